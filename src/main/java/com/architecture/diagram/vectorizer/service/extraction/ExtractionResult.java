package com.architecture.diagram.vectorizer.service.extraction;

import com.architecture.diagram.vectorizer.model.ConversionWarning;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import lombok.Value;

import java.util.List;

@Value
public class ExtractionResult {
    Diagram diagram;
    ExtractionSummary summary;
    List<ConversionWarning> warnings;
}
