package com.architecture.diagram.vectorizer.service.diagram;

import com.architecture.diagram.vectorizer.model.ConversionWarning;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import lombok.Value;

import java.util.List;

@Value
public class ValidatedDiagram {
    Diagram diagram;
    List<ConversionWarning> warnings;
}
