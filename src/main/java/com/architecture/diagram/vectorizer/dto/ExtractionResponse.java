package com.architecture.diagram.vectorizer.dto;

import com.architecture.diagram.vectorizer.model.ConversionWarning;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.service.extraction.ExtractionSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResponse {

    private Diagram diagram;
    private ExtractionSummary summary;
    private List<ConversionWarning> warnings;
}
