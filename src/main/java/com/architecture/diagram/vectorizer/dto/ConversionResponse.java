package com.architecture.diagram.vectorizer.dto;

import com.architecture.diagram.vectorizer.model.ConversionWarning;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.service.extraction.ExtractionSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Result of converting one diagram. When {@code error} is set the item failed as a whole and
 * carries no diagram or outputs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResponse {

    private String name;
    private Diagram diagram;
    private ExtractionSummary summary;     // Only for scene input
    private Map<String, String> outputs;   // format -> rendered text
    private Map<String, String> errors;    // format -> failure message
    private List<ConversionWarning> warnings;
    private String error;
}
