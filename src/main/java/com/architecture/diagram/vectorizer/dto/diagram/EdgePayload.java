package com.architecture.diagram.vectorizer.dto.diagram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EdgePayload {

    private String id;
    private String from;
    private String to;
    private String type;        // arrow, line
    private String label;
    private StylePayload style;
    private Double confidence;
}
