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
public class NodePayload {

    private String id;
    private String type;
    private String label;
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private StylePayload style;
    private Double confidence;
}
