package com.architecture.diagram.vectorizer.dto.diagram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Style block shared by node and edge payloads; each side reads the keys it understands.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StylePayload {

    private String fillColor;
    private String strokeColor;
    private Double strokeWidth;
    private String strokeStyle;     // solid, dashed, dotted
}
