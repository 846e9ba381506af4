package com.architecture.diagram.vectorizer.dto;

import com.architecture.diagram.vectorizer.dto.diagram.DiagramPayload;
import com.architecture.diagram.vectorizer.dto.scene.ScenePayload;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One diagram to convert. Exactly one of {@code scene} (raw drawing) or {@code diagram}
 * (Intermediate Model JSON, e.g. from a vision model) must be set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversionRequest {

    private String name;            // Caller's label for the item, echoed in the response
    private String title;           // Optional title applied to a diagram extracted from a scene
    private ScenePayload scene;
    private DiagramPayload diagram;
}
