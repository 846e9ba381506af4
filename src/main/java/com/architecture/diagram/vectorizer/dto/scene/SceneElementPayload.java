package com.architecture.diagram.vectorizer.dto.scene;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One raw element of a scene. Which fields are meaningful depends on {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SceneElementPayload {

    private String id;
    private String type;            // rectangle, ellipse, diamond, text, arrow, line, frame, ...
    @JsonProperty("isDeleted")
    private boolean deleted;
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private String backgroundColor;
    private String strokeColor;
    private Double strokeWidth;
    private String strokeStyle;
    private String text;
    private String containerId;
    private String frameId;
    private String name;
    private BindingPayload startBinding;
    private BindingPayload endBinding;
    private List<List<Double>> points;  // Relative to (x, y)
}
