package com.architecture.diagram.vectorizer.service.extraction;

import lombok.Builder;
import lombok.Value;

/**
 * Tunable tolerances for geometric binding fallback, in scene units.
 */
@Value
@Builder
public class BindingThresholds {

    public static final double DEFAULT_CONNECTOR_PROXIMITY = 20;
    public static final double DEFAULT_FRAME_CONTAINMENT_SLACK = 0;

    /** Maximum distance from a connector endpoint to a shape boundary. */
    @Builder.Default
    double connectorProximity = DEFAULT_CONNECTOR_PROXIMITY;

    /** Overhang allowed when testing that an element lies inside a frame. */
    @Builder.Default
    double frameContainmentSlack = DEFAULT_FRAME_CONTAINMENT_SLACK;

    public static BindingThresholds defaults() {
        return BindingThresholds.builder().build();
    }
}
