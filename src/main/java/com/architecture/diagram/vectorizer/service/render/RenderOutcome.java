package com.architecture.diagram.vectorizer.service.render;

import lombok.Value;

import java.util.Map;

/**
 * Outputs of a multi-format render: successful texts and per-format failures, both keyed by
 * the requested format name in request order.
 */
@Value
public class RenderOutcome {
    Map<String, String> outputs;
    Map<String, String> errors;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
