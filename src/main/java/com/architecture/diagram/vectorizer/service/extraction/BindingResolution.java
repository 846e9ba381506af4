package com.architecture.diagram.vectorizer.service.extraction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-raw-id lookup produced by the {@link BindingResolver}.
 * Unattached text and unresolved connectors are recorded rather than dropped silently.
 */
@Value
@Builder
public class BindingResolution {

    /** Container raw id -> text contents; explicitly bound text first, then contained text, each in encounter order. */
    @Singular
    Map<String, List<String>> containerTexts;

    /** Connector raw id -> resolved endpoints. */
    @Singular
    Map<String, ConnectorBinding> connectorBindings;

    /** Element raw id -> frame raw ids, nearest (smallest) frame first. */
    @Singular
    Map<String, List<String>> elementFrames;

    Set<String> unattachedTexts;
    Set<String> unresolvedConnectors;

    /**
     * Label text of the container, stripped; empty when none.
     */
    public String labelFor(String containerId) {
        List<String> texts = containerTexts.get(containerId);
        if (texts == null || texts.isEmpty()) {
            return "";
        }
        return texts.get(0).strip();
    }

    public Optional<ConnectorBinding> bindingFor(String connectorId) {
        return Optional.ofNullable(connectorBindings.get(connectorId));
    }

    public List<String> framesOf(String elementId) {
        return elementFrames.getOrDefault(elementId, Collections.emptyList());
    }

    /**
     * Nearest enclosing frame id, if any.
     */
    public Optional<String> nearestFrameOf(String elementId) {
        List<String> frames = framesOf(elementId);
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(0));
    }
}
