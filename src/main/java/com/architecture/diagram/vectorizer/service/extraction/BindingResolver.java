package com.architecture.diagram.vectorizer.service.extraction;

import com.architecture.diagram.vectorizer.model.scene.ConnectorElement;
import com.architecture.diagram.vectorizer.model.scene.ElementKind;
import com.architecture.diagram.vectorizer.model.scene.FrameElement;
import com.architecture.diagram.vectorizer.model.scene.Point;
import com.architecture.diagram.vectorizer.model.scene.Scene;
import com.architecture.diagram.vectorizer.model.scene.SceneElement;
import com.architecture.diagram.vectorizer.model.scene.ShapeElement;
import com.architecture.diagram.vectorizer.model.scene.TextElement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves implicit relationships of a raw scene:
 * 1. Text -> container (shape or connector)
 * 2. Connector endpoints -> shapes
 * 3. Element -> frames
 *
 * An explicit reference that names an element present in the scene always wins, even if that
 * element is deleted; the extraction pipeline decides what survives. Without one, geometry decides.
 * Resolution never throws: anything that cannot be resolved is recorded in the result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BindingResolver {

    private final BindingThresholds thresholds;

    public BindingResolution resolve(Scene scene) {
        List<ShapeElement> liveShapes = scene.shapes().stream()
                .filter(SceneElement::isLive)
                .collect(Collectors.toList());
        List<FrameElement> liveFrames = scene.frames().stream()
                .filter(SceneElement::isLive)
                .collect(Collectors.toList());

        // Explicitly bound text is listed before text attached by geometry
        Map<String, List<String>> boundTexts = new LinkedHashMap<>();
        Map<String, List<String>> containedTexts = new LinkedHashMap<>();
        Set<String> unattachedTexts = new LinkedHashSet<>();
        for (TextElement text : scene.texts()) {
            if (text.isDeleted()) {
                continue;
            }
            Optional<String> explicit = explicitTextContainer(text, scene);
            if (explicit.isPresent()) {
                boundTexts.computeIfAbsent(explicit.get(), key -> new ArrayList<>()).add(text.getText());
                continue;
            }
            Optional<String> container = GeometryHeuristics.smallestContaining(text.getBounds().centroid(), liveShapes);
            if (container.isPresent()) {
                containedTexts.computeIfAbsent(container.get(), key -> new ArrayList<>()).add(text.getText());
            } else {
                log.debug("Text {} is not attached to any shape", text.getId());
                unattachedTexts.add(text.getId());
            }
        }
        Map<String, List<String>> containerTexts = new LinkedHashMap<>(boundTexts);
        containedTexts.forEach((containerId, texts) ->
                containerTexts.computeIfAbsent(containerId, key -> new ArrayList<>()).addAll(texts));

        Map<String, ConnectorBinding> connectorBindings = new LinkedHashMap<>();
        Set<String> unresolvedConnectors = new LinkedHashSet<>();
        for (ConnectorElement connector : scene.connectors()) {
            if (connector.isDeleted()) {
                continue;
            }
            String start = resolveEndpoint(connector.getStartRef(), connector.getStartPoint(), scene, liveShapes);
            String end = resolveEndpoint(connector.getEndRef(), connector.getEndPoint(), scene, liveShapes);
            ConnectorBinding binding = new ConnectorBinding(start, end);
            connectorBindings.put(connector.getId(), binding);
            if (!binding.isResolved()) {
                log.debug("Connector {} unresolved (start={}, end={})", connector.getId(), start, end);
                unresolvedConnectors.add(connector.getId());
            }
        }

        Map<String, List<String>> elementFrames = new LinkedHashMap<>();
        for (SceneElement element : scene.getElements()) {
            if (element.isDeleted() || element.getKind() == ElementKind.FRAME) {
                continue;
            }
            List<String> frames = resolveFrames(element, scene, liveFrames);
            if (!frames.isEmpty()) {
                elementFrames.put(element.getId(), frames);
            }
        }

        return BindingResolution.builder()
                .containerTexts(containerTexts)
                .connectorBindings(connectorBindings)
                .elementFrames(elementFrames)
                .unattachedTexts(Collections.unmodifiableSet(unattachedTexts))
                .unresolvedConnectors(Collections.unmodifiableSet(unresolvedConnectors))
                .build();
    }

    private Optional<String> explicitTextContainer(TextElement text, Scene scene) {
        SceneElement explicit = scene.find(text.getContainerRef());
        if (explicit != null
                && (explicit.getKind() == ElementKind.SHAPE || explicit.getKind() == ElementKind.CONNECTOR)) {
            return Optional.of(explicit.getId());
        }
        if (text.getContainerRef() != null) {
            log.debug("Text {} names unknown container {}, falling back to geometry",
                    text.getId(), text.getContainerRef());
        }
        return Optional.empty();
    }

    private String resolveEndpoint(String ref, Point point, Scene scene, List<ShapeElement> liveShapes) {
        SceneElement explicit = scene.find(ref);
        if (explicit != null) {
            return explicit.getKind() == ElementKind.SHAPE ? explicit.getId() : null;
        }
        if (point == null) {
            return null;
        }
        return GeometryHeuristics.nearestWithin(point, liveShapes, thresholds.getConnectorProximity()).orElse(null);
    }

    private List<String> resolveFrames(SceneElement element, Scene scene, List<FrameElement> liveFrames) {
        SceneElement explicit = scene.find(element.getFrameRef());
        if (explicit != null && explicit.getKind() == ElementKind.FRAME) {
            return List.of(explicit.getId());
        }
        return GeometryHeuristics.enclosing(element.getBounds(), liveFrames, thresholds.getFrameContainmentSlack());
    }
}
