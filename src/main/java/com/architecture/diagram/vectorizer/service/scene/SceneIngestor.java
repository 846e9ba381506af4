package com.architecture.diagram.vectorizer.service.scene;

import com.architecture.diagram.vectorizer.dto.scene.BindingPayload;
import com.architecture.diagram.vectorizer.dto.scene.SceneElementPayload;
import com.architecture.diagram.vectorizer.dto.scene.ScenePayload;
import com.architecture.diagram.vectorizer.model.diagram.StrokeStyle;
import com.architecture.diagram.vectorizer.model.scene.Bounds;
import com.architecture.diagram.vectorizer.model.scene.ConnectorElement;
import com.architecture.diagram.vectorizer.model.scene.FrameElement;
import com.architecture.diagram.vectorizer.model.scene.Point;
import com.architecture.diagram.vectorizer.model.scene.Scene;
import com.architecture.diagram.vectorizer.model.scene.SceneElement;
import com.architecture.diagram.vectorizer.model.scene.ShapeElement;
import com.architecture.diagram.vectorizer.model.scene.TextElement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validates a loosely-typed raw scene once into the closed set of typed elements
 * (shape, text, connector, frame). Downstream passes only see the typed variants.
 *
 * Kind mapping:
 * - text -> TextElement
 * - arrow, line -> ConnectorElement
 * - frame, magicframe -> FrameElement
 * - anything else -> ShapeElement (the raw type is kept for shape mapping)
 */
@Service
@Slf4j
public class SceneIngestor {

    private static final String TRANSPARENT = "transparent";

    public Scene ingest(ScenePayload payload) {
        List<SceneElement> elements = new ArrayList<>();
        if (payload == null || payload.getElements() == null) {
            return new Scene(elements);
        }

        Set<String> seenIds = new HashSet<>();
        int position = 0;
        for (SceneElementPayload raw : payload.getElements()) {
            position++;
            if (raw == null) {
                continue;
            }
            if (raw.getId() == null || raw.getId().isBlank()) {
                log.warn("Skipping scene element #{} of type {} without an id", position, raw.getType());
                continue;
            }
            if (!seenIds.add(raw.getId())) {
                log.warn("Skipping duplicate scene element id: {}", raw.getId());
                continue;
            }
            elements.add(toElement(raw));
        }

        log.debug("Ingested {} scene elements", elements.size());
        return new Scene(elements);
    }

    private SceneElement toElement(SceneElementPayload raw) {
        String type = raw.getType() != null ? raw.getType().trim().toLowerCase(Locale.ROOT) : "";
        Bounds bounds = Bounds.of(value(raw.getX()), value(raw.getY()), value(raw.getWidth()), value(raw.getHeight()));
        String frameRef = blankToNull(raw.getFrameId());

        switch (type) {
            case "text":
                return TextElement.builder()
                        .id(raw.getId())
                        .deleted(raw.isDeleted())
                        .bounds(bounds)
                        .frameRef(frameRef)
                        .text(raw.getText() != null ? raw.getText() : "")
                        .containerRef(blankToNull(raw.getContainerId()))
                        .build();
            case "arrow":
            case "line":
                return toConnector(raw, type, bounds, frameRef);
            case "frame":
            case "magicframe":
                return FrameElement.builder()
                        .id(raw.getId())
                        .deleted(raw.isDeleted())
                        .bounds(bounds)
                        .frameRef(frameRef)
                        .name(raw.getName())
                        .build();
            default:
                String fill = raw.getBackgroundColor();
                return ShapeElement.builder()
                        .id(raw.getId())
                        .deleted(raw.isDeleted())
                        .bounds(bounds)
                        .frameRef(frameRef)
                        .rawType(type)
                        .text(raw.getText())
                        .fillColor(fill != null && !fill.isBlank() && !TRANSPARENT.equalsIgnoreCase(fill) ? fill : null)
                        .strokeColor(blankToNull(raw.getStrokeColor()))
                        .strokeWidth(raw.getStrokeWidth())
                        .build();
        }
    }

    private ConnectorElement toConnector(SceneElementPayload raw, String type, Bounds bounds, String frameRef) {
        double originX = value(raw.getX());
        double originY = value(raw.getY());
        Point start;
        Point end;

        List<List<Double>> points = raw.getPoints();
        List<Point> absolute = new ArrayList<>();
        if (points != null) {
            for (List<Double> point : points) {
                if (point != null && point.size() >= 2 && point.get(0) != null && point.get(1) != null) {
                    absolute.add(new Point(originX + point.get(0), originY + point.get(1)));
                }
            }
        }
        if (absolute.size() >= 2) {
            start = absolute.get(0);
            end = absolute.get(absolute.size() - 1);
        } else {
            // No usable polyline: assume a straight stroke across the raw box
            start = new Point(originX, originY);
            end = new Point(originX + value(raw.getWidth()), originY + value(raw.getHeight()));
        }

        return ConnectorElement.builder()
                .id(raw.getId())
                .deleted(raw.isDeleted())
                .bounds(bounds)
                .frameRef(frameRef)
                .arrow("arrow".equals(type))
                .startRef(bindingRef(raw.getStartBinding()))
                .endRef(bindingRef(raw.getEndBinding()))
                .startPoint(start)
                .endPoint(end)
                .strokeStyle(StrokeStyle.fromString(raw.getStrokeStyle()))
                .build();
    }

    private String bindingRef(BindingPayload binding) {
        return binding != null ? blankToNull(binding.getElementId()) : null;
    }

    private double value(Double number) {
        return number != null && !number.isNaN() && !number.isInfinite() ? number : 0;
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
