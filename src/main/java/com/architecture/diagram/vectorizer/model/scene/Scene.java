package com.architecture.diagram.vectorizer.model.scene;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validated raw scene: typed elements in source encounter order, indexed by raw id.
 */
@Getter
public class Scene {

    private final List<SceneElement> elements;
    private final Map<String, SceneElement> elementsById;

    public Scene(List<SceneElement> elements) {
        this.elements = List.copyOf(elements);
        Map<String, SceneElement> byId = new LinkedHashMap<>();
        for (SceneElement element : this.elements) {
            byId.putIfAbsent(element.getId(), element);
        }
        this.elementsById = Collections.unmodifiableMap(byId);
    }

    public List<ShapeElement> shapes() {
        return ofType(ShapeElement.class);
    }

    public List<TextElement> texts() {
        return ofType(TextElement.class);
    }

    public List<ConnectorElement> connectors() {
        return ofType(ConnectorElement.class);
    }

    public List<FrameElement> frames() {
        return ofType(FrameElement.class);
    }

    public SceneElement find(String id) {
        return id == null ? null : elementsById.get(id);
    }

    private <T extends SceneElement> List<T> ofType(Class<T> type) {
        return elements.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
