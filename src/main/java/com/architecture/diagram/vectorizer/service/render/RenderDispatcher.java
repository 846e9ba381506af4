package com.architecture.diagram.vectorizer.service.render;

import com.architecture.diagram.vectorizer.exception.DiagramSchemaException;
import com.architecture.diagram.vectorizer.exception.UnknownFormatException;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.service.diagram.DiagramValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a Diagram to the emitter for the requested format under the resolved layout policy.
 *
 * The layout defaults per format: structural for mermaid and graphviz, positional for drawio
 * and svg. The diagram's invariants are checked before any emitter sees it.
 */
@Service
@Slf4j
public class RenderDispatcher {

    private final Map<OutputFormat, FormatEmitter> emitters = new EnumMap<>(OutputFormat.class);
    private final DiagramValidator diagramValidator;

    public RenderDispatcher(List<FormatEmitter> emitters, DiagramValidator diagramValidator) {
        for (FormatEmitter emitter : emitters) {
            this.emitters.put(emitter.format(), emitter);
        }
        this.diagramValidator = diagramValidator;
    }

    /**
     * Render with the format's default layout.
     */
    public String render(Diagram diagram, String format) {
        return render(diagram, format, null);
    }

    /**
     * Render one format.
     *
     * @param layout structural/positional, or null for the format default
     * @throws UnknownFormatException when the format is not supported
     * @throws DiagramSchemaException when the diagram violates its invariants
     */
    public String render(Diagram diagram, String format, String layout) {
        OutputFormat outputFormat = OutputFormat.fromString(format);
        LayoutMode requested = LayoutMode.fromString(layout);
        return render(diagram, outputFormat, requested);
    }

    public String render(Diagram diagram, OutputFormat format, LayoutMode layoutMode) {
        FormatEmitter emitter = emitters.get(format);
        if (emitter == null) {
            throw new UnknownFormatException(format.getKey());
        }
        diagramValidator.verify(diagram);

        LayoutMode resolved = layoutMode != null ? layoutMode : format.getDefaultLayout();
        log.debug("Rendering {} nodes, {} edges as {} ({})",
                diagram.getNodes().size(), diagram.getEdges().size(), format.getKey(), resolved.getValue());
        return emitter.emit(diagram, resolved);
    }

    /**
     * Render several formats independently. A failing format is reported in the outcome's errors
     * and does not affect the others.
     */
    public RenderOutcome renderAll(Diagram diagram, List<String> formats, String layout) {
        Map<String, String> outputs = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (String format : formats) {
            try {
                outputs.put(format, render(diagram, format, layout));
            } catch (UnknownFormatException | DiagramSchemaException e) {
                log.warn("Render to '{}' failed: {}", format, e.getMessage());
                errors.put(format, e.getMessage());
            }
        }
        return new RenderOutcome(Collections.unmodifiableMap(outputs), Collections.unmodifiableMap(errors));
    }

    public List<OutputFormat> supportedFormats() {
        return List.copyOf(emitters.keySet());
    }
}
