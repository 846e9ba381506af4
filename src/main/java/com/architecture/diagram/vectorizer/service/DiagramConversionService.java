package com.architecture.diagram.vectorizer.service;

import com.architecture.diagram.vectorizer.dto.ConversionRequest;
import com.architecture.diagram.vectorizer.dto.ConversionResponse;
import com.architecture.diagram.vectorizer.dto.diagram.DiagramPayload;
import com.architecture.diagram.vectorizer.dto.scene.ScenePayload;
import com.architecture.diagram.vectorizer.exception.DiagramSchemaException;
import com.architecture.diagram.vectorizer.model.ConversionWarning;
import com.architecture.diagram.vectorizer.model.diagram.Diagram;
import com.architecture.diagram.vectorizer.service.diagram.DiagramValidator;
import com.architecture.diagram.vectorizer.service.diagram.ValidatedDiagram;
import com.architecture.diagram.vectorizer.service.extraction.ExtractionPipeline;
import com.architecture.diagram.vectorizer.service.extraction.ExtractionResult;
import com.architecture.diagram.vectorizer.service.extraction.ExtractionSummary;
import com.architecture.diagram.vectorizer.service.render.LayoutMode;
import com.architecture.diagram.vectorizer.service.render.RenderDispatcher;
import com.architecture.diagram.vectorizer.service.render.RenderOutcome;
import com.architecture.diagram.vectorizer.service.scene.SceneIngestor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point combining the two input paths with rendering:
 * - raw scene -> ingest -> extraction pipeline -> Diagram
 * - diagram JSON -> validation -> Diagram
 * followed by rendering to any number of formats.
 *
 * In a batch, each item succeeds or fails on its own; a schema error in one item is reported
 * on that item and processing continues with the next.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagramConversionService {

    private final SceneIngestor sceneIngestor;
    private final ExtractionPipeline extractionPipeline;
    private final DiagramValidator diagramValidator;
    private final RenderDispatcher renderDispatcher;

    public ExtractionResult extract(ScenePayload scene) {
        return extractionPipeline.extract(sceneIngestor.ingest(scene));
    }

    public ValidatedDiagram validate(DiagramPayload payload) {
        return diagramValidator.validate(payload);
    }

    /**
     * Validate diagram JSON and render it to one format.
     */
    public String render(DiagramPayload payload, String format, String layout) {
        Diagram diagram = diagramValidator.validate(payload).getDiagram();
        return renderDispatcher.render(diagram, format, layout);
    }

    /**
     * Convert one request to the given formats.
     *
     * @throws DiagramSchemaException when the input cannot become a valid Diagram
     */
    public ConversionResponse convert(ConversionRequest request, List<String> formats, String layout) {
        if (request == null || (request.getScene() == null) == (request.getDiagram() == null)) {
            throw new DiagramSchemaException("Conversion request must contain exactly one of 'scene' or 'diagram'");
        }

        Diagram diagram;
        ExtractionSummary summary = null;
        List<ConversionWarning> warnings;
        if (request.getScene() != null) {
            ExtractionResult result = extract(request.getScene());
            diagram = result.getDiagram();
            if (request.getTitle() != null && !request.getTitle().isBlank()) {
                diagram = diagram.toBuilder().title(request.getTitle()).build();
            }
            summary = result.getSummary();
            warnings = result.getWarnings();
        } else {
            ValidatedDiagram validated = diagramValidator.validate(request.getDiagram());
            diagram = validated.getDiagram();
            warnings = validated.getWarnings();
        }

        RenderOutcome outcome = renderDispatcher.renderAll(diagram, formats, layout);
        return ConversionResponse.builder()
                .name(request.getName())
                .diagram(diagram)
                .summary(summary)
                .outputs(outcome.getOutputs())
                .errors(outcome.getErrors())
                .warnings(warnings)
                .build();
    }

    /**
     * Convert every request independently. Items with schema errors are returned with
     * {@code error} set; the remaining items are unaffected.
     */
    public List<ConversionResponse> convertBatch(List<ConversionRequest> requests, List<String> formats, String layout) {
        // Layout is shared by all items, so a bad name fails the whole request up front
        LayoutMode.fromString(layout);

        List<ConversionResponse> responses = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < requests.size(); i++) {
            ConversionRequest request = requests.get(i);
            try {
                responses.add(convert(request, formats, layout));
            } catch (DiagramSchemaException e) {
                failed++;
                String name = request != null && request.getName() != null ? request.getName() : "#" + (i + 1);
                log.warn("Batch item {} failed: {}", name, e.getMessage());
                responses.add(ConversionResponse.builder()
                        .name(request != null ? request.getName() : null)
                        .error(e.getMessage())
                        .build());
            }
        }
        log.info("Converted batch of {} diagrams ({} failed)", requests.size(), failed);
        return responses;
    }
}
