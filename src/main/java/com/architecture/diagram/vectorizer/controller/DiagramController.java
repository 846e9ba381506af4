package com.architecture.diagram.vectorizer.controller;

import com.architecture.diagram.vectorizer.dto.ConversionRequest;
import com.architecture.diagram.vectorizer.dto.ConversionResponse;
import com.architecture.diagram.vectorizer.dto.ExtractionResponse;
import com.architecture.diagram.vectorizer.dto.FormatInfo;
import com.architecture.diagram.vectorizer.dto.diagram.DiagramPayload;
import com.architecture.diagram.vectorizer.dto.scene.ScenePayload;
import com.architecture.diagram.vectorizer.service.DiagramConversionService;
import com.architecture.diagram.vectorizer.service.extraction.ExtractionResult;
import com.architecture.diagram.vectorizer.service.render.OutputFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for diagram extraction and conversion.
 */
@RestController
@RequestMapping("/api/diagrams")
@RequiredArgsConstructor
@Slf4j
public class DiagramController {

    private final DiagramConversionService conversionService;

    /**
     * List supported output formats with their default layout and file extension.
     */
    @GetMapping("/formats")
    public ResponseEntity<List<FormatInfo>> getFormats() {
        List<FormatInfo> formats = Arrays.stream(OutputFormat.values())
                .map(format -> FormatInfo.builder()
                        .format(format.getKey())
                        .defaultLayout(format.getDefaultLayout().getValue())
                        .extension(format.getExtension())
                        .build())
                .collect(Collectors.toList());
        return ResponseEntity.ok(formats);
    }

    /**
     * Extract a Diagram from a raw scene.
     */
    @PostMapping("/extract")
    public ResponseEntity<ExtractionResponse> extract(@RequestBody ScenePayload scene) {
        log.info("Extracting diagram from scene with {} elements",
                scene.getElements() != null ? scene.getElements().size() : 0);

        ExtractionResult result = conversionService.extract(scene);
        return ResponseEntity.ok(ExtractionResponse.builder()
                .diagram(result.getDiagram())
                .summary(result.getSummary())
                .warnings(result.getWarnings())
                .build());
    }

    /**
     * Render diagram JSON to one format.
     *
     * @param format mermaid, graphviz, drawio or svg (aliases mmd, dot, xml)
     * @param layout structural or positional; defaults per format
     */
    @PostMapping("/render")
    public ResponseEntity<String> render(
            @RequestBody DiagramPayload diagram,
            @RequestParam String format,
            @RequestParam(required = false) String layout) {
        log.info("Rendering diagram to format: {}, layout: {}", format, layout);

        String output = conversionService.render(diagram, format, layout);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(output);
    }

    /**
     * Convert a scene or diagram to one or more formats.
     */
    @PostMapping("/convert")
    public ResponseEntity<ConversionResponse> convert(
            @RequestBody ConversionRequest request,
            @RequestParam(defaultValue = "mermaid") List<String> formats,
            @RequestParam(required = false) String layout) {
        log.info("Converting diagram to formats: {}, layout: {}", formats, layout);

        return ResponseEntity.ok(conversionService.convert(request, formats, layout));
    }

    /**
     * Convert several scenes or diagrams; a failing item does not abort the others.
     */
    @PostMapping("/convert/batch")
    public ResponseEntity<List<ConversionResponse>> convertBatch(
            @RequestBody List<ConversionRequest> requests,
            @RequestParam(defaultValue = "mermaid") List<String> formats,
            @RequestParam(required = false) String layout) {
        log.info("Converting batch of {} diagrams to formats: {}", requests.size(), formats);

        return ResponseEntity.ok(conversionService.convertBatch(requests, formats, layout));
    }
}
