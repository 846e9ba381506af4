package com.architecture.diagram.vectorizer.controller;

import com.architecture.diagram.vectorizer.exception.DiagramSchemaException;
import com.architecture.diagram.vectorizer.exception.UnknownFormatException;
import com.architecture.diagram.vectorizer.exception.UnknownLayoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DiagramSchemaException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleSchemaError(DiagramSchemaException e) {
        log.warn("Rejected diagram: {}", e.getMessage());
        return Map.of(
                "error", "SCHEMA_ERROR",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(UnknownFormatException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownFormat(UnknownFormatException e) {
        return Map.of(
                "error", "UNKNOWN_FORMAT",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(UnknownLayoutException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownLayout(UnknownLayoutException e) {
        return Map.of(
                "error", "UNKNOWN_LAYOUT",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(HttpMessageNotReadableException e) {
        return Map.of(
                "error", "SCHEMA_ERROR",
                "message", "Request body is not valid JSON for this endpoint"
        );
    }
}
