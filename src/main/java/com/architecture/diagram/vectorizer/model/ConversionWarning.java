package com.architecture.diagram.vectorizer.model;

import lombok.Value;

/**
 * A non-fatal problem found while building a diagram. The affected element was either
 * dropped or degraded; the conversion itself succeeded.
 */
@Value
public class ConversionWarning {

    WarningType type;
    String elementId;
    String message;

    public static ConversionWarning unresolvedBinding(String elementId, String message) {
        return new ConversionWarning(WarningType.UNRESOLVED_BINDING, elementId, message);
    }

    public static ConversionWarning unsupportedShape(String elementId, String message) {
        return new ConversionWarning(WarningType.UNSUPPORTED_SHAPE, elementId, message);
    }
}
