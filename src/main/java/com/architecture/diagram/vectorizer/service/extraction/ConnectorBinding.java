package com.architecture.diagram.vectorizer.service.extraction;

import lombok.Value;

/**
 * Resolved raw element ids at each end of a connector; either side may be null.
 */
@Value
public class ConnectorBinding {

    String startId;
    String endId;

    public boolean isResolved() {
        return startId != null && endId != null;
    }
}
