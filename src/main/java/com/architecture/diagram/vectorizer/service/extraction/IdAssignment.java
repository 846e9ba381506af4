package com.architecture.diagram.vectorizer.service.extraction;

import lombok.Value;

/**
 * Result of one identifier assignment: the new id and the registry that now includes it.
 */
@Value
public class IdAssignment {
    String id;
    IdRegistry registry;
}
