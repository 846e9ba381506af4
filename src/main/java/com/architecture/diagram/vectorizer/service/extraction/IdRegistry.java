package com.architecture.diagram.vectorizer.service.extraction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set of identifiers already handed out within one diagram.
 * Threaded through {@link IdentifierAssigner} calls as an explicit accumulator.
 */
public final class IdRegistry {

    private static final IdRegistry EMPTY = new IdRegistry(Collections.emptySet());

    private final Set<String> ids;

    private IdRegistry(Set<String> ids) {
        this.ids = ids;
    }

    public static IdRegistry empty() {
        return EMPTY;
    }

    public static IdRegistry of(Set<String> ids) {
        return new IdRegistry(Collections.unmodifiableSet(new LinkedHashSet<>(ids)));
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public IdRegistry with(String id) {
        Set<String> next = new LinkedHashSet<>(ids);
        next.add(id);
        return new IdRegistry(Collections.unmodifiableSet(next));
    }

    public Set<String> asSet() {
        return ids;
    }

    public int size() {
        return ids.size();
    }
}
