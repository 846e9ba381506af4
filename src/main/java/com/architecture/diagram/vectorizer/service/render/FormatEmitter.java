package com.architecture.diagram.vectorizer.service.render;

import com.architecture.diagram.vectorizer.model.diagram.Diagram;

/**
 * Serializes a Diagram into one output grammar.
 *
 * Implementations are pure: no side effects, and byte-identical output for identical input.
 * Every node and edge appears at least once, every group maps to the grammar's native grouping
 * construct, label text is escaped per the grammar, and unordered attribute blocks are key-sorted.
 */
public interface FormatEmitter {

    OutputFormat format();

    String emit(Diagram diagram, LayoutMode layoutMode);
}
