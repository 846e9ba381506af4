package com.architecture.diagram.vectorizer.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Generates stable, deterministic identifiers for diagram nodes, edges and groups.
 *
 * Identifiers are:
 * - Deterministic: the same labels in the same encounter order always produce the same ids
 * - Grammar-neutral: lower-case snake_case tokens valid in every output format
 * - Collision-safe: never reuse an id already present in the registry
 *
 * Format Rules:
 * - Node / Group: {normalizedLabel}, then {normalizedLabel}_{context}, then numeric suffix
 * - Edge: {fromId}_to_{toId}, then numeric suffix for parallel edges
 *
 * The registry of assigned ids is passed in and returned with every assignment.
 */
@Service
@Slf4j
public class IdentifierAssigner {

    static final String EMPTY_TOKEN = "node";

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    /**
     * Assign an id for {@code label}. On collision, try the label qualified with the
     * normalized {@code context} (may be null), then numeric suffixes starting at 2.
     */
    public IdAssignment assign(String label, String context, IdRegistry registry) {
        String base = normalize(label);
        if (!registry.contains(base)) {
            return accept(base, registry);
        }

        String qualified = qualify(base, context);
        if (qualified != null && !registry.contains(qualified)) {
            log.debug("Identifier '{}' taken, using context-qualified '{}'", base, qualified);
            return accept(qualified, registry);
        }

        return accept(withNumericSuffix(qualified != null ? qualified : base, registry), registry);
    }

    /**
     * Assign an id that is qualified with {@code context} from the start. Used when the
     * caller already knows the plain label is ambiguous within the diagram.
     * Falls back to {@link #assign} when there is no context.
     */
    public IdAssignment assignQualified(String label, String context, IdRegistry registry) {
        String qualified = qualify(normalize(label), context);
        if (qualified == null) {
            return assign(label, null, registry);
        }
        if (!registry.contains(qualified)) {
            return accept(qualified, registry);
        }
        return accept(withNumericSuffix(qualified, registry), registry);
    }

    /**
     * Assign an edge id. Format: {from}_to_{to}, with numeric suffixes for parallel edges.
     */
    public IdAssignment assignEdge(String fromId, String toId, IdRegistry registry) {
        String base = String.format("%s_to_%s", fromId, toId);
        if (!registry.contains(base)) {
            return accept(base, registry);
        }
        return accept(withNumericSuffix(base, registry), registry);
    }

    /**
     * Normalize a label into a grammar-neutral token.
     * Examples:
     * - "Process Data" -> "process_data"
     * - "  API -- Gateway!! " -> "api_gateway"
     * - "3rd Party" -> "node_3rd_party"
     * - "" or "???" -> "node"
     */
    public String normalize(String label) {
        if (label == null) {
            return EMPTY_TOKEN;
        }
        String token = NON_ALPHANUMERIC.matcher(label.toLowerCase(Locale.ROOT)).replaceAll("_");
        token = EDGE_UNDERSCORES.matcher(token).replaceAll("");
        if (token.isEmpty()) {
            return EMPTY_TOKEN;
        }
        if (Character.isDigit(token.charAt(0))) {
            return EMPTY_TOKEN + "_" + token;
        }
        return token;
    }

    private String qualify(String base, String context) {
        if (context == null || context.isBlank()) {
            return null;
        }
        String suffix = NON_ALPHANUMERIC.matcher(context.toLowerCase(Locale.ROOT)).replaceAll("_");
        suffix = EDGE_UNDERSCORES.matcher(suffix).replaceAll("");
        if (suffix.isEmpty()) {
            return null;
        }
        return base + "_" + suffix;
    }

    private String withNumericSuffix(String base, IdRegistry registry) {
        int counter = 2;
        String candidate = base + "_" + counter;
        while (registry.contains(candidate)) {
            counter++;
            candidate = base + "_" + counter;
        }
        log.debug("Identifier '{}' taken, using '{}'", base, candidate);
        return candidate;
    }

    private IdAssignment accept(String id, IdRegistry registry) {
        return new IdAssignment(id, registry.with(id));
    }
}
