package com.architecture.diagram.vectorizer.service.extraction;

import com.architecture.diagram.vectorizer.model.scene.Bounds;
import com.architecture.diagram.vectorizer.model.scene.Point;
import com.architecture.diagram.vectorizer.model.scene.SceneElement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pure geometric fallbacks used when a raw element carries no explicit binding.
 * Candidates are always considered in encounter order; ties go to the earlier candidate.
 */
final class GeometryHeuristics {

    private GeometryHeuristics() {
    }

    /**
     * Smallest-area candidate whose bounds contain {@code point}.
     */
    static Optional<String> smallestContaining(Point point, List<? extends SceneElement> candidates) {
        SceneElement best = null;
        for (SceneElement candidate : candidates) {
            if (!candidate.getBounds().contains(point)) {
                continue;
            }
            if (best == null || candidate.getBounds().area() < best.getBounds().area()) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best).map(SceneElement::getId);
    }

    /**
     * Candidate whose boundary is nearest to {@code point}, if within {@code tolerance}.
     * A point inside candidates binds to the smallest of them; otherwise equally near
     * candidates break by encounter order.
     */
    static Optional<String> nearestWithin(Point point, List<? extends SceneElement> candidates, double tolerance) {
        Optional<String> containing = smallestContaining(point, candidates);
        if (containing.isPresent()) {
            return containing;
        }
        SceneElement best = null;
        double bestDistance = Double.MAX_VALUE;
        for (SceneElement candidate : candidates) {
            double distance = candidate.getBounds().distanceTo(point);
            if (distance <= tolerance && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best).map(SceneElement::getId);
    }

    /**
     * All candidates that fully enclose {@code bounds}, smallest first.
     */
    static List<String> enclosing(Bounds bounds, List<? extends SceneElement> candidates, double slack) {
        List<SceneElement> matches = new ArrayList<>();
        for (SceneElement candidate : candidates) {
            if (candidate.getBounds().encloses(bounds, slack)) {
                matches.add(candidate);
            }
        }
        // List.sort is stable, so equal areas keep encounter order
        matches.sort(Comparator.comparingDouble(candidate -> candidate.getBounds().area()));
        return matches.stream().map(SceneElement::getId).collect(Collectors.toList());
    }
}
