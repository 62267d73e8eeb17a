package com.familygraph.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one layout run, threaded through the recursive placement
 * and discarded once positions are emitted. Never shared between runs.
 */
public final class LayoutContext {

    private final RelationshipIndex index;
    private final Set<String> knownPersons;
    private final double spacingX;
    private final double spacingY;
    private final Set<String> visited = new LinkedHashSet<>();
    private final Map<String, Placement> placements = new LinkedHashMap<>();

    public LayoutContext(RelationshipIndex index, Set<String> knownPersons, double spacingX, double spacingY) {
        this.index = index;
        this.knownPersons = knownPersons;
        this.spacingX = spacingX;
        this.spacingY = spacingY;
    }

    public RelationshipIndex index() {
        return index;
    }

    public double spacingX() {
        return spacingX;
    }

    public double spacingY() {
        return spacingY;
    }

    /**
     * Relationship records may name ids missing from the snapshot; those are never placed.
     */
    public boolean isKnown(String personId) {
        return knownPersons.contains(personId);
    }

    public boolean isVisited(String personId) {
        return visited.contains(personId);
    }

    /**
     * @return {@code false} if the person was already visited
     */
    public boolean markVisited(String personId) {
        return visited.add(personId);
    }

    public Set<String> visited() {
        return Collections.unmodifiableSet(visited);
    }

    public void place(String personId, double depth, double family) {
        placements.put(personId, new Placement(depth, family));
    }

    public Map<String, Placement> placements() {
        return Collections.unmodifiableMap(placements);
    }

    /**
     * Largest depth coordinate placed so far, 0 when nothing is placed.
     */
    public double maxDepth() {
        return placements.values().stream()
                .mapToDouble(Placement::depth)
                .max()
                .orElse(0);
    }
}
