package com.familygraph.layout;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class CoordinateEmitter {

    public Position emit(Placement placement, LayoutDirection direction) {
        if (direction == LayoutDirection.LEFT_RIGHT) {
            return new Position(placement.depth(), placement.family());
        }
        return new Position(placement.family(), placement.depth());
    }

    /**
     * Emits positions keyed in the order of {@code personIds}; ids without a placement are left out.
     */
    public Map<String, Position> emitAll(Collection<String> personIds,
                                         Map<String, Placement> placements,
                                         LayoutDirection direction) {
        Map<String, Position> positions = new LinkedHashMap<>();
        for (String personId : personIds) {
            Placement placement = placements.get(personId);
            if (placement != null) {
                positions.put(personId, emit(placement, direction));
            }
        }
        return positions;
    }
}
