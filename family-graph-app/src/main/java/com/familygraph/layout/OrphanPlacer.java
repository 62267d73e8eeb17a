package com.familygraph.layout;

import java.util.Collection;

/**
 * Gives a position to everyone the recursive pass could not reach: one row
 * past the deepest generation, spread along the family axis in snapshot order.
 */
public class OrphanPlacer {

    /**
     * @return number of persons placed here
     */
    public int placeOrphans(Collection<String> personIds, LayoutContext context) {
        double depth = context.maxDepth() + context.spacingY();
        int index = 0;
        for (String personId : personIds) {
            if (context.markVisited(personId)) {
                context.place(personId, depth, index * context.spacingX());
                index++;
            }
        }
        return index;
    }
}
