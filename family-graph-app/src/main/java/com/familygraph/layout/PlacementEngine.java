package com.familygraph.layout;

import com.familygraph.model.Marriage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive family-unit placement. A person is centred over the span of their
 * children, spouses sit to the right of the person in marriage order, and each
 * child subtree starts where the previous sibling's footprint ended.
 */
public class PlacementEngine {

    /**
     * Place {@code personId}, their spouses and every unvisited descendant.
     *
     * @param personId   person heading the family unit
     * @param generation distance from the layout root
     * @param base       left edge of the free space on the family axis
     * @param context    state of the current run
     * @return the footprint of the subtree on the family axis, 0 if the person was already placed
     */
    public double place(String personId, int generation, double base, LayoutContext context) {
        if (!context.isKnown(personId) || !context.markVisited(personId)) {
            return 0;
        }

        RelationshipIndex index = context.index();
        double spacing = context.spacingX();

        List<String> spouses = new ArrayList<>();
        Set<String> children = new LinkedHashSet<>();

        for (Marriage marriage : index.marriagesOf(personId)) {
            String spouseId = marriage.spouseOf(personId);
            if (context.isKnown(spouseId) && context.markVisited(spouseId)) {
                spouses.add(spouseId);
            }
            children.addAll(index.childrenOfMarriage(marriage.id()));
        }
        children.addAll(index.childrenOfParent(personId));

        double childrenWidth = 0;
        boolean placedAnyChild = false;
        for (String childId : children) {
            double childWidth = place(childId, generation + 1, base + childrenWidth, context);
            if (childWidth > 0) {
                placedAnyChild = true;
                childrenWidth += childWidth;
            }
        }

        double unitWidth = spacing * (1 + spouses.size());
        if (!placedAnyChild) {
            childrenWidth = unitWidth;
        }

        double familyOffset = base + childrenWidth / 2 - unitWidth / 2;
        double depth = generation * context.spacingY();

        context.place(personId, depth, familyOffset);
        for (int i = 0; i < spouses.size(); i++) {
            context.place(spouses.get(i), depth, familyOffset + spacing * (i + 1));
        }

        return Math.max(childrenWidth, unitWidth);
    }
}
