package com.familygraph.layout;

import com.familygraph.model.FamilyTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * Computes a position for every person of a snapshot. Stateless: each call
 * builds its own index and context, so concurrent calls on independent
 * snapshots need no coordination.
 */
@Component
public class TreeLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(TreeLayoutEngine.class);

    private final PlacementEngine placementEngine;
    private final OrphanPlacer orphanPlacer;
    private final CoordinateEmitter coordinateEmitter;

    public TreeLayoutEngine() {
        this(new PlacementEngine(), new OrphanPlacer(), new CoordinateEmitter());
    }

    public TreeLayoutEngine(PlacementEngine placementEngine,
                            OrphanPlacer orphanPlacer,
                            CoordinateEmitter coordinateEmitter) {
        this.placementEngine = placementEngine;
        this.orphanPlacer = orphanPlacer;
        this.coordinateEmitter = coordinateEmitter;
    }

    /**
     * Lay out the whole snapshot starting from {@code options.rootPersonId()}.
     * An unknown root is not an error: everyone is then placed by the orphan fallback.
     *
     * @return person id to position, in snapshot order, covering every person of the snapshot
     */
    public Map<String, Position> computeLayout(FamilyTree tree, LayoutOptions options) {
        if (tree.isEmpty()) {
            return Collections.emptyMap();
        }

        LayoutContext context = new LayoutContext(
                RelationshipIndex.of(tree), tree.persons().keySet(), options.spacingX(), options.spacingY());

        String rootId = options.rootPersonId();
        if (rootId != null && tree.persons().containsKey(rootId)) {
            placementEngine.place(rootId, 0, 0, context);
        } else {
            log.warn("Root person not found: {}", rootId);
        }

        int orphans = orphanPlacer.placeOrphans(tree.persons().keySet(), context);
        if (orphans > 0) {
            log.debug("Placed {} persons unreachable from root {}", orphans, rootId);
        }

        Map<String, Position> positions = coordinateEmitter.emitAll(
                tree.persons().keySet(), context.placements(), options.direction());

        if (positions.size() != tree.persons().size()) {
            log.error("Layout omitted {} of {} persons", tree.persons().size() - positions.size(),
                    tree.persons().size());
        }

        log.info("Calculated layout for {} persons", positions.size());
        return positions;
    }
}
