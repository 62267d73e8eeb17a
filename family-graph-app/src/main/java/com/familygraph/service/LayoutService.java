package com.familygraph.service;

import com.familygraph.config.FamilyGraphConfig;
import com.familygraph.layout.LayoutDirection;
import com.familygraph.layout.LayoutOptions;
import com.familygraph.layout.Position;
import com.familygraph.layout.TreeLayoutEngine;
import com.familygraph.model.FamilyTree;
import com.familygraph.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Runs the layout engine over the stored tree and writes the positions back.
 */
@Service
public class LayoutService {

    private static final Logger log = LoggerFactory.getLogger(LayoutService.class);

    private final TreeLayoutEngine layoutEngine;
    private final TreeStateService treeStateService;
    private final PersonRepository personRepository;
    private final FamilyGraphConfig.Layout defaults;

    public LayoutService(TreeLayoutEngine layoutEngine,
                         TreeStateService treeStateService,
                         PersonRepository personRepository,
                         FamilyGraphConfig config) {
        this.layoutEngine = layoutEngine;
        this.treeStateService = treeStateService;
        this.personRepository = personRepository;
        this.defaults = config.getLayout();
    }

    /**
     * Build engine options, filling unset fields from configuration.
     */
    public LayoutOptions resolveOptions(String rootPersonId, LayoutDirection direction,
                                        Double spacingX, Double spacingY) {
        return new LayoutOptions(
            direction != null ? direction : defaults.getDirection(),
            rootPersonId,
            spacingX != null ? spacingX : defaults.getSpacingX(),
            spacingY != null ? spacingY : defaults.getSpacingY()
        );
    }

    /**
     * Lay out the stored tree from the given root and persist every position.
     *
     * @return the applied positions keyed by person id
     * @throws NoSuchElementException if the root person does not exist
     */
    @Transactional
    public Map<String, Position> applyLayout(LayoutOptions options) {
        if (options.rootPersonId() == null || !personRepository.existsById(options.rootPersonId())) {
            throw new NoSuchElementException("Root person not found");
        }

        treeStateService.recordAction("auto_layout");
        FamilyTree tree = treeStateService.snapshot();

        Map<String, Position> positions = layoutEngine.computeLayout(tree, options);
        positions.forEach((personId, position) ->
                personRepository.updatePosition(personId, position.x(), position.y()));

        log.info("Applied auto-layout with root: {} ({}, {} persons)",
                options.rootPersonId(), options.direction().value(), positions.size());
        return positions;
    }

    /**
     * Compute positions without storing them.
     */
    public Map<String, Position> previewLayout(LayoutOptions options) {
        return layoutEngine.computeLayout(treeStateService.snapshot(), options);
    }
}
