package com.familygraph.layout;

import com.familygraph.model.FamilyTree;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanPlacerTest {

    private final FamilyTree tree = FamilyTree.builder()
            .person("A", "Ann").person("B", "Ben").person("C", "Cy").person("D", "Di")
            .build();

    private LayoutContext newContext() {
        return new LayoutContext(RelationshipIndex.of(tree), tree.persons().keySet(), 200, 150);
    }

    @Test
    void placesOnlyUnvisitedPersons() {
        LayoutContext context = newContext();
        context.markVisited("B");
        context.place("B", 300, 40);

        int placed = new OrphanPlacer().placeOrphans(tree.persons().keySet(), context);

        assertThat(placed).isEqualTo(3);
        assertThat(context.placements())
                .containsEntry("A", new Placement(450, 0))
                .containsEntry("B", new Placement(300, 40))
                .containsEntry("C", new Placement(450, 200))
                .containsEntry("D", new Placement(450, 400));
    }

    @Test
    void usesFirstGenerationRowWhenNothingPlaced() {
        LayoutContext context = newContext();

        new OrphanPlacer().placeOrphans(tree.persons().keySet(), context);

        assertThat(context.placements().values()).extracting(Placement::depth).containsOnly(150.0);
        assertThat(context.visited()).containsExactly("A", "B", "C", "D");
    }
}
