package com.familygraph.service;

import com.familygraph.model.FamilyTree;
import com.familygraph.model.Person;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SvgGeneratorTest {

    private SvgGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SvgGenerator();
    }

    private static Person person(String id, String name, String gender, double x, double y) {
        return new Person(id, name, gender, "1920", null, null, null, x, y);
    }

    @Test
    void rendersPlaceholderForEmptyTree() {
        assertThat(generator.generateSvg(FamilyTree.empty())).contains("No family members found");
    }

    @Test
    void drawsBoxPerPerson() {
        FamilyTree tree = FamilyTree.builder()
                .person(person("a", "Arthur", "male", 0, 0))
                .person(person("b", "Beatrice", "female", 200, 0))
                .build();

        String svg = generator.generateSvg(tree);

        assertThat(svg).contains("data-person-id=\"a\"", "data-person-id=\"b\"");
        assertThat(svg).contains("person-box male", "person-box female");
        assertThat(svg).contains(">Arthur<", ">b. 1920<");
    }

    @Test
    void shiftsNegativePositionsIntoView() {
        FamilyTree tree = FamilyTree.builder()
                .person(person("a", "Arthur", "male", -100, -50))
                .build();

        String svg = generator.generateSvg(tree);

        assertThat(svg).contains("x=\"40.0\" y=\"40.0\"");
    }

    @Test
    void drawsMarriageAndOneConnectorPerChildOfMarriage() {
        FamilyTree tree = FamilyTree.builder()
                .person(person("a", "Arthur", "male", 0, 0))
                .person(person("b", "Beatrice", "female", 200, 0))
                .person(person("c", "Clara", "female", 100, 150))
                .marriage("m1", "a", "b", 1)
                .child("a", "c", "m1")
                .child("b", "c", "m1")
                .build();

        String svg = generator.generateSvg(tree);

        assertThat(svg).containsOnlyOnce("class=\"marriage\"");
        assertThat(svg).containsOnlyOnce("class=\"connector\"");
    }

    @Test
    void escapesAndTruncatesNames() {
        FamilyTree tree = FamilyTree.builder()
                .person(person("a", "Bartholomew <Barty> Wright", null, 0, 0))
                .build();

        String svg = generator.generateSvg(tree);

        assertThat(svg).contains(">Bartholomew &lt;Bar...<");
        assertThat(svg).contains("person-box unknown");
    }
}
