package com.familygraph.service;

import com.familygraph.model.Person;
import com.familygraph.repository.MarriageRepository;
import com.familygraph.repository.ParentChildRepository;
import com.familygraph.repository.PersonRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Sql(scripts = "/wright-family.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
@Transactional
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class PersonServiceTest {

    @Autowired
    private PersonService personService;

    @Autowired
    private TreeStateService treeStateService;

    @Autowired
    private MarriageRepository marriageRepository;

    @Autowired
    private ParentChildRepository parentChildRepository;

    @SpyBean
    private PersonRepository personRepository;

    private static final String ARTHUR = "p-arthur";
    private static final String CLARA = "p-clara";
    private static final String DANIEL = "p-daniel";
    private static final String FRANK = "p-frank";

    @BeforeEach
    void setUp() {
        treeStateService.clearHistory();
    }

    @Nested
    @DisplayName("createPerson")
    class CreatePerson {

        @Test
        void createsWithGeneratedIdAndDefaults() {
            Person created = personService.createPerson(Map.of("name", "Grace Wright"));

            assertThat(created.id()).isNotBlank();
            assertThat(created.gender()).isEqualTo("unknown");
            assertThat(created.x()).isZero();
            assertThat(personService.getPerson(created.id())).contains(created);
        }

        @Test
        void keepsSuppliedFields() {
            Map<String, Object> body = new HashMap<>();
            body.put("name", "Harold Wright");
            body.put("gender", "male");
            body.put("dateOfBirth", "1975");
            body.put("x", 120);
            body.put("y", 80.5);

            Person created = personService.createPerson(body);

            assertThat(created.gender()).isEqualTo("male");
            assertThat(created.dateOfBirth()).isEqualTo("1975");
            assertThat(created.x()).isEqualTo(120);
            assertThat(created.y()).isEqualTo(80.5);
        }

        @Test
        void requiresName() {
            assertThatThrownBy(() -> personService.createPerson(Map.of("gender", "male")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("name is required");
        }

        @Test
        void isUndoable() {
            personService.createPerson(Map.of("name", "Grace Wright"));

            assertThat(treeStateService.undo()).isTrue();
            assertThat(personService.listPersons()).hasSize(6);
        }
    }

    @Nested
    @DisplayName("updatePerson")
    class UpdatePerson {

        @Test
        void changesOnlySuppliedFields() {
            Optional<Person> result = personService.updatePerson(DANIEL, Map.of("dateOfDeath", "2020"));

            assertThat(result).isPresent();
            Person daniel = result.get();
            assertThat(daniel.dateOfDeath()).isEqualTo("2020");
            assertThat(daniel.name()).isEqualTo("Daniel Wright");
            assertThat(daniel.notes()).isEqualTo("Emigrated 1975");
        }

        @Test
        void clearsFieldExplicitlySetToNull() {
            Map<String, Object> body = new HashMap<>();
            body.put("notes", null);

            Person daniel = personService.updatePerson(DANIEL, body).orElseThrow();

            assertThat(daniel.notes()).isNull();
        }

        @Test
        void returnsEmptyWhenPersonNotFound() {
            assertThat(personService.updatePerson("missing", Map.of("name", "X"))).isEmpty();
        }

        @Test
        void rejectsBlankName() {
            assertThatThrownBy(() -> personService.updatePerson(DANIEL, Map.of("name", " ")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("positions")
    class Positions {

        @Test
        void movesPersonWithoutHistory() {
            Optional<Person> moved = personService.updatePosition(FRANK, 310, 45);

            assertThat(moved).isPresent();
            assertThat(moved.get().x()).isEqualTo(310);
            assertThat(moved.get().y()).isEqualTo(45);
            assertThat(treeStateService.canUndo()).isFalse();
        }

        @Test
        void returnsEmptyWhenMovingUnknownPerson() {
            assertThat(personService.updatePosition("missing", 1, 2)).isEmpty();
        }

        @Test
        void bulkMoveCountsKnownPersonsOnly() {
            int count = personService.updatePositions(List.of(
                    Map.<String, Object>of("id", ARTHUR, "x", 10, "y", 20),
                    Map.<String, Object>of("id", "missing", "x", 1, "y", 1),
                    Map.<String, Object>of("x", 5, "y", 5),
                    Map.<String, Object>of("id", CLARA, "x", 30.5, "y", 40)));

            assertThat(count).isEqualTo(2);
            assertThat(personService.getPerson(CLARA).orElseThrow().x()).isEqualTo(30.5);
        }
    }

    @Nested
    @DisplayName("deletePerson")
    class DeletePerson {

        @Test
        void removesMarriagesAndLinks() {
            boolean deleted = personService.deletePerson(ARTHUR);

            assertThat(deleted).isTrue();
            assertThat(personService.getPerson(ARTHUR)).isEmpty();
            assertThat(marriageRepository.findAll()).isEmpty();
            assertThat(parentChildRepository.findAll())
                    .noneMatch(pc -> pc.involves(ARTHUR))
                    .hasSize(3);
            verify(personRepository).delete(ARTHUR);
        }

        @Test
        void returnsFalseWhenPersonNotFound() {
            assertThat(personService.deletePerson("missing")).isFalse();
            verify(personRepository, never()).delete(anyString());
        }
    }
}
