package com.familygraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of every person, marriage and parent-child record.
 * Collections are copied on construction and exposed read-only, so a snapshot
 * can be handed to the layout engine or kept in the undo history safely.
 */
public record FamilyTree(
    Map<String, Person> persons,
    Map<String, Marriage> marriages,
    List<ParentChild> parentChild,
    Map<String, Object> metadata
) {
    public FamilyTree {
        persons = persons == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(persons));
        marriages = marriages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(marriages));
        parentChild = parentChild == null ? List.of() : List.copyOf(parentChild);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static FamilyTree empty() {
        return new FamilyTree(Map.of(), Map.of(), List.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return persons.isEmpty();
    }

    public static class Builder {
        private final Map<String, Person> persons = new LinkedHashMap<>();
        private final Map<String, Marriage> marriages = new LinkedHashMap<>();
        private final List<ParentChild> parentChild = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder person(Person person) {
            persons.put(person.id(), person);
            return this;
        }

        public Builder person(String id, String name) {
            return person(new Person(id, name, null, null, null, null, null, 0, 0));
        }

        public Builder marriage(Marriage marriage) {
            marriages.put(marriage.id(), marriage);
            return this;
        }

        public Builder marriage(String id, String spouse1Id, String spouse2Id, int order) {
            return marriage(new Marriage(id, spouse1Id, spouse2Id, null, order));
        }

        public Builder child(ParentChild relation) {
            parentChild.add(relation);
            return this;
        }

        public Builder child(String parentId, String childId, String marriageId) {
            return child(new ParentChild(parentId, childId, marriageId));
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public FamilyTree build() {
            return new FamilyTree(persons, marriages, parentChild, metadata);
        }
    }
}
