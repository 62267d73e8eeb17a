package com.familygraph.layout;

import com.familygraph.model.FamilyTree;
import com.familygraph.model.Marriage;
import com.familygraph.model.ParentChild;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup tables over a {@link FamilyTree} snapshot. Built once per layout run;
 * unknown keys answer with an empty list.
 */
public final class RelationshipIndex {

    private final Map<String, List<Marriage>> marriagesByPerson;
    private final Map<String, Set<String>> childrenByMarriage;
    private final Map<String, Set<String>> childrenByParent;

    private RelationshipIndex(Map<String, List<Marriage>> marriagesByPerson,
                              Map<String, Set<String>> childrenByMarriage,
                              Map<String, Set<String>> childrenByParent) {
        this.marriagesByPerson = marriagesByPerson;
        this.childrenByMarriage = childrenByMarriage;
        this.childrenByParent = childrenByParent;
    }

    public static RelationshipIndex of(FamilyTree tree) {
        Map<String, List<Marriage>> marriagesByPerson = new HashMap<>();
        Map<String, Set<String>> childrenByMarriage = new HashMap<>();
        Map<String, Set<String>> childrenByParent = new HashMap<>();

        for (Marriage marriage : tree.marriages().values()) {
            marriagesByPerson.computeIfAbsent(marriage.spouse1Id(), k -> new ArrayList<>()).add(marriage);
            if (!marriage.spouse2Id().equals(marriage.spouse1Id())) {
                marriagesByPerson.computeIfAbsent(marriage.spouse2Id(), k -> new ArrayList<>()).add(marriage);
            }
            childrenByMarriage.put(marriage.id(), new LinkedHashSet<>());
        }

        // List.sort is stable, so equal orders keep snapshot order
        for (List<Marriage> marriages : marriagesByPerson.values()) {
            marriages.sort(Comparator.comparingInt(Marriage::order));
        }

        for (ParentChild relation : tree.parentChild()) {
            childrenByParent.computeIfAbsent(relation.parentId(), k -> new LinkedHashSet<>())
                    .add(relation.childId());
            if (relation.marriageId() != null) {
                Set<String> children = childrenByMarriage.get(relation.marriageId());
                if (children != null) {
                    children.add(relation.childId());
                }
            }
        }

        return new RelationshipIndex(marriagesByPerson, childrenByMarriage, childrenByParent);
    }

    /**
     * Marriages of a person, earliest {@code order} first.
     */
    public List<Marriage> marriagesOf(String personId) {
        List<Marriage> marriages = marriagesByPerson.get(personId);
        return marriages == null ? List.of() : List.copyOf(marriages);
    }

    public List<String> childrenOfMarriage(String marriageId) {
        Set<String> children = childrenByMarriage.get(marriageId);
        return children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Every child recorded under the parent, whatever marriage the record names.
     */
    public List<String> childrenOfParent(String personId) {
        Set<String> children = childrenByParent.get(personId);
        return children == null ? List.of() : List.copyOf(children);
    }
}
