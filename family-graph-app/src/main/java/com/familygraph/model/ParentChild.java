package com.familygraph.model;

public record ParentChild(
    String parentId,
    String childId,
    String marriageId   // optional: the union that produced the child
) {
    public boolean involves(String personId) {
        return personId != null && (personId.equals(parentId) || personId.equals(childId));
    }
}
