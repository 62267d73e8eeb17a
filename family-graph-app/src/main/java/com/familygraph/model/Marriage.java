package com.familygraph.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A union between two persons. {@code order} ranks the marriages of the same
 * person: lower is earlier.
 */
public record Marriage(
    String id,
    String spouse1Id,
    String spouse2Id,
    String marriageDate,
    int order
) {
    public static final int DEFAULT_ORDER = 1;

    /**
     * JSON entry point; a marriage saved without an order ranks first.
     */
    @JsonCreator
    public static Marriage fromJson(@JsonProperty("id") String id,
                                    @JsonProperty("spouse1Id") String spouse1Id,
                                    @JsonProperty("spouse2Id") String spouse2Id,
                                    @JsonProperty("marriageDate") String marriageDate,
                                    @JsonProperty("order") Integer order) {
        return new Marriage(id, spouse1Id, spouse2Id, marriageDate, order == null ? DEFAULT_ORDER : order);
    }

    public boolean involves(String personId) {
        return personId != null && (personId.equals(spouse1Id) || personId.equals(spouse2Id));
    }

    /**
     * The participant that is not {@code personId}.
     */
    public String spouseOf(String personId) {
        return spouse1Id.equals(personId) ? spouse2Id : spouse1Id;
    }
}
