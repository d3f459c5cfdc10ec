package com.pressroom.core.relation;

/**
 * Cardinality of a relation, read from its source side.
 */
public enum Cardinality {
    ONE_TO_ONE,
    ONE_TO_MANY,
    MANY_TO_ONE,
    MANY_TO_MANY;

    public boolean isCollection() {
        return this == ONE_TO_MANY || this == MANY_TO_MANY;
    }
}
