package com.ndcheck.logic;

/**
 * Accessibility relation between worlds. Each value includes the properties of the
 * ones before it: S4 is reflexive and transitive, S5 adds symmetry.
 */
public enum WorldDiscipline {
    NONE,
    REFLEXIVE,
    TRANSITIVE,
    EQUIVALENCE;

    public boolean isReflexive() {
        return this != NONE;
    }

    public boolean isTransitive() {
        return this == TRANSITIVE || this == EQUIVALENCE;
    }

    public boolean isSymmetric() {
        return this == EQUIVALENCE;
    }

    /**
     * Whether □A available {@code distance} strict boundaries outside the current
     * world yields A here.
     */
    public boolean allowsNecessityTransfer(int distance) {
        switch (this) {
            case NONE:
                return distance == 1;
            case REFLEXIVE:
                return distance == 0 || distance == 1;
            default:
                return distance >= 0;
        }
    }
}
