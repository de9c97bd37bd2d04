package com.ndcheck.logic;

/**
 * How a subproof was opened. WORLD subproofs are the strict boxes of modal logic,
 * opened by a bare {@code □}; HYPOTHETICAL_WORLD ones are opened by {@code □: A}.
 */
public enum SubproofKind {
    ORDINARY,
    WORLD,
    HYPOTHETICAL_WORLD;

    public boolean isStrict() {
        return this != ORDINARY;
    }

    public String describe() {
        switch (this) {
            case WORLD:
                return "a strict (□) subproof";
            case HYPOTHETICAL_WORLD:
                return "a strict subproof opened with □: and a hypothesis";
            default:
                return "an ordinary subproof";
        }
    }
}
