package com.ndcheck.proof;

import java.util.Locale;

/**
 * Step kinds as named on the wire.
 */
public enum StepKind {
    PREMISE("premise"),
    ASSUMPTION("assumption"),
    LINE("line"),
    CLOSE_SUBPROOF("close_subproof"),
    END_AND_BEGIN("end_and_begin");

    private final String wireName;

    StepKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * True for kinds whose text is a formula followed by a justification.
     */
    public boolean isJustified() {
        return this == LINE || this == CLOSE_SUBPROOF;
    }

    public static StepKind fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Step kind is missing.");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (StepKind kind : values()) {
            if (kind.wireName.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown step kind: \"" + name + "\".");
    }
}
