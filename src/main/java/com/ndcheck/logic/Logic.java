package com.ndcheck.logic;

import java.util.Locale;

/**
 * The proof systems a problem can be stated in. The FOML labels are the first-order
 * versions of the modal systems.
 */
public enum Logic {
    TFL(false, false, WorldDiscipline.NONE),
    FOL(true, false, WorldDiscipline.NONE),
    MLK(false, true, WorldDiscipline.NONE),
    MLT(false, true, WorldDiscipline.REFLEXIVE),
    MLS4(false, true, WorldDiscipline.TRANSITIVE),
    MLS5(false, true, WorldDiscipline.EQUIVALENCE),
    FOMLK(true, true, WorldDiscipline.NONE),
    FOMLT(true, true, WorldDiscipline.REFLEXIVE),
    FOMLS4(true, true, WorldDiscipline.TRANSITIVE),
    FOMLS5(true, true, WorldDiscipline.EQUIVALENCE);

    private final boolean firstOrder;
    private final boolean modal;
    private final WorldDiscipline worldDiscipline;

    Logic(boolean firstOrder, boolean modal, WorldDiscipline worldDiscipline) {
        this.firstOrder = firstOrder;
        this.modal = modal;
        this.worldDiscipline = worldDiscipline;
    }

    public boolean isFirstOrder() {
        return firstOrder;
    }

    public boolean isModal() {
        return modal;
    }

    public WorldDiscipline getWorldDiscipline() {
        return worldDiscipline;
    }

    /**
     * Resolve a logic label as sent by the editor. Matching is case-insensitive and
     * the bare modal names (K, T, S4, S5) map to their propositional systems.
     *
     * @throws IllegalArgumentException if the label names no logic
     */
    public static Logic fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A logic must be selected.");
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        switch (key) {
            case "K":
                return MLK;
            case "T":
                return MLT;
            case "S4":
                return MLS4;
            case "S5":
                return MLS5;
            default:
                break;
        }
        for (Logic logic : values()) {
            if (logic.name().equals(key)) {
                return logic;
            }
        }
        throw new IllegalArgumentException("Unknown logic: \"" + name.trim() + "\".");
    }
}
