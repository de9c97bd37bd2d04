package com.ndcheck.logic;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rules of inference. Each constant is a table row: the symbol written in
 * justifications, the citation shape it expects, which systems offer it, the kind of
 * subproof its range citations must name and whether its line citations may reach
 * across world boundaries. Discharge, freshness and substitution checks live in the
 * verifier.
 */
public enum Rule {
    R("R", 1, 0, Requirement.ANY),
    AND_INTRO("∧I", 2, 0, Requirement.ANY),
    AND_ELIM("∧E", 1, 0, Requirement.ANY),
    OR_INTRO("∨I", 1, 0, Requirement.ANY),
    OR_ELIM("∨E", 1, 2, Requirement.ANY),
    IMPLIES_INTRO("→I", 0, 1, Requirement.ANY),
    IMPLIES_ELIM("→E", 2, 0, Requirement.ANY),
    IFF_INTRO("↔I", 0, 2, Requirement.ANY),
    IFF_ELIM("↔E", 2, 0, Requirement.ANY),
    NOT_INTRO("¬I", 0, 1, Requirement.ANY),
    NOT_ELIM("¬E", 2, 0, Requirement.ANY),
    EXPLOSION("X", 1, 0, Requirement.ANY, "⊥E"),
    INDIRECT_PROOF("IP", 0, 1, Requirement.ANY),
    DISJUNCTIVE_SYLLOGISM("DS", 2, 0, Requirement.ANY),
    MODUS_TOLLENS("MT", 2, 0, Requirement.ANY),
    DOUBLE_NEGATION_ELIM("DNE", 1, 0, Requirement.ANY),
    EXCLUDED_MIDDLE("LEM", 0, 2, Requirement.ANY),
    DE_MORGAN("DeM", 1, 0, Requirement.ANY),

    FORALL_INTRO("∀I", 1, 0, Requirement.FIRST_ORDER),
    FORALL_ELIM("∀E", 1, 0, Requirement.FIRST_ORDER),
    EXISTS_INTRO("∃I", 1, 0, Requirement.FIRST_ORDER),
    EXISTS_ELIM("∃E", 1, 1, Requirement.FIRST_ORDER),
    IDENTITY_INTRO("=I", 0, 0, Requirement.FIRST_ORDER),
    IDENTITY_ELIM("=E", 2, 0, Requirement.FIRST_ORDER),
    QUANTIFIER_CONVERSION("CQ", 1, 0, Requirement.FIRST_ORDER),

    BOX_INTRO("□I", 0, 1, Requirement.MODAL, SubproofKind.WORLD),
    BOX_ELIM("□E", 1, 0, Requirement.MODAL, true),
    DIAMOND_ELIM("♢E", 1, 1, Requirement.MODAL, SubproofKind.HYPOTHETICAL_WORLD),
    DIAMOND_DEFINITION("Def♢", 1, 0, Requirement.MODAL),
    MODAL_CONVERSION("MC", 1, 0, Requirement.MODAL),
    /** A ⊢ ♢A needs a reflexive frame, so K omits it. */
    DIAMOND_INTRO("♢I", 1, 0, Requirement.REFLEXIVE_MODAL),
    REFLEXIVITY("RT", 1, 0, Requirement.REFLEXIVE_MODAL),
    TRANSITIVITY("R4", 1, 0, Requirement.TRANSITIVE_MODAL, true),
    EUCLIDEAN("R5", 1, 0, Requirement.SYMMETRIC_MODAL, true);

    /** Which systems offer a rule. */
    public enum Requirement {
        ANY,
        FIRST_ORDER,
        MODAL,
        REFLEXIVE_MODAL,
        TRANSITIVE_MODAL,
        SYMMETRIC_MODAL
    }

    private static final Map<String, Rule> BY_SYMBOL = buildSymbolIndex();

    private final String symbol;
    private final int lineCitations;
    private final int rangeCitations;
    private final Requirement requirement;
    private final boolean worldTransfer;
    private final SubproofKind rangeKind;
    private final List<String> aliases;

    Rule(String symbol, int lineCitations, int rangeCitations, Requirement requirement, String... aliases) {
        this(symbol, lineCitations, rangeCitations, requirement, SubproofKind.ORDINARY, false, aliases);
    }

    Rule(String symbol, int lineCitations, int rangeCitations, Requirement requirement, boolean worldTransfer) {
        this(symbol, lineCitations, rangeCitations, requirement, SubproofKind.ORDINARY, worldTransfer);
    }

    Rule(String symbol, int lineCitations, int rangeCitations, Requirement requirement, SubproofKind rangeKind) {
        this(symbol, lineCitations, rangeCitations, requirement, rangeKind, false);
    }

    Rule(String symbol, int lineCitations, int rangeCitations, Requirement requirement,
         SubproofKind rangeKind, boolean worldTransfer, String... aliases) {
        this.symbol = symbol;
        this.lineCitations = lineCitations;
        this.rangeCitations = rangeCitations;
        this.requirement = requirement;
        this.rangeKind = rangeKind;
        this.worldTransfer = worldTransfer;
        this.aliases = List.of(aliases);
    }

    public String getSymbol() {
        return symbol;
    }

    public int getLineCitations() {
        return lineCitations;
    }

    public int getRangeCitations() {
        return rangeCitations;
    }

    public SubproofKind getRangeKind() {
        return rangeKind;
    }

    /**
     * Line citations of □E, R4 and R5 are resolved across strict boundaries; every
     * other rule only sees lines of the current world.
     */
    public boolean crossesWorlds() {
        return worldTransfer;
    }

    /**
     * Whether a system with the given language and accessibility discipline offers
     * this rule.
     */
    public boolean isAvailableIn(Logic logic, WorldDiscipline discipline) {
        switch (requirement) {
            case ANY:
                return true;
            case FIRST_ORDER:
                return logic.isFirstOrder();
            case MODAL:
                return logic.isModal();
            case REFLEXIVE_MODAL:
                return logic.isModal() && discipline.isReflexive();
            case TRANSITIVE_MODAL:
                return logic.isModal() && discipline.isTransitive();
            case SYMMETRIC_MODAL:
                return logic.isModal() && discipline.isSymmetric();
            default:
                return false;
        }
    }

    public String describeCitations() {
        if (lineCitations == 0 && rangeCitations == 0) {
            return "no citations";
        }
        StringBuilder sb = new StringBuilder();
        if (lineCitations > 0) {
            sb.append(lineCitations).append(lineCitations == 1 ? " line" : " lines");
        }
        if (rangeCitations > 0) {
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append(rangeCitations).append(rangeCitations == 1 ? " subproof" : " subproofs");
        }
        return sb.toString();
    }

    /**
     * Look up a rule by its written symbol or an alias, or null if nothing matches.
     */
    public static Rule fromSymbol(String symbol) {
        if (symbol == null) {
            return null;
        }
        return BY_SYMBOL.get(symbol.trim());
    }

    private static Map<String, Rule> buildSymbolIndex() {
        Map<String, Rule> map = new HashMap<>();
        for (Rule rule : values()) {
            map.put(rule.symbol, rule);
            for (String alias : rule.aliases) {
                map.put(alias, rule);
            }
        }
        return Collections.unmodifiableMap(map);
    }
}
