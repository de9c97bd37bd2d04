package com.ndcheck.logic;

/**
 * Syntactic building blocks a logic may admit. A formula is accepted under a logic
 * only if every operator it uses is in that logic's registry entry.
 */
public enum Operator {
    SENTENCE_LETTER("sentence letter"),
    PREDICATE("predicate"),
    IDENTITY("="),
    FUNCTION("function symbol"),
    BOTTOM("⊥"),
    NOT("¬"),
    AND("∧"),
    OR("∨"),
    IMPLIES("→"),
    IFF("↔"),
    FORALL("∀"),
    EXISTS("∃"),
    NECESSARILY("□"),
    POSSIBLY("♢");

    private final String label;

    Operator(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
