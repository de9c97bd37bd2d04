package com.ndcheck.proof;

import com.ndcheck.syntax.Formula;

import java.util.List;

/**
 * Read-only view of the proof state at the line being verified.
 */
public interface ContextView {

    /** Number the next materialized line will get. */
    int nextIndex();

    int depth();

    /** The line with this number, or null if it has not been written. */
    ProofLine line(int index);

    /** Whether the line belongs to the chain of open subproofs, top level included. */
    boolean isOpen(int index);

    /**
     * Strict subproofs opened between an open line and the current position. Only
     * meaningful when {@link #isOpen(int)} holds.
     */
    int worldDistance(int index);

    /** The closed subproof spanning exactly these lines, or null. */
    ClosedSubproof closedSubproof(int first, int last);

    /** Whether a closed subproof can be cited here as a whole. */
    boolean isVisible(ClosedSubproof subproof);

    /** Premises and the assumptions of every open subproof. */
    List<Formula> openHypotheses();

    /** Every line with a formula that is not inside a closed subproof. */
    List<ProofLine> availableLines();
}
