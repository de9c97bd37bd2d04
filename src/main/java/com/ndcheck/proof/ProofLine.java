package com.ndcheck.proof;

import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.Justification;

/**
 * A materialized proof line. Lines that failed verification are kept, marked as not
 * established, so numbering stays aligned with what the author wrote.
 */
public final class ProofLine {

    private final int index;
    private final int depth;
    private final Formula formula;
    private final LineRole role;
    private final Justification justification;
    private final SubproofKind opens;
    private final boolean established;
    private final String source;

    ProofLine(int index, int depth, Formula formula, LineRole role, Justification justification,
              SubproofKind opens, boolean established, String source) {
        this.index = index;
        this.depth = depth;
        this.formula = formula;
        this.role = role;
        this.justification = justification;
        this.opens = opens;
        this.established = established;
        this.source = source;
    }

    public int getIndex() {
        return index;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Null for the marker line of a world subproof and for unreadable lines.
     */
    public Formula getFormula() {
        return formula;
    }

    public LineRole getRole() {
        return role;
    }

    public Justification getJustification() {
        return justification;
    }

    /**
     * Kind of subproof this line opens, or null when it opens none.
     */
    public SubproofKind getOpens() {
        return opens;
    }

    public boolean isEstablished() {
        return established;
    }

    public String getSource() {
        return source;
    }

    public boolean isWorldMarker() {
        return opens == SubproofKind.WORLD;
    }
}
