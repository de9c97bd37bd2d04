package com.ndcheck.proof;

import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;

/**
 * A subproof that has been closed, citable as the range {@code first-last}.
 */
public final class ClosedSubproof {

    private final int first;
    private final int last;
    private final Formula assumption;
    private final Formula conclusion;
    private final SubproofKind kind;
    private final int parentFrameId;
    private final boolean established;

    ClosedSubproof(int first, int last, Formula assumption, Formula conclusion, SubproofKind kind,
                   int parentFrameId, boolean established) {
        this.first = first;
        this.last = last;
        this.assumption = assumption;
        this.conclusion = conclusion;
        this.kind = kind;
        this.parentFrameId = parentFrameId;
        this.established = established;
    }

    public int getFirst() {
        return first;
    }

    public int getLast() {
        return last;
    }

    public Formula getAssumption() {
        return assumption;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    public SubproofKind getKind() {
        return kind;
    }

    int getParentFrameId() {
        return parentFrameId;
    }

    /**
     * Both the opening line and the last line were accepted.
     */
    public boolean isEstablished() {
        return established;
    }

    public String describeRange() {
        return first + "-" + last;
    }
}
