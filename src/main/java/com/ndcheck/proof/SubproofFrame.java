package com.ndcheck.proof;

import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;

/**
 * An open subproof on the {@link ContextStack}.
 */
public final class SubproofFrame {

    private final int id;
    private final int openedAtLine;
    private final Formula assumption;
    private final int depth;
    private final SubproofKind kind;

    SubproofFrame(int id, int openedAtLine, Formula assumption, int depth, SubproofKind kind) {
        this.id = id;
        this.openedAtLine = openedAtLine;
        this.assumption = assumption;
        this.depth = depth;
        this.kind = kind;
    }

    public int getId() {
        return id;
    }

    public int getOpenedAtLine() {
        return openedAtLine;
    }

    public Formula getAssumption() {
        return assumption;
    }

    public int getDepth() {
        return depth;
    }

    public SubproofKind getKind() {
        return kind;
    }

    public boolean isStrict() {
        return kind.isStrict();
    }
}
