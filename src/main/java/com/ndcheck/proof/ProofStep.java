package com.ndcheck.proof;

import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.Justification;

/**
 * One step replayed by the {@link ProofDriver}. The indent is the depth the author
 * placed the step at, or {@link #UNSPECIFIED_INDENT} when the caller did not say.
 */
public sealed interface ProofStep permits ProofStep.Premise, ProofStep.Assumption, ProofStep.Line,
    ProofStep.CloseSubproof, ProofStep.CloseAndReopen, ProofStep.Malformed {

    int UNSPECIFIED_INDENT = -1;

    int indent();

    StepKind stepKind();

    record Premise(int indent, Formula formula) implements ProofStep {
        @Override
        public StepKind stepKind() {
            return StepKind.PREMISE;
        }
    }

    /**
     * Opens a subproof. A WORLD subproof has no formula.
     */
    record Assumption(int indent, Formula formula, SubproofKind subproofKind) implements ProofStep {
        @Override
        public StepKind stepKind() {
            return StepKind.ASSUMPTION;
        }
    }

    record Line(int indent, Formula formula, Justification justification) implements ProofStep {
        @Override
        public StepKind stepKind() {
            return StepKind.LINE;
        }
    }

    /**
     * Closes the innermost subproof; the line itself sits in the enclosing one.
     */
    record CloseSubproof(int indent, Formula formula, Justification justification) implements ProofStep {
        @Override
        public StepKind stepKind() {
            return StepKind.CLOSE_SUBPROOF;
        }
    }

    record CloseAndReopen(int indent, Formula formula, SubproofKind subproofKind) implements ProofStep {
        @Override
        public StepKind stepKind() {
            return StepKind.END_AND_BEGIN;
        }
    }

    /**
     * A step whose text could not be read. It still opens or closes a subproof as its
     * kind says, so the lines after it keep their places.
     */
    record Malformed(int indent, StepKind intended, ErrorKind error, String message, String source) implements ProofStep {
        @Override
        public StepKind stepKind() {
            return intended;
        }
    }

    static Premise premise(Formula formula) {
        return new Premise(UNSPECIFIED_INDENT, formula);
    }
}
