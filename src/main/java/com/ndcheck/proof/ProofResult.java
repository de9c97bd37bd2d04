package com.ndcheck.proof;

import java.util.List;

/**
 * Outcome of replaying a whole proof.
 */
public final class ProofResult {

    public static final String COMPLETE_MESSAGE = "Proof complete!";
    public static final String INCOMPLETE_MESSAGE = "No errors yet, but the proof is incomplete!";

    private final List<LineResult> lineResults;
    private final List<ProofLine> lines;
    private final ProofStatus status;
    private final String message;
    private final ErrorKind errorKind;
    private final String incompleteReason;

    ProofResult(List<LineResult> lineResults, List<ProofLine> lines, ProofStatus status, String message,
                ErrorKind errorKind, String incompleteReason) {
        this.lineResults = List.copyOf(lineResults);
        this.lines = List.copyOf(lines);
        this.status = status;
        this.message = message;
        this.errorKind = errorKind;
        this.incompleteReason = incompleteReason;
    }

    public List<LineResult> getLineResults() {
        return lineResults;
    }

    public List<ProofLine> getLines() {
        return lines;
    }

    public boolean isComplete() {
        return status == ProofStatus.COMPLETE;
    }

    public ProofStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Kind of the first line error, {@link ErrorKind#INCOMPLETE_PROOF} for an error-free
     * proof that is not finished, null when complete.
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getIncompleteReason() {
        return incompleteReason;
    }
}
