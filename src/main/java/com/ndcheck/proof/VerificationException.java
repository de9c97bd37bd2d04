package com.ndcheck.proof;

/**
 * A step that cannot be accepted at the line it was written on.
 */
public class VerificationException extends RuntimeException {

    private final ErrorKind kind;
    private final int lineIndex;

    public VerificationException(ErrorKind kind, int lineIndex, String message) {
        super(message);
        this.kind = kind;
        this.lineIndex = lineIndex;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getLineIndex() {
        return lineIndex;
    }
}
