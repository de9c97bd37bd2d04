package com.ndcheck.proof;

/**
 * Verdict for one materialized line.
 */
public final class LineResult {

    private final int lineNumber;
    private final boolean ok;
    private final String message;
    private final ErrorKind errorKind;

    private LineResult(int lineNumber, boolean ok, String message, ErrorKind errorKind) {
        this.lineNumber = lineNumber;
        this.ok = ok;
        this.message = message;
        this.errorKind = errorKind;
    }

    public static LineResult ok(int lineNumber) {
        return new LineResult(lineNumber, true, "", null);
    }

    public static LineResult error(int lineNumber, ErrorKind kind, String message) {
        return new LineResult(lineNumber, false, message, kind);
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public boolean isOk() {
        return ok;
    }

    public String getMessage() {
        return message;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineResult)) {
            return false;
        }
        LineResult other = (LineResult) o;
        return lineNumber == other.lineNumber && ok == other.ok
            && message.equals(other.message) && errorKind == other.errorKind;
    }

    @Override
    public int hashCode() {
        return 31 * lineNumber + message.hashCode();
    }

    @Override
    public String toString() {
        return ok ? "Line " + lineNumber + ": ok" : "Line " + lineNumber + ": " + errorKind.getLabel() + ": " + message;
    }
}
