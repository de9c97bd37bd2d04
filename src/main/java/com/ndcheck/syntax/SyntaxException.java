package com.ndcheck.syntax;

/**
 * Malformed formula, term or justification text. Carries the offending substring
 * when one can be pointed at.
 */
public class SyntaxException extends RuntimeException {

    private final String offending;

    public SyntaxException(String message) {
        this(message, null);
    }

    public SyntaxException(String message, String offending) {
        super(message);
        this.offending = offending;
    }

    public String getOffending() {
        return offending;
    }
}
