package com.ndcheck;

import com.ndcheck.proof.ErrorKind;

/**
 * The problem statement or the request around a proof cannot be used. The kind is null
 * when the failure is not about formula text (an unknown logic, a bad step kind).
 */
public class ProblemException extends IllegalArgumentException {

    private final ErrorKind kind;

    public ProblemException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
