package com.ndcheck.models;

public class LineVerdict {

    private int lineNumber;
    private boolean ok;
    private String message;
    private String errorKind;

    public LineVerdict() {
    }

    public LineVerdict(int lineNumber, boolean ok, String message, String errorKind) {
        this.lineNumber = lineNumber;
        this.ok = ok;
        this.message = message;
        this.errorKind = errorKind;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }
}
