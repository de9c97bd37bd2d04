package com.ndcheck.proof;

/**
 * Why a line or a whole proof was rejected. The label is the name reported to clients.
 */
public enum ErrorKind {
    SYNTAX_ERROR("SyntaxError"),
    OPERATOR_NOT_SUPPORTED("OperatorNotSupportedError"),
    SCOPE_ERROR("ScopeError"),
    UNKNOWN_RULE("UnknownRuleError"),
    RULE_MISMATCH("RuleMismatchError"),
    FRESHNESS_VIOLATION("FreshnessViolation"),
    INCOMPLETE_PROOF("IncompleteProof");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
