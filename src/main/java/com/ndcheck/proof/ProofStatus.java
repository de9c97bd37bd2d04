package com.ndcheck.proof;

public enum ProofStatus {
    COMPLETE("complete"),
    INCOMPLETE("incomplete"),
    ERROR("error");

    private final String wireName;

    ProofStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
