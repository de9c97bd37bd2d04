package com.ndcheck.proof;

public enum LineRole {
    PREMISE,
    ASSUMPTION,
    DERIVED
}
