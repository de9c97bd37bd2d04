package com.ndcheck.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The rule name written after a derived formula together with its citations, in the
 * order they were written.
 */
public class Justification {

    private final String rule;
    private final List<Citation> citations;

    public Justification(String rule, List<Citation> citations) {
        this.rule = rule;
        this.citations = List.copyOf(citations);
    }

    public String getRule() {
        return rule;
    }

    public List<Citation> getCitations() {
        return citations;
    }

    public List<Citation.LineRef> lineRefs() {
        List<Citation.LineRef> out = new ArrayList<>();
        for (Citation citation : citations) {
            if (citation instanceof Citation.LineRef) {
                out.add((Citation.LineRef) citation);
            }
        }
        return out;
    }

    public List<Citation.RangeRef> rangeRefs() {
        List<Citation.RangeRef> out = new ArrayList<>();
        for (Citation citation : citations) {
            if (citation instanceof Citation.RangeRef) {
                out.add((Citation.RangeRef) citation);
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Justification)) {
            return false;
        }
        Justification other = (Justification) o;
        return rule.equals(other.rule) && citations.equals(other.citations);
    }

    @Override
    public int hashCode() {
        return 31 * rule.hashCode() + citations.hashCode();
    }

    @Override
    public String toString() {
        if (citations.isEmpty()) {
            return rule;
        }
        return rule + ", " + citations.stream().map(Citation::toString).collect(Collectors.joining(", "));
    }
}
