package com.ndcheck.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses justification text such as {@code →E, 1, 2} or {@code ¬I, 2-4} and splits a
 * step line {@code "<formula>; <justification>"} into its two halves.
 */
public class JustificationParser {

    private static final Pattern LINE = Pattern.compile("\\d+");
    private static final Pattern RANGE = Pattern.compile("(\\d+)\\s*[-–]\\s*(\\d+)");
    private static final String RULE_GLYPHS = "¬∧∨→↔⊥∀∃□♢◇=";

    /**
     * Halves of a step line. The justification is null when no separator was written.
     */
    public record StepText(String formula, String justification) {
    }

    public Justification parse(String text) {
        if (text == null || text.isBlank()) {
            throw new SyntaxException("Missing justification.");
        }
        String trimmed = text.trim();
        int end = 0;
        while (end < trimmed.length() && trimmed.charAt(end) != ',' && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        String rule = normalizeRule(trimmed.substring(0, end));
        String rest = trimmed.substring(end).trim();
        if (rest.startsWith(",")) {
            rest = rest.substring(1).trim();
        }
        return new Justification(rule, parseCitations(rest));
    }

    /**
     * Split at the first {@code ;} or {@code |}.
     */
    public StepText splitStepLine(String text) {
        if (text == null) {
            return new StepText("", null);
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ';' || ch == '|') {
                return new StepText(text.substring(0, i).trim(), text.substring(i + 1).trim());
            }
        }
        return new StepText(text.trim(), null);
    }

    private String normalizeRule(String token) {
        if (token.isEmpty()) {
            throw new SyntaxException("Missing rule name.");
        }
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            if (!Character.isLetterOrDigit(ch) && RULE_GLYPHS.indexOf(ch) < 0) {
                throw new SyntaxException("Invalid rule name '" + token + "'.", token);
            }
        }
        return token.replace('◇', '♢');
    }

    private List<Citation> parseCitations(String text) {
        List<Citation> citations = new ArrayList<>();
        if (text.isEmpty()) {
            return citations;
        }
        for (String piece : text.split(",", -1)) {
            String part = piece.trim();
            if (part.isEmpty()) {
                throw new SyntaxException("Empty citation in '" + text + "'.", text);
            }
            Matcher range = RANGE.matcher(part);
            if (range.matches()) {
                int first = toLineNumber(range.group(1), part);
                int last = toLineNumber(range.group(2), part);
                if (first >= last) {
                    throw new SyntaxException("Range " + part + " must run from a lower to a higher line.", part);
                }
                citations.add(new Citation.RangeRef(first, last));
            } else if (LINE.matcher(part).matches()) {
                citations.add(new Citation.LineRef(toLineNumber(part, part)));
            } else {
                throw new SyntaxException("Invalid citation '" + part + "'.", part);
            }
        }
        return citations;
    }

    private int toLineNumber(String digits, String citation) {
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Line number out of range in '" + citation + "'.", citation);
        }
        if (value < 1) {
            throw new SyntaxException("Line numbers start at 1, found '" + citation + "'.", citation);
        }
        return value;
    }
}
