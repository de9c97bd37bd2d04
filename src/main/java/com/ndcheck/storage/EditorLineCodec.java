package com.ndcheck.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndcheck.models.StepDescriptor;
import com.ndcheck.proof.StepKind;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the editor's line tuples {@code [indent, flags, text, justification]} (flag 1
 * marks an assumption, flag 2 a premise) and infers the step kind of each line from how
 * its indent relates to the previous one. Indents that fit no kind are passed through
 * as plain lines; the driver reports them.
 */
public class EditorLineCodec {

    public static final int FLAG_ASSUMPTION = 1;
    public static final int FLAG_PREMISE = 2;

    private static final ObjectMapper mapper = new ObjectMapper();

    static List<StepDescriptor> readTuples(String json) throws IOException {
        JsonNode[] tuples = mapper.readValue(json, JsonNode[].class);
        if (tuples == null) {
            return new ArrayList<>();
        }
        return decode(Arrays.asList(tuples));
    }

    /**
     * @throws IllegalArgumentException if a tuple is not an array of indent, flags and text
     */
    public static List<StepDescriptor> decode(List<JsonNode> tuples) {
        List<StepDescriptor> steps = new ArrayList<>();
        int previousIndent = 0;
        for (int i = 0; i < tuples.size(); i++) {
            JsonNode tuple = tuples.get(i);
            int lineNumber = i + 1;
            if (tuple == null || !tuple.isArray() || tuple.size() < 3
                || !tuple.get(0).isInt() || !tuple.get(1).isInt()) {
                throw new IllegalArgumentException("Line " + lineNumber
                    + ": expected [indent, flags, text, justification].");
            }
            int indent = tuple.get(0).asInt();
            int flags = tuple.get(1).asInt();
            String text = tuple.get(2).asText("").trim();
            String justification = tuple.size() > 3 && !tuple.get(3).isNull() ? tuple.get(3).asText("").trim() : "";

            StepKind kind;
            if ((flags & FLAG_PREMISE) != 0) {
                kind = StepKind.PREMISE;
            } else if ((flags & FLAG_ASSUMPTION) != 0) {
                boolean sibling = indent == previousIndent && indent > 0 && i > 0;
                kind = sibling ? StepKind.END_AND_BEGIN : StepKind.ASSUMPTION;
            } else if (indent == previousIndent - 1) {
                kind = StepKind.CLOSE_SUBPROOF;
            } else {
                kind = StepKind.LINE;
            }

            String raw = text;
            if (kind.isJustified() && !justification.isEmpty()) {
                raw = text + "; " + justification;
            }
            StepDescriptor step = new StepDescriptor(kind.getWireName(), indent, raw);
            step.setLineNumber(lineNumber);
            steps.add(step);
            previousIndent = indent;
        }
        return steps;
    }
}
