package com.ndcheck.storage;

import com.ndcheck.models.StepDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EditorLineCodecTest {

    private static List<String> kinds(List<StepDescriptor> steps) {
        return steps.stream().map(StepDescriptor::getKind).collect(Collectors.toList());
    }

    @Test
    void decodesPremisesAndDerivedLines() throws Exception {
        List<StepDescriptor> steps = EditorLineCodec.readTuples(
            "[[0,2,\"P → Q\",\"PR\"],[0,2,\"P\",\"PR\"],[0,0,\"Q\",\"→E, 1,2\"]]");
        assertEquals(List.of("premise", "premise", "line"), kinds(steps));
        assertEquals("P → Q", steps.get(0).getRawText());
        assertEquals("Q; →E, 1,2", steps.get(2).getRawText());
        assertEquals(Integer.valueOf(3), steps.get(2).getLineNumber());
        assertEquals(Integer.valueOf(0), steps.get(2).getIndent());
    }

    @Test
    void infersSubproofBoundariesFromIndentation() throws Exception {
        List<StepDescriptor> steps = EditorLineCodec.readTuples("["
            + "[1,1,\"¬(P ∨ ¬P)\",\"\"],"
            + "[2,1,\"P\",\"\"],"
            + "[2,0,\"P ∨ ¬P\",\"∨I, 2\"],"
            + "[2,0,\"⊥\",\"¬E, 1, 3\"],"
            + "[1,0,\"¬P\",\"¬I, 2-4\"],"
            + "[1,0,\"P ∨ ¬P\",\"∨I, 5\"],"
            + "[1,0,\"⊥\",\"¬E, 1, 6\"],"
            + "[0,0,\"P ∨ ¬P\",\"IP, 1-7\"]]");
        assertEquals(List.of("assumption", "assumption", "line", "line", "close_subproof",
            "line", "line", "close_subproof"), kinds(steps));
        assertEquals("¬(P ∨ ¬P)", steps.get(0).getRawText());
    }

    @Test
    void assumptionAtSameIndentStartsSiblingSubproof() throws Exception {
        List<StepDescriptor> steps = EditorLineCodec.readTuples("["
            + "[0,2,\"P ∨ Q\",null],"
            + "[1,1,\"P\",null],"
            + "[1,0,\"Q ∨ P\",\"∨I, 2\"],"
            + "[1,1,\"Q\",null],"
            + "[1,0,\"Q ∨ P\",\"∨I, 4\"],"
            + "[0,0,\"Q ∨ P\",\"∨E, 1, 2-3, 4-5\"]]");
        assertEquals(List.of("premise", "assumption", "line", "end_and_begin", "line", "close_subproof"),
            kinds(steps));
    }

    @Test
    void rejectsMalformedTuple() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> EditorLineCodec.readTuples("[[0,2,\"P\"],[0,\"x\",\"Q\"]]"));
        assertEquals("Line 2: expected [indent, flags, text, justification].", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> EditorLineCodec.readTuples("[[0,2]]"));
    }

    @Test
    void emptyListGivesNoSteps() throws Exception {
        assertTrue(EditorLineCodec.readTuples("[]").isEmpty());
    }
}
