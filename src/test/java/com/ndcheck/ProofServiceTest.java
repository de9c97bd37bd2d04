package com.ndcheck;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndcheck.logic.Logic;
import com.ndcheck.models.LogicInfo;
import com.ndcheck.models.StepDescriptor;
import com.ndcheck.proof.ErrorKind;
import com.ndcheck.proof.Problem;
import com.ndcheck.proof.ProofResult;
import com.ndcheck.proof.ProofStatus;
import com.ndcheck.storage.EditorLineCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofServiceTest {

    private final ProofService service = new ProofService();

    private static StepDescriptor step(String kind, Integer indent, String text) {
        return new StepDescriptor(kind, indent, text);
    }

    @Test
    void validatesWellFormedProblem() {
        Problem problem = service.validateProblem("TFL", "P → Q, P", "Q");
        assertEquals(Logic.TFL, problem.logic());
        assertEquals(2, problem.premises().size());
        assertEquals("Q", problem.conclusion().toString());
    }

    @Test
    void acceptsModalAliasesAndNoPremises() {
        Problem problem = service.validateProblem("S5", "NA", "□P → P");
        assertEquals(Logic.MLS5, problem.logic());
        assertTrue(problem.premises().isEmpty());
    }

    @Test
    void rejectsUnknownLogic() {
        ProblemException e = assertThrows(ProblemException.class, () -> service.validateProblem("XYZ", "", "P"));
        assertEquals("Unknown logic: \"XYZ\".", e.getMessage());
        assertNull(e.getKind());
    }

    @Test
    void namesTheBadPartOfTheProblem() {
        ProblemException premises = assertThrows(ProblemException.class,
            () -> service.validateProblem("TFL", "P ∧", "Q"));
        assertTrue(premises.getMessage().startsWith(ProofService.INVALID_PREMISES), premises.getMessage());
        assertEquals(ErrorKind.SYNTAX_ERROR, premises.getKind());

        ProblemException missing = assertThrows(ProblemException.class,
            () -> service.validateProblem("TFL", "P", " "));
        assertEquals("Invalid conclusion: A conclusion must be provided.", missing.getMessage());

        ProblemException operator = assertThrows(ProblemException.class,
            () -> service.validateProblem("TFL", "P", "∀xFx"));
        assertTrue(operator.getMessage().startsWith(ProofService.INVALID_CONCLUSION), operator.getMessage());
        assertEquals(ErrorKind.OPERATOR_NOT_SUPPORTED, operator.getKind());
    }

    @Test
    void checksProofFromDescriptors() {
        List<StepDescriptor> steps = List.of(
            step("premise", 0, "P → Q"),
            step("premise", 0, "P"),
            step("line", 0, "Q; →E, 1, 2"));
        ProofResult result = service.checkProof("TFL", "P → Q, P", "Q", steps);
        assertTrue(result.isComplete());
        assertEquals("Proof complete!", result.getMessage());
    }

    @Test
    void rebuildsTextFromSeparateFields() {
        StepDescriptor derived = new StepDescriptor();
        derived.setKind("line");
        derived.setFormulaText("Q");
        derived.setJustText("→E, 1, 2");
        assertEquals("Q; →E, 1, 2", derived.resolveText());
        ProofResult result = service.checkProof("TFL", "P → Q, P", "Q", List.of(derived));
        assertEquals(ProofStatus.COMPLETE, result.getStatus());
    }

    @Test
    void checksProofFromEditorTuples() throws Exception {
        JsonNode tuples = new ObjectMapper().readTree("["
            + "[1,1,\"¬(P ∨ ¬P)\",\"\"],"
            + "[2,1,\"P\",\"\"],"
            + "[2,0,\"P ∨ ¬P\",\"∨I, 2\"],"
            + "[2,0,\"⊥\",\"¬E, 1, 3\"],"
            + "[1,0,\"¬P\",\"¬I, 2-4\"],"
            + "[1,0,\"P ∨ ¬P\",\"∨I, 5\"],"
            + "[1,0,\"⊥\",\"¬E, 1, 6\"],"
            + "[0,0,\"P ∨ ¬P\",\"IP, 1-7\"]]");
        List<JsonNode> rows = new ArrayList<>();
        tuples.forEach(rows::add);
        ProofResult result = service.checkProof("TFL", "", "P ∨ ¬P", EditorLineCodec.decode(rows));
        assertTrue(result.isComplete(), result.getMessage());
    }

    @Test
    void reportsWrongIndentationAsScopeError() {
        List<StepDescriptor> steps = List.of(
            step("premise", 0, "P"),
            step("line", 1, "P; R, 1"));
        ProofResult result = service.checkProof("TFL", "P", "P", steps);
        assertEquals(ProofStatus.ERROR, result.getStatus());
        assertEquals(ErrorKind.SCOPE_ERROR, result.getErrorKind());
        assertTrue(result.getMessage().startsWith("Line 2: "), result.getMessage());
    }

    @Test
    void rejectsUnknownStepKind() {
        List<StepDescriptor> steps = List.of(step("lemma", null, "P; R, 1"));
        ProblemException e = assertThrows(ProblemException.class,
            () -> service.checkProof("TFL", "P", "P", steps));
        assertTrue(e.getMessage().startsWith("Line 1: "), e.getMessage());
    }

    @Test
    void rejectsMissingStep() {
        List<StepDescriptor> steps = Arrays.asList(step("premise", null, "P"), null);
        ProblemException e = assertThrows(ProblemException.class,
            () -> service.checkProof("TFL", "P", "P", steps));
        assertEquals("Line 2: Step is missing.", e.getMessage());
    }

    @Test
    void describesEveryLogic() {
        List<LogicInfo> logics = service.describeLogics();
        assertEquals(Logic.values().length, logics.size());
        LogicInfo tfl = logics.get(0);
        assertEquals("TFL", tfl.getName());
        assertFalse(tfl.isFirstOrder());
        assertTrue(tfl.getRules().contains("→E"));
        assertFalse(tfl.getRules().contains("∀I"));
        LogicInfo s5 = logics.stream().filter(info -> "MLS5".equals(info.getName())).findFirst().orElseThrow();
        assertTrue(s5.getRules().contains("R5"));
        assertEquals("EQUIVALENCE", s5.getWorldDiscipline());
    }
}
