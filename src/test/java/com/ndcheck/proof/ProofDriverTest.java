package com.ndcheck.proof;

import com.ndcheck.logic.Logic;
import com.ndcheck.logic.LogicRegistry;
import com.ndcheck.logic.SubproofKind;
import com.ndcheck.logic.WorldDiscipline;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.FormulaParser;
import com.ndcheck.syntax.JustificationParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofDriverTest {

    private final LogicRegistry registry = LogicRegistry.standard();
    private final FormulaParser parser = new FormulaParser(registry);
    private final StepDecoder decoder = new StepDecoder(parser, new JustificationParser());
    private final ProofDriver driver = new ProofDriver(registry);

    private static String[] premise(String text) {
        return new String[] {"premise", text};
    }

    private static String[] assume(String text) {
        return new String[] {"assumption", text};
    }

    private static String[] line(String text) {
        return new String[] {"line", text};
    }

    private static String[] close(String text) {
        return new String[] {"close_subproof", text};
    }

    private static String[] reopen(String text) {
        return new String[] {"end_and_begin", text};
    }

    private ProofResult check(Logic logic, String premises, String conclusion, String[]... steps) {
        List<ProofStep> decoded = new ArrayList<>();
        for (String[] step : steps) {
            decoded.add(decoder.decode(StepKind.fromWireName(step[0]), ProofStep.UNSPECIFIED_INDENT, step[1], logic));
        }
        return driver.run(logic, parser.parsePremises(premises, logic), parser.parseFormula(conclusion, logic), decoded);
    }

    private static LineResult resultFor(ProofResult result, int lineNumber) {
        return result.getLineResults().get(lineNumber - 1);
    }

    private static void assertComplete(ProofResult result) {
        assertTrue(result.isComplete(), result.getMessage() + " / " + result.getIncompleteReason());
        assertEquals(ProofStatus.COMPLETE, result.getStatus());
        assertEquals(ProofResult.COMPLETE_MESSAGE, result.getMessage());
        assertNull(result.getErrorKind());
    }

    private static void assertFailsAt(ProofResult result, int lineNumber, ErrorKind kind) {
        assertFalse(result.isComplete());
        assertEquals(ProofStatus.ERROR, result.getStatus());
        LineResult line = resultFor(result, lineNumber);
        assertFalse(line.isOk(), "line " + lineNumber + " should fail");
        assertEquals(kind, line.getErrorKind(), line.getMessage());
    }

    @Test
    void modusPonensWithPremiseSteps() {
        ProofResult result = check(Logic.TFL, "P → Q, P", "Q",
            premise("P → Q"), premise("P"), line("Q; →E, 1,2"));
        assertComplete(result);
        assertEquals(3, result.getLineResults().size());
        assertTrue(result.getLineResults().stream().allMatch(LineResult::isOk));
    }

    @Test
    void premisesAreReplayedWhenOmitted() {
        ProofResult result = check(Logic.TFL, "P → Q, P", "Q", line("Q; →E, 1, 2"));
        assertComplete(result);
        assertEquals(LineRole.PREMISE, result.getLines().get(0).getRole());
        assertEquals(3, result.getLines().size());
    }

    @Test
    void excludedMiddleByIndirectProof() {
        ProofResult result = check(Logic.TFL, "", "P ∨ ¬P",
            assume("¬(P ∨ ¬P)"),
            assume("P"),
            line("P ∨ ¬P; ∨I, 2"),
            line("⊥; ¬E, 1, 3"),
            close("¬P; ¬I, 2-4"),
            line("P ∨ ¬P; ∨I, 5"),
            line("⊥; ¬E, 1, 6"),
            close("P ∨ ¬P; IP, 1-7"));
        assertComplete(result);
        assertEquals(0, result.getLines().get(7).getDepth());
        assertEquals(2, result.getLines().get(3).getDepth());
    }

    @Test
    void rejectsCitationOfFutureLine() {
        ProofResult result = check(Logic.TFL, "P → Q, P", "Q",
            premise("P → Q"), premise("P"), line("Q; →E, 1,4"));
        assertFailsAt(result, 3, ErrorKind.SCOPE_ERROR);
        assertTrue(result.getMessage().startsWith("Line 3: "), result.getMessage());
    }

    @Test
    void rejectsCitationIntoClosedSubproof() {
        ProofResult result = check(Logic.TFL, "P → Q", "Q",
            premise("P → Q"),
            assume("P"),
            line("P; R, 2"),
            close("P → P; →I, 2-3"),
            line("Q; →E, 1, 2"));
        assertTrue(resultFor(result, 4).isOk());
        assertFailsAt(result, 5, ErrorKind.SCOPE_ERROR);
        assertEquals("→E: line 2 lies inside a closed subproof.", resultFor(result, 5).getMessage());
    }

    @Test
    void rejectsRangeOfSubproofClosedInsideAnother() {
        ProofResult valid = check(Logic.TFL, "", "P → (Q → Q)",
            assume("P"),
            assume("Q"),
            line("Q; R, 2"),
            close("Q → Q; →I, 2-3"),
            close("P → (Q → Q); →I, 1-4"));
        assertComplete(valid);

        ProofResult reused = check(Logic.TFL, "", "Q → Q",
            assume("P"),
            assume("Q"),
            line("Q; R, 2"),
            close("Q → Q; →I, 2-3"),
            close("P → (Q → Q); →I, 1-4"),
            line("Q → Q; →I, 2-3"));
        assertFailsAt(reused, 6, ErrorKind.SCOPE_ERROR);
    }

    @Test
    void reportsUnknownRuleAndCitationShape() {
        assertFailsAt(check(Logic.TFL, "P → Q, P", "Q", line("Q; MP, 1, 2")), 3, ErrorKind.UNKNOWN_RULE);
        assertFailsAt(check(Logic.TFL, "P → Q, P", "Q", line("Q; →E, 1")), 3, ErrorKind.RULE_MISMATCH);
        assertFailsAt(check(Logic.TFL, "P → Q, P", "Q", line("Q; ∧I, 1, 2")), 3, ErrorKind.RULE_MISMATCH);
        assertFailsAt(check(Logic.TFL, "P", "P", line("P; ∀E, 1")), 2, ErrorKind.UNKNOWN_RULE);
    }

    @Test
    void malformedLinesStillTakeTheirNumber() {
        ProofResult result = check(Logic.TFL, "P → Q, P", "Q",
            line("Q ∧; →E, 1, 2"),
            line("Q; →E, 1, 2"));
        assertFailsAt(result, 3, ErrorKind.SYNTAX_ERROR);
        assertTrue(resultFor(result, 4).isOk());
        assertEquals(4, result.getLines().size());
        assertFalse(result.getLines().get(2).isEstablished());
    }

    @Test
    void operatorOutsideLogicIsReportedPerLine() {
        ProofResult result = check(Logic.TFL, "P", "P", line("∀xFx; R, 1"));
        assertFailsAt(result, 2, ErrorKind.OPERATOR_NOT_SUPPORTED);
    }

    @Test
    void missingJustificationIsSyntaxError() {
        ProofResult result = check(Logic.TFL, "P", "P", line("P"));
        assertFailsAt(result, 2, ErrorKind.SYNTAX_ERROR);
        assertEquals("Justification is missing.", resultFor(result, 2).getMessage());
    }

    @Test
    void laterLinesCannotLeanOnFailedLines() {
        ProofResult result = check(Logic.TFL, "P → Q, P", "Q",
            line("R; →E, 1, 2"),
            line("Q; →E, 1, 2"),
            line("R; R, 3"));
        assertFailsAt(result, 3, ErrorKind.RULE_MISMATCH);
        assertTrue(resultFor(result, 4).isOk());
        assertFailsAt(result, 5, ErrorKind.RULE_MISMATCH);
        assertEquals("R: line 3 is not established.", resultFor(result, 5).getMessage());
    }

    @Test
    void premiseStepsMustMatchStatedPremises() {
        ProofResult result = check(Logic.TFL, "P → Q, P", "Q",
            premise("P"), premise("P → Q"), line("Q; →E, 2, 1"));
        assertFailsAt(result, 1, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void premisesMustComeFirst() {
        ProofResult result = check(Logic.TFL, "P", "P",
            premise("P"), line("P; R, 1"), premise("P"));
        assertFailsAt(result, 3, ErrorKind.SCOPE_ERROR);
    }

    @Test
    void closingWithoutOpenSubproofIsScopeError() {
        ProofResult result = check(Logic.TFL, "P", "P", close("P; R, 1"));
        assertFailsAt(result, 2, ErrorKind.SCOPE_ERROR);
    }

    @Test
    void reportsIncompleteProofs() {
        ProofResult noDerivation = check(Logic.TFL, "P → Q, P", "Q", premise("P → Q"), premise("P"));
        assertEquals(ProofStatus.INCOMPLETE, noDerivation.getStatus());
        assertEquals(ErrorKind.INCOMPLETE_PROOF, noDerivation.getErrorKind());
        assertEquals(ProofResult.INCOMPLETE_MESSAGE, noDerivation.getMessage());
        assertEquals("The last line must be derived by a rule.", noDerivation.getIncompleteReason());

        ProofResult open = check(Logic.TFL, "", "P → P", assume("P"));
        assertEquals(ProofStatus.INCOMPLETE, open.getStatus());
        assertEquals("1 subproof is still open.", open.getIncompleteReason());

        ProofResult wrongEnd = check(Logic.TFL, "P ∧ Q", "Q", line("P; ∧E, 1"));
        assertEquals(ProofStatus.INCOMPLETE, wrongEnd.getStatus());
        assertEquals("The last line is not the conclusion Q.", wrongEnd.getIncompleteReason());

        ProofResult empty = check(Logic.TFL, "", "P → P");
        assertEquals("The proof has no lines.", empty.getIncompleteReason());
    }

    @Test
    void repeatingAPremiseCompletesTheProof() {
        assertComplete(check(Logic.TFL, "P", "P", line("P; R, 1")));
    }

    @Test
    void disjunctionEliminationWithSiblingSubproofs() {
        ProofResult result = check(Logic.TFL, "P ∨ Q", "Q ∨ P",
            premise("P ∨ Q"),
            assume("P"),
            line("Q ∨ P; ∨I, 2"),
            reopen("Q"),
            line("Q ∨ P; ∨I, 4"),
            close("Q ∨ P; ∨E, 1, 2-3, 4-5"));
        assertComplete(result);
        assertEquals(1, result.getLines().get(3).getDepth());
    }

    @Test
    void derivedTruthFunctionalRules() {
        assertComplete(check(Logic.TFL, "P → Q, ¬Q", "¬P", line("¬P; MT, 1, 2")));
        assertComplete(check(Logic.TFL, "P ∨ Q, ¬P", "Q", line("Q; DS, 1, 2")));
        assertComplete(check(Logic.TFL, "¬(P ∧ Q)", "¬P ∨ ¬Q", line("¬P ∨ ¬Q; DeM, 1")));
        assertComplete(check(Logic.TFL, "¬¬P", "P", line("P; DNE, 1")));
        assertComplete(check(Logic.TFL, "⊥", "Q", line("Q; X, 1")));
    }

    @Test
    void biconditionalIntroductionTakesSubproofsInEitherOrder() {
        assertComplete(check(Logic.TFL, "P → Q, Q → P", "P ↔ Q",
            premise("P → Q"),
            premise("Q → P"),
            assume("P"),
            line("Q; →E, 1, 3"),
            reopen("Q"),
            line("P; →E, 2, 5"),
            close("P ↔ Q; ↔I, 3-4, 5-6")));
        assertComplete(check(Logic.TFL, "P → Q, Q → P", "P ↔ Q",
            premise("P → Q"),
            premise("Q → P"),
            assume("Q"),
            line("P; →E, 2, 3"),
            reopen("P"),
            line("Q; →E, 1, 5"),
            close("P ↔ Q; ↔I, 3-4, 5-6")));
    }

    @Test
    void biconditionalIntroductionNeedsBothDirections() {
        ProofResult result = check(Logic.TFL, "P → Q", "P ↔ Q",
            premise("P → Q"),
            assume("P"),
            line("Q; →E, 1, 2"),
            reopen("Q"),
            line("Q; R, 4"),
            close("P ↔ Q; ↔I, 2-3, 4-5"));
        assertFailsAt(result, 6, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void biconditionalEliminationRunsBothWays() {
        assertComplete(check(Logic.TFL, "P ↔ Q, P", "Q", line("Q; ↔E, 1, 2")));
        assertComplete(check(Logic.TFL, "P ↔ Q, Q", "P", line("P; ↔E, 2, 1")));
        assertFailsAt(check(Logic.TFL, "P ↔ Q, P", "Q", line("P; ↔E, 1, 2")), 3, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void excludedMiddleWithSiblingSubproofs() {
        ProofResult result = check(Logic.TFL, "P → Q, ¬P → Q", "Q",
            premise("P → Q"),
            premise("¬P → Q"),
            assume("P"),
            line("Q; →E, 1, 3"),
            reopen("¬P"),
            line("Q; →E, 2, 5"),
            close("Q; LEM, 3-4, 5-6"));
        assertComplete(result);
        assertEquals(1, result.getLines().get(4).getDepth());
    }

    @Test
    void excludedMiddleNeedsComplementaryAssumptions() {
        ProofResult result = check(Logic.TFL, "P → Q", "Q",
            premise("P → Q"),
            assume("P"),
            line("Q; →E, 1, 2"),
            reopen("Q"),
            line("Q; R, 4"),
            close("Q; LEM, 2-3, 4-5"));
        assertFailsAt(result, 6, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void quantifierConversionInBothDirections() {
        assertComplete(check(Logic.FOL, "∀x¬Fx", "¬∃xFx", line("¬∃xFx; CQ, 1")));
        assertComplete(check(Logic.FOL, "¬∃xFx", "∀x¬Fx", line("∀x¬Fx; CQ, 1")));
        assertComplete(check(Logic.FOL, "∃x¬Fx", "¬∀xFx", line("¬∀xFx; CQ, 1")));
        assertComplete(check(Logic.FOL, "¬∀xFx", "∃x¬Fx", line("∃x¬Fx; CQ, 1")));
        assertFailsAt(check(Logic.FOL, "∀x¬Fx", "¬∀xFx", line("¬∀xFx; CQ, 1")), 2, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void possibilityDefinitionInBothDirections() {
        assertComplete(check(Logic.MLK, "♢P", "¬□¬P", line("¬□¬P; Def♢, 1")));
        assertComplete(check(Logic.MLK, "¬□¬P", "♢P", line("♢P; Def♢, 1")));
        assertFailsAt(check(Logic.MLK, "♢P", "¬□P", line("¬□P; Def♢, 1")), 2, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void modalConversionInBothDirections() {
        assertComplete(check(Logic.MLK, "¬□P", "♢¬P", line("♢¬P; MC, 1")));
        assertComplete(check(Logic.MLK, "♢¬P", "¬□P", line("¬□P; MC, 1")));
        assertComplete(check(Logic.MLK, "¬♢P", "□¬P", line("□¬P; MC, 1")));
        assertComplete(check(Logic.MLK, "□¬P", "¬♢P", line("¬♢P; MC, 1")));
        assertFailsAt(check(Logic.MLK, "¬□P", "□¬P", line("□¬P; MC, 1")), 2, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void possibilityIntroductionNeedsReflexiveFrames() {
        assertComplete(check(Logic.MLT, "P", "♢P", line("♢P; ♢I, 1")));
        assertComplete(check(Logic.MLS5, "P", "♢P", line("♢P; ♢I, 1")));
        assertFailsAt(check(Logic.MLT, "P", "♢Q", line("♢Q; ♢I, 1")), 2, ErrorKind.RULE_MISMATCH);

        ProofResult underK = check(Logic.MLK, "P", "♢P", line("♢P; ♢I, 1"));
        assertFailsAt(underK, 2, ErrorKind.UNKNOWN_RULE);
        assertEquals("Rule ♢I is not available in MLK.", resultFor(underK, 2).getMessage());
    }

    @Test
    void necessityEliminationFollowsTheRegisteredDiscipline() {
        LogicRegistry reflexiveK = new LogicRegistry()
            .register(new LogicRegistry.Entry(Logic.MLK, registry.operatorsFor(Logic.MLK),
                LogicRegistry.availableRules(Logic.MLK, WorldDiscipline.REFLEXIVE), WorldDiscipline.REFLEXIVE))
            .freeze();
        ProofDriver reflexiveDriver = new ProofDriver(reflexiveK);
        List<ProofStep> steps = List.of(decoder.decode(StepKind.LINE, ProofStep.UNSPECIFIED_INDENT, "P; □E, 1", Logic.MLK));

        ProofResult result = reflexiveDriver.run(Logic.MLK, parser.parsePremises("□P", Logic.MLK),
            parser.parseFormula("P", Logic.MLK), steps);
        assertComplete(result);
        assertFailsAt(driver.run(Logic.MLK, parser.parsePremises("□P", Logic.MLK),
            parser.parseFormula("P", Logic.MLK), steps), 2, ErrorKind.SCOPE_ERROR);
    }

    @Test
    void universalGeneralization() {
        ProofResult result = check(Logic.FOL, "∀x(Fx ∧ Gx)", "∀xFx",
            premise("∀x(Fx ∧ Gx)"),
            line("Fa ∧ Ga; ∀E, 1"),
            line("Fa; ∧E, 2"),
            line("∀xFx; ∀I, 3"));
        assertComplete(result);
    }

    @Test
    void universalGeneralizationNeedsFreshConstant() {
        ProofResult result = check(Logic.FOL, "", "Fa → ∀xFx",
            assume("Fa"),
            line("∀xFx; ∀I, 1"));
        assertFailsAt(result, 2, ErrorKind.FRESHNESS_VIOLATION);

        ProofResult stillThere = check(Logic.FOL, "Raa", "∀xRxa", line("∀xRxa; ∀I, 1"));
        assertFailsAt(stillThere, 2, ErrorKind.FRESHNESS_VIOLATION);
    }

    @Test
    void existentialElimination() {
        ProofResult result = check(Logic.FOL, "∃xFx, ∀x(Fx → Gx)", "∃xGx",
            premise("∃xFx"),
            premise("∀x(Fx → Gx)"),
            assume("Fa"),
            line("Fa → Ga; ∀E, 2"),
            line("Ga; →E, 4, 3"),
            line("∃xGx; ∃I, 5"),
            close("∃xGx; ∃E, 1, 3-6"));
        assertComplete(result);
    }

    @Test
    void existentialWitnessMustBeFresh() {
        ProofResult result = check(Logic.FOL, "∃xFx, Ga", "∃x(Fx ∧ Gx)",
            premise("∃xFx"),
            premise("Ga"),
            assume("Fa"),
            line("Fa ∧ Ga; ∧I, 3, 2"),
            line("∃x(Fx ∧ Gx); ∃I, 4"),
            close("∃x(Fx ∧ Gx); ∃E, 1, 3-5"));
        assertTrue(resultFor(result, 5).isOk());
        assertFailsAt(result, 6, ErrorKind.FRESHNESS_VIOLATION);
    }

    @Test
    void instantiationMustNotCaptureVariables() {
        ProofResult result = check(Logic.FOL, "∀x∃yRxy", "∃yRyy", line("∃yRyy; ∀E, 1"));
        assertFailsAt(result, 2, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void identityRules() {
        assertComplete(check(Logic.FOL, "a = b, Fa", "Fb", line("Fb; =E, 1, 2")));
        assertComplete(check(Logic.FOL, "", "a = a", line("a = a; =I")));
        assertFailsAt(check(Logic.FOL, "a = b, Fa", "Fc", line("Fc; =E, 1, 2")), 3, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void necessityEliminationNeedsOneWorldStepInK() {
        assertFailsAt(check(Logic.MLK, "□P", "P", line("P; □E, 1")), 2, ErrorKind.SCOPE_ERROR);
        assertComplete(check(Logic.MLT, "□P", "P", line("P; □E, 1")));
        assertComplete(check(Logic.MLT, "□P", "P", line("P; RT, 1")));
    }

    @Test
    void necessityIntroductionInK() {
        ProofResult result = check(Logic.MLK, "□(P → Q), □P", "□Q",
            premise("□(P → Q)"),
            premise("□P"),
            assume("□"),
            line("P → Q; □E, 1"),
            line("P; □E, 2"),
            line("Q; →E, 4, 5"),
            close("□Q; □I, 3-6"));
        assertComplete(result);
        assertTrue(result.getLines().get(2).isWorldMarker());
    }

    @Test
    void reiterationDoesNotCrossWorlds() {
        ProofResult result = check(Logic.MLK, "P", "□P",
            assume("□"),
            line("P; R, 1"),
            close("□P; □I, 2-3"));
        assertFailsAt(result, 3, ErrorKind.SCOPE_ERROR);
    }

    @Test
    void worldMarkerNeedsModalLogic() {
        ProofResult result = check(Logic.TFL, "P", "P", assume("□"), line("P; R, 1"));
        assertFailsAt(result, 2, ErrorKind.OPERATOR_NOT_SUPPORTED);
    }

    @Test
    void nestedWorldsNeedTransitivity() {
        String[][] steps = {
            premise("□P"),
            assume("□"),
            assume("□"),
            line("P; □E, 1"),
            close("□P; □I, 3-4"),
            close("□□P; □I, 2-5")
        };
        assertComplete(check(Logic.MLS4, "□P", "□□P", steps));
        assertFailsAt(check(Logic.MLK, "□P", "□□P", steps), 4, ErrorKind.SCOPE_ERROR);
    }

    @Test
    void transitivityRuleOnlyInS4AndAbove() {
        String[][] steps = {
            premise("□P"),
            assume("□"),
            line("□P; R4, 1"),
            close("□□P; □I, 2-3")
        };
        assertComplete(check(Logic.MLS4, "□P", "□□P", steps));
        assertComplete(check(Logic.MLS5, "□P", "□□P", steps));
        ProofResult underT = check(Logic.MLT, "□P", "□□P", steps);
        assertFailsAt(underT, 3, ErrorKind.UNKNOWN_RULE);
        assertEquals("Rule R4 is not available in MLT.", resultFor(underT, 3).getMessage());
    }

    @Test
    void euclideanRuleOnlyInS5() {
        String[][] steps = {
            premise("♢P"),
            assume("□"),
            line("♢P; R5, 1"),
            close("□♢P; □I, 2-3")
        };
        assertComplete(check(Logic.MLS5, "♢P", "□♢P", steps));
        assertFailsAt(check(Logic.MLS4, "♢P", "□♢P", steps), 3, ErrorKind.UNKNOWN_RULE);
    }

    @Test
    void possibilityElimination() {
        ProofResult result = check(Logic.MLK, "♢P, □(P → Q)", "♢Q",
            premise("♢P"),
            premise("□(P → Q)"),
            assume("□: P"),
            line("P → Q; □E, 2"),
            line("Q; →E, 4, 3"),
            close("♢Q; ♢E, 1, 3-5"));
        assertComplete(result);
        assertEquals(SubproofKind.HYPOTHETICAL_WORLD, result.getLines().get(2).getOpens());
        assertEquals(Formula.letter("P"), result.getLines().get(2).getFormula());
    }

    @Test
    void rangeMustBeTheRightKindOfSubproof() {
        ProofResult result = check(Logic.MLK, "P", "P → P",
            assume("P"),
            line("P; R, 2"),
            close("P → P; □I, 2-3"));
        assertFailsAt(result, 4, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void checkingTwiceGivesTheSameVerdict() {
        String[][] steps = {
            assume("¬(P ∨ ¬P)"),
            assume("P"),
            line("P ∨ ¬P; ∨I, 2"),
            line("⊥; ¬E, 1, 2"),
            close("¬P; ¬I, 2-4")
        };
        ProofResult first = check(Logic.TFL, "", "P ∨ ¬P", steps);
        ProofResult second = check(Logic.TFL, "", "P ∨ ¬P", steps);
        assertEquals(first.getLineResults(), second.getLineResults());
        assertEquals(first.getStatus(), second.getStatus());
        assertEquals(first.getMessage(), second.getMessage());
        assertEquals(first.getLines().size(), second.getLines().size());
        assertFailsAt(first, 4, ErrorKind.RULE_MISMATCH);
    }

    @Test
    void explicitIndentMustMatchDepth() {
        List<ProofStep> steps = List.of(
            decoder.decode(StepKind.PREMISE, 0, "P", Logic.TFL),
            decoder.decode(StepKind.LINE, 1, "P; R, 1", Logic.TFL));
        ProofResult result = driver.run(Logic.TFL, parser.parsePremises("P", Logic.TFL),
            parser.parseFormula("P", Logic.TFL), steps);
        assertFailsAt(result, 2, ErrorKind.SCOPE_ERROR);
    }
}
