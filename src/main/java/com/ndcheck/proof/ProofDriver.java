package com.ndcheck.proof;

import com.ndcheck.AppLogger;
import com.ndcheck.logic.Logic;
import com.ndcheck.logic.LogicRegistry;
import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.Justification;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays proof steps against a fresh {@link ContextStack}, verifying each derived line
 * and reporting a verdict per line plus one for the whole proof.
 *
 * <p>A failed step still produces its line (marked as not established) and still opens
 * or closes its subproof, so later lines are numbered and nested as the author wrote
 * them and independent lines are still checked.
 */
public class ProofDriver {

    private final RuleVerifier verifier;

    public ProofDriver(LogicRegistry registry) {
        this.verifier = new RuleVerifier(registry);
    }

    /**
     * When {@code steps} contains no premise step the stated premises are replayed
     * first; otherwise the premise steps must repeat them in order.
     */
    public ProofResult run(Logic logic, List<Formula> premises, Formula conclusion, List<ProofStep> steps) {
        Run run = new Run(logic, premises);
        if (steps.stream().noneMatch(step -> step.stepKind() == StepKind.PREMISE)) {
            for (Formula premise : premises) {
                run.apply(ProofStep.premise(premise));
            }
        }
        for (ProofStep step : steps) {
            run.apply(step);
        }
        return run.finish(conclusion);
    }

    private final class Run {
        private final Logic logic;
        private final List<Formula> premises;
        private final ContextStack stack = new ContextStack();
        private final List<LineResult> results = new ArrayList<>();
        private int premiseCursor;
        private boolean pastPremises;

        Run(Logic logic, List<Formula> premises) {
            this.logic = logic;
            this.premises = premises;
        }

        void apply(ProofStep step) {
            int index = stack.nextIndex();
            VerificationException error = null;
            if (step instanceof ProofStep.Malformed) {
                ProofStep.Malformed malformed = (ProofStep.Malformed) step;
                error = new VerificationException(malformed.error(), index, malformed.message());
            }
            switch (step.stepKind()) {
                case PREMISE:
                    error = firstOf(error, checkPremise(step, index));
                    Formula premise = formulaOf(step);
                    stack.append(premise, LineRole.PREMISE, null, error == null, sourceOf(step));
                    break;
                case ASSUMPTION:
                    pastPremises = true;
                    error = firstOf(error, checkIndent(step, index, stack.depth() + 1));
                    openSubproof(step, error);
                    break;
                case END_AND_BEGIN:
                    pastPremises = true;
                    if (stack.hasOpenSubproof()) {
                        error = firstOf(error, checkIndent(step, index, stack.depth()));
                        stack.closeSubproof();
                    } else {
                        error = firstOf(error, new VerificationException(ErrorKind.SCOPE_ERROR, index,
                            "There is no open subproof to end."));
                    }
                    openSubproof(step, error);
                    break;
                case LINE:
                    pastPremises = true;
                    error = firstOf(error, checkIndent(step, index, stack.depth()));
                    derive(step, index, error);
                    return;
                case CLOSE_SUBPROOF:
                    pastPremises = true;
                    if (stack.hasOpenSubproof()) {
                        stack.closeSubproof();
                    } else {
                        error = firstOf(error, new VerificationException(ErrorKind.SCOPE_ERROR, index,
                            "There is no open subproof to close."));
                    }
                    error = firstOf(error, checkIndent(step, index, stack.depth()));
                    derive(step, index, error);
                    return;
                default:
                    throw new IllegalStateException("Unhandled step kind " + step.stepKind());
            }
            record(index, error);
        }

        private void derive(ProofStep step, int index, VerificationException earlier) {
            VerificationException error = earlier;
            Formula formula = formulaOf(step);
            Justification justification = justificationOf(step);
            if (error == null) {
                try {
                    verifier.verify(logic, stack, formula, justification);
                } catch (VerificationException e) {
                    error = e;
                }
            }
            stack.append(formula, LineRole.DERIVED, justification, error == null, sourceOf(step));
            record(index, error);
        }

        private void openSubproof(ProofStep step, VerificationException error) {
            SubproofKind kind = SubproofKind.ORDINARY;
            if (step instanceof ProofStep.Assumption) {
                kind = ((ProofStep.Assumption) step).subproofKind();
            } else if (step instanceof ProofStep.CloseAndReopen) {
                kind = ((ProofStep.CloseAndReopen) step).subproofKind();
            }
            stack.openSubproof(formulaOf(step), kind, error == null, sourceOf(step));
        }

        private VerificationException checkPremise(ProofStep step, int index) {
            if (pastPremises || stack.hasOpenSubproof()) {
                return new VerificationException(ErrorKind.SCOPE_ERROR, index,
                    "Premises must come first, outside every subproof.");
            }
            VerificationException indent = checkIndent(step, index, 0);
            if (indent != null) {
                return indent;
            }
            int position = premiseCursor++;
            Formula premise = formulaOf(step);
            if (premise == null) {
                return null;
            }
            if (position >= premises.size()) {
                return new VerificationException(ErrorKind.RULE_MISMATCH, index,
                    premise + " is not a premise of the problem.");
            }
            if (!premises.get(position).equals(premise)) {
                return new VerificationException(ErrorKind.RULE_MISMATCH, index,
                    "Premise " + (position + 1) + " is " + premises.get(position) + ", found " + premise + ".");
            }
            return null;
        }

        private VerificationException checkIndent(ProofStep step, int index, int expected) {
            if (step.indent() == ProofStep.UNSPECIFIED_INDENT || step.indent() == expected) {
                return null;
            }
            return new VerificationException(ErrorKind.SCOPE_ERROR, index,
                "Line is indented at level " + step.indent() + " but belongs at level " + expected + ".");
        }

        private void record(int index, VerificationException error) {
            if (error == null) {
                results.add(LineResult.ok(index));
            } else {
                results.add(LineResult.error(index, error.getKind(), error.getMessage()));
            }
        }

        ProofResult finish(Formula conclusion) {
            List<ProofLine> lines = stack.lines();
            for (LineResult result : results) {
                if (!result.isOk()) {
                    log(false);
                    return new ProofResult(results, lines, ProofStatus.ERROR,
                        "Line " + result.getLineNumber() + ": " + result.getMessage(),
                        result.getErrorKind(), null);
                }
            }
            String reason = incompleteReason(lines, conclusion);
            log(reason == null);
            if (reason != null) {
                return new ProofResult(results, lines, ProofStatus.INCOMPLETE, ProofResult.INCOMPLETE_MESSAGE,
                    ErrorKind.INCOMPLETE_PROOF, reason);
            }
            return new ProofResult(results, lines, ProofStatus.COMPLETE, ProofResult.COMPLETE_MESSAGE,
                null, null);
        }

        private String incompleteReason(List<ProofLine> lines, Formula conclusion) {
            if (stack.hasOpenSubproof()) {
                int open = stack.openFrames().size();
                return open == 1 ? "1 subproof is still open." : open + " subproofs are still open.";
            }
            if (lines.isEmpty()) {
                return "The proof has no lines.";
            }
            ProofLine last = lines.get(lines.size() - 1);
            if (last.getRole() != LineRole.DERIVED) {
                return "The last line must be derived by a rule.";
            }
            if (!conclusion.equals(last.getFormula())) {
                return "The last line is not the conclusion " + conclusion + ".";
            }
            return null;
        }

        private void log(boolean complete) {
            AppLogger.get().info("Checked " + logic.name() + " proof: " + stack.lines().size()
                + " lines, " + (complete ? "complete" : "not complete"));
        }
    }

    private static VerificationException firstOf(VerificationException first, VerificationException second) {
        return first != null ? first : second;
    }

    private static Formula formulaOf(ProofStep step) {
        if (step instanceof ProofStep.Premise) {
            return ((ProofStep.Premise) step).formula();
        }
        if (step instanceof ProofStep.Assumption) {
            return ((ProofStep.Assumption) step).formula();
        }
        if (step instanceof ProofStep.Line) {
            return ((ProofStep.Line) step).formula();
        }
        if (step instanceof ProofStep.CloseSubproof) {
            return ((ProofStep.CloseSubproof) step).formula();
        }
        if (step instanceof ProofStep.CloseAndReopen) {
            return ((ProofStep.CloseAndReopen) step).formula();
        }
        return null;
    }

    private static Justification justificationOf(ProofStep step) {
        if (step instanceof ProofStep.Line) {
            return ((ProofStep.Line) step).justification();
        }
        if (step instanceof ProofStep.CloseSubproof) {
            return ((ProofStep.CloseSubproof) step).justification();
        }
        return null;
    }

    private static String sourceOf(ProofStep step) {
        if (step instanceof ProofStep.Malformed) {
            return ((ProofStep.Malformed) step).source();
        }
        Formula formula = formulaOf(step);
        if (formula == null) {
            return StepDecoder.WORLD_MARKER;
        }
        return formula.toString();
    }
}
