package com.ndcheck.proof;

import com.ndcheck.logic.Logic;
import com.ndcheck.logic.Operator;
import com.ndcheck.logic.SubproofKind;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.FormulaParser;
import com.ndcheck.syntax.Justification;
import com.ndcheck.syntax.JustificationParser;
import com.ndcheck.syntax.OperatorNotSupportedException;
import com.ndcheck.syntax.SyntaxException;

/**
 * Turns the text of one step into a {@link ProofStep}. Text that cannot be read becomes
 * a {@link ProofStep.Malformed} step rather than an exception, so the driver can keep
 * the proof's shape.
 *
 * <p>Assumption text {@code □} opens a world subproof; {@code □: A} opens a world in
 * which A is assumed.
 */
public class StepDecoder {

    static final String WORLD_MARKER = "□";
    private static final String HYPOTHESIS_PREFIX = "□:";

    private final FormulaParser formulaParser;
    private final JustificationParser justificationParser;

    public StepDecoder(FormulaParser formulaParser, JustificationParser justificationParser) {
        this.formulaParser = formulaParser;
        this.justificationParser = justificationParser;
    }

    public ProofStep decode(StepKind kind, int indent, String text, Logic logic) {
        JustificationParser.StepText parts = justificationParser.splitStepLine(text);
        String source = text == null ? "" : text.trim();
        if (parts.formula().isEmpty()) {
            return new ProofStep.Malformed(indent, kind, ErrorKind.SYNTAX_ERROR, "Formula is missing.", source);
        }
        try {
            switch (kind) {
                case PREMISE:
                    return new ProofStep.Premise(indent, formulaParser.parseFormula(parts.formula(), logic));
                case ASSUMPTION:
                case END_AND_BEGIN:
                    return decodeAssumption(kind, indent, parts.formula(), logic);
                case LINE:
                case CLOSE_SUBPROOF:
                    if (parts.justification() == null || parts.justification().isEmpty()) {
                        return new ProofStep.Malformed(indent, kind, ErrorKind.SYNTAX_ERROR, "Justification is missing.", source);
                    }
                    Formula formula = formulaParser.parseFormula(parts.formula(), logic);
                    Justification justification = justificationParser.parse(parts.justification());
                    return kind == StepKind.LINE
                        ? new ProofStep.Line(indent, formula, justification)
                        : new ProofStep.CloseSubproof(indent, formula, justification);
                default:
                    throw new IllegalStateException("Unhandled step kind " + kind);
            }
        } catch (OperatorNotSupportedException e) {
            return new ProofStep.Malformed(indent, kind, ErrorKind.OPERATOR_NOT_SUPPORTED, e.getMessage(), source);
        } catch (SyntaxException e) {
            return new ProofStep.Malformed(indent, kind, ErrorKind.SYNTAX_ERROR, e.getMessage(), source);
        }
    }

    private ProofStep decodeAssumption(StepKind kind, int indent, String text, Logic logic) {
        SubproofKind subproofKind = SubproofKind.ORDINARY;
        Formula formula = null;
        if (WORLD_MARKER.equals(text)) {
            requireModal(logic);
            subproofKind = SubproofKind.WORLD;
        } else if (text.startsWith(HYPOTHESIS_PREFIX)) {
            requireModal(logic);
            subproofKind = SubproofKind.HYPOTHETICAL_WORLD;
            formula = formulaParser.parseFormula(text.substring(HYPOTHESIS_PREFIX.length()), logic);
        } else {
            formula = formulaParser.parseFormula(text, logic);
        }
        return kind == StepKind.ASSUMPTION
            ? new ProofStep.Assumption(indent, formula, subproofKind)
            : new ProofStep.CloseAndReopen(indent, formula, subproofKind);
    }

    private void requireModal(Logic logic) {
        if (!logic.isModal()) {
            throw new OperatorNotSupportedException(Operator.NECESSARILY, logic);
        }
    }
}
