package com.ndcheck;

import com.ndcheck.logic.Logic;
import com.ndcheck.logic.LogicRegistry;
import com.ndcheck.logic.Operator;
import com.ndcheck.logic.Rule;
import com.ndcheck.models.LogicInfo;
import com.ndcheck.models.StepDescriptor;
import com.ndcheck.proof.ErrorKind;
import com.ndcheck.proof.Problem;
import com.ndcheck.proof.ProofDriver;
import com.ndcheck.proof.ProofResult;
import com.ndcheck.proof.ProofStep;
import com.ndcheck.proof.StepDecoder;
import com.ndcheck.proof.StepKind;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.FormulaParser;
import com.ndcheck.syntax.JustificationParser;
import com.ndcheck.syntax.OperatorNotSupportedException;
import com.ndcheck.syntax.SyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The two operations offered to the editor: validating a problem statement and checking
 * a proof of it. Holds no per-call state, so one instance serves every request.
 */
public class ProofService {

    static final String INVALID_PREMISES = "Invalid premise(s): ";
    static final String INVALID_CONCLUSION = "Invalid conclusion: ";

    private final LogicRegistry registry;
    private final FormulaParser formulaParser;
    private final StepDecoder stepDecoder;
    private final ProofDriver driver;

    public ProofService() {
        this(LogicRegistry.standard());
    }

    public ProofService(LogicRegistry registry) {
        this.registry = registry;
        this.formulaParser = new FormulaParser(registry);
        this.stepDecoder = new StepDecoder(formulaParser, new JustificationParser());
        this.driver = new ProofDriver(registry);
    }

    /**
     * Parse the problem statement under the named logic.
     *
     * @throws ProblemException naming the first part that does not parse
     */
    public Problem validateProblem(String logicName, String premisesText, String conclusionText) {
        Logic logic = resolveLogic(logicName);
        List<Formula> premises;
        try {
            premises = formulaParser.parsePremises(premisesText, logic);
        } catch (SyntaxException e) {
            throw new ProblemException(INVALID_PREMISES + e.getMessage(), kindOf(e));
        }
        if (conclusionText == null || conclusionText.isBlank()) {
            throw new ProblemException(INVALID_CONCLUSION + "A conclusion must be provided.", ErrorKind.SYNTAX_ERROR);
        }
        Formula conclusion;
        try {
            conclusion = formulaParser.parseFormula(conclusionText, logic);
        } catch (SyntaxException e) {
            throw new ProblemException(INVALID_CONCLUSION + e.getMessage(), kindOf(e));
        }
        return new Problem(logic, premises, conclusion);
    }

    /**
     * Replay a proof of the problem. Errors inside the proof are reported per line in
     * the result; only an unusable problem or step kind is thrown.
     */
    public ProofResult checkProof(String logicName, String premisesText, String conclusionText,
                                  List<StepDescriptor> descriptors) {
        Problem problem = validateProblem(logicName, premisesText, conclusionText);
        List<ProofStep> steps = new ArrayList<>();
        for (int i = 0; i < descriptors.size(); i++) {
            StepDescriptor descriptor = descriptors.get(i);
            if (descriptor == null) {
                throw new ProblemException("Line " + (i + 1) + ": Step is missing.", null);
            }
            StepKind kind;
            try {
                kind = StepKind.fromWireName(descriptor.getKind());
            } catch (IllegalArgumentException e) {
                int lineNumber = descriptor.getLineNumber() != null ? descriptor.getLineNumber() : i + 1;
                throw new ProblemException("Line " + lineNumber + ": " + e.getMessage(), null);
            }
            int indent = descriptor.getIndent() != null ? descriptor.getIndent() : ProofStep.UNSPECIFIED_INDENT;
            steps.add(stepDecoder.decode(kind, indent, descriptor.resolveText(), problem.logic()));
        }
        ProofResult result = driver.run(problem.logic(), problem.premises(), problem.conclusion(), steps);
        AppLogger.get().info("check-proof " + problem.logic().name() + " -> " + result.getStatus().getWireName());
        return result;
    }

    public List<LogicInfo> describeLogics() {
        List<LogicInfo> out = new ArrayList<>();
        for (Map.Entry<Logic, LogicRegistry.Entry> entry : registry.all().entrySet()) {
            LogicRegistry.Entry row = entry.getValue();
            LogicInfo info = new LogicInfo();
            info.setName(entry.getKey().name());
            info.setFirstOrder(entry.getKey().isFirstOrder());
            info.setModal(entry.getKey().isModal());
            info.setWorldDiscipline(row.getWorldDiscipline().name());
            List<String> operators = new ArrayList<>();
            for (Operator operator : row.getOperators()) {
                operators.add(operator.getLabel());
            }
            info.setOperators(operators);
            List<String> rules = new ArrayList<>();
            for (Rule rule : row.getRules()) {
                rules.add(rule.getSymbol());
            }
            info.setRules(rules);
            out.add(info);
        }
        return out;
    }

    private Logic resolveLogic(String logicName) {
        try {
            return Logic.fromName(logicName);
        } catch (IllegalArgumentException e) {
            throw new ProblemException(e.getMessage(), null);
        }
    }

    private static ErrorKind kindOf(SyntaxException e) {
        return e instanceof OperatorNotSupportedException ? ErrorKind.OPERATOR_NOT_SUPPORTED : ErrorKind.SYNTAX_ERROR;
    }
}
