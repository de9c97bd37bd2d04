package com.ndcheck.proof;

import com.ndcheck.logic.Logic;
import com.ndcheck.logic.LogicRegistry;
import com.ndcheck.logic.Rule;
import com.ndcheck.logic.WorldDiscipline;
import com.ndcheck.syntax.Citation;
import com.ndcheck.syntax.Formula;
import com.ndcheck.syntax.Formulas;
import com.ndcheck.syntax.Justification;
import com.ndcheck.syntax.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a derived formula follows by the named rule from the cited lines and
 * subproofs. Stateless; the proof state arrives as a read-only {@link ContextView}.
 */
public class RuleVerifier {

    private final LogicRegistry registry;

    public RuleVerifier(LogicRegistry registry) {
        this.registry = registry;
    }

    /**
     * Verify one Line or CloseSubproof step that is about to become line
     * {@code context.nextIndex()}.
     *
     * @return the rule the justification resolved to
     * @throws VerificationException if the step is not a correct application
     */
    public Rule verify(Logic logic, ContextView context, Formula formula, Justification justification) {
        int at = context.nextIndex();
        String name = justification.getRule();
        Rule rule = registry.resolveRule(logic, name);
        if (rule == null) {
            Rule known = Rule.fromSymbol(name);
            String message = known == null
                ? "Unknown rule \"" + name + "\"."
                : "Rule " + known.getSymbol() + " is not available in " + logic.name() + ".";
            throw new VerificationException(ErrorKind.UNKNOWN_RULE, at, message);
        }
        List<Citation.LineRef> lineRefs = justification.lineRefs();
        List<Citation.RangeRef> rangeRefs = justification.rangeRefs();
        if (lineRefs.size() != rule.getLineCitations() || rangeRefs.size() != rule.getRangeCitations()) {
            throw new VerificationException(ErrorKind.RULE_MISMATCH, at, rule.getSymbol() + " expects "
                + rule.describeCitations() + ", found " + describeShape(lineRefs.size(), rangeRefs.size()) + ".");
        }
        Application app = new Application(logic, registry.worldDiscipline(logic), context, rule, formula, at);
        for (Citation.LineRef ref : lineRefs) {
            app.lines.add(app.resolveLine(ref.line()));
        }
        for (Citation.RangeRef ref : rangeRefs) {
            app.ranges.add(app.resolveRange(ref));
        }
        app.check();
        return rule;
    }

    private static String describeShape(int lines, int ranges) {
        if (lines == 0 && ranges == 0) {
            return "no citations";
        }
        StringBuilder sb = new StringBuilder();
        if (lines > 0) {
            sb.append(lines).append(lines == 1 ? " line" : " lines");
        }
        if (ranges > 0) {
            if (sb.length() > 0) {
                sb.append(" and ");
            }
            sb.append(ranges).append(ranges == 1 ? " subproof" : " subproofs");
        }
        return sb.toString();
    }

    private static final class Cited {
        final ProofLine line;
        final int distance;

        Cited(ProofLine line, int distance) {
            this.line = line;
            this.distance = distance;
        }

        Formula formula() {
            return line.getFormula();
        }
    }

    /**
     * One rule application under verification.
     */
    private static final class Application {
        private final Logic logic;
        private final WorldDiscipline discipline;
        private final ContextView context;
        private final Rule rule;
        private final Formula target;
        private final int at;
        private final List<Cited> lines = new ArrayList<>();
        private final List<ClosedSubproof> ranges = new ArrayList<>();

        Application(Logic logic, WorldDiscipline discipline, ContextView context, Rule rule, Formula target, int at) {
            this.logic = logic;
            this.discipline = discipline;
            this.context = context;
            this.rule = rule;
            this.target = target;
            this.at = at;
        }

        Cited resolveLine(int n) {
            ProofLine line = context.line(n);
            if (line == null) {
                throw fail(ErrorKind.SCOPE_ERROR, "line " + n + " does not come before line " + at + ".");
            }
            if (!context.isOpen(n)) {
                throw fail(ErrorKind.SCOPE_ERROR, "line " + n + " lies inside a closed subproof.");
            }
            int distance = context.worldDistance(n);
            if (distance > 0 && !rule.crossesWorlds()) {
                throw fail(ErrorKind.SCOPE_ERROR, "line " + n + " lies outside the current strict subproof.");
            }
            if (!line.isEstablished()) {
                throw mismatch("line " + n + " is not established.");
            }
            if (line.getFormula() == null) {
                throw mismatch("line " + n + " opens a world and has no formula.");
            }
            return new Cited(line, distance);
        }

        ClosedSubproof resolveRange(Citation.RangeRef ref) {
            if (context.line(ref.last()) == null) {
                throw fail(ErrorKind.SCOPE_ERROR, "lines " + ref + " do not come before line " + at + ".");
            }
            ClosedSubproof closed = context.closedSubproof(ref.first(), ref.last());
            if (closed == null) {
                throw fail(ErrorKind.SCOPE_ERROR, "lines " + ref + " are not a closed subproof.");
            }
            if (!context.isVisible(closed)) {
                throw fail(ErrorKind.SCOPE_ERROR, "subproof " + ref + " is not visible from line " + at + ".");
            }
            if (closed.getKind() != rule.getRangeKind()) {
                throw mismatch("needs " + rule.getRangeKind().describe() + ", but " + ref + " is "
                    + closed.getKind().describe() + ".");
            }
            if (!closed.isEstablished() || closed.getConclusion() == null) {
                throw mismatch("subproof " + ref + " is not established.");
            }
            return closed;
        }

        void check() {
            switch (rule) {
                case R:
                    expect(formula(0), "the cited formula");
                    break;
                case AND_INTRO:
                    checkAndIntro();
                    break;
                case AND_ELIM:
                    checkAndElim();
                    break;
                case OR_INTRO:
                    checkOrIntro();
                    break;
                case OR_ELIM:
                    checkOrElim();
                    break;
                case IMPLIES_INTRO:
                    checkImpliesIntro();
                    break;
                case IMPLIES_ELIM:
                    checkImpliesElim();
                    break;
                case IFF_INTRO:
                    checkIffIntro();
                    break;
                case IFF_ELIM:
                    checkIffElim();
                    break;
                case NOT_INTRO:
                    checkNotIntro();
                    break;
                case NOT_ELIM:
                    checkNotElim();
                    break;
                case EXPLOSION:
                    if (!(formula(0) instanceof Formula.Bottom)) {
                        throw mismatch("line " + lineNo(0) + " must be ⊥, found " + formula(0) + ".");
                    }
                    break;
                case INDIRECT_PROOF:
                    checkIndirectProof();
                    break;
                case DISJUNCTIVE_SYLLOGISM:
                    checkDisjunctiveSyllogism();
                    break;
                case MODUS_TOLLENS:
                    checkModusTollens();
                    break;
                case DOUBLE_NEGATION_ELIM:
                    checkDoubleNegation();
                    break;
                case EXCLUDED_MIDDLE:
                    checkExcludedMiddle();
                    break;
                case DE_MORGAN:
                    if (!deMorgan(formula(0), target) && !deMorgan(target, formula(0))) {
                        throw mismatch(target + " is not a De Morgan form of " + formula(0) + ".");
                    }
                    break;
                case FORALL_INTRO:
                    checkForallIntro();
                    break;
                case FORALL_ELIM:
                    checkForallElim();
                    break;
                case EXISTS_INTRO:
                    checkExistsIntro();
                    break;
                case EXISTS_ELIM:
                    checkExistsElim();
                    break;
                case IDENTITY_INTRO:
                    checkIdentityIntro();
                    break;
                case IDENTITY_ELIM:
                    checkIdentityElim();
                    break;
                case QUANTIFIER_CONVERSION:
                    if (!quantifierDual(formula(0), target) && !quantifierDual(target, formula(0))) {
                        throw mismatch(target + " is not a quantifier conversion of " + formula(0) + ".");
                    }
                    break;
                case BOX_INTRO:
                    expect(new Formula.Necessarily(ranges.get(0).getConclusion()),
                        "□ applied to the conclusion of " + ranges.get(0).describeRange());
                    break;
                case BOX_ELIM:
                    checkBoxElim();
                    break;
                case DIAMOND_ELIM:
                    checkDiamondElim();
                    break;
                case DIAMOND_DEFINITION:
                    if (!diamondDefinition(formula(0), target) && !diamondDefinition(target, formula(0))) {
                        throw mismatch(target + " does not rewrite " + formula(0) + " between ♢A and ¬□¬A.");
                    }
                    break;
                case MODAL_CONVERSION:
                    if (!modalConversion(formula(0), target) && !modalConversion(target, formula(0))) {
                        throw mismatch(target + " is not a modal conversion of " + formula(0) + ".");
                    }
                    break;
                case DIAMOND_INTRO:
                    expect(new Formula.Possibly(formula(0)), "♢ applied to line " + lineNo(0));
                    break;
                case REFLEXIVITY:
                    expect(necessityBody(0), "the formula under □ on line " + lineNo(0));
                    break;
                case TRANSITIVITY:
                    checkTransitivity();
                    break;
                case EUCLIDEAN:
                    checkEuclidean();
                    break;
                default:
                    throw new IllegalStateException("No check for rule " + rule);
            }
        }

        private void checkAndIntro() {
            if (!(target instanceof Formula.And)) {
                throw mismatch("expected a conjunction, found " + target + ".");
            }
            Formula.And and = (Formula.And) target;
            Formula a = formula(0);
            Formula b = formula(1);
            boolean ok = (and.left().equals(a) && and.right().equals(b))
                || (and.left().equals(b) && and.right().equals(a));
            if (!ok) {
                throw mismatch("expected " + new Formula.And(a, b) + ", found " + target + ".");
            }
        }

        private void checkAndElim() {
            Formula.And and = cast(formula(0), Formula.And.class, 0, "a conjunction");
            if (!target.equals(and.left()) && !target.equals(and.right())) {
                throw mismatch("expected " + and.left() + " or " + and.right() + ", found " + target + ".");
            }
        }

        private void checkOrIntro() {
            if (!(target instanceof Formula.Or)) {
                throw mismatch("expected a disjunction, found " + target + ".");
            }
            Formula.Or or = (Formula.Or) target;
            if (!or.left().equals(formula(0)) && !or.right().equals(formula(0))) {
                throw mismatch(formula(0) + " is not a disjunct of " + target + ".");
            }
        }

        private void checkOrElim() {
            Formula.Or or = cast(formula(0), Formula.Or.class, 0, "a disjunction");
            ClosedSubproof first = ranges.get(0);
            ClosedSubproof second = ranges.get(1);
            boolean assumed = (or.left().equals(first.getAssumption()) && or.right().equals(second.getAssumption()))
                || (or.right().equals(first.getAssumption()) && or.left().equals(second.getAssumption()));
            if (!assumed) {
                throw mismatch("the subproofs must assume " + or.left() + " and " + or.right() + ".");
            }
            concludesTarget(first);
            concludesTarget(second);
        }

        private void checkImpliesIntro() {
            ClosedSubproof sub = ranges.get(0);
            expect(new Formula.Implies(sub.getAssumption(), sub.getConclusion()),
                "the assumption of " + sub.describeRange() + " implying its conclusion");
        }

        private void checkImpliesElim() {
            if (modusPonens(0, 1) || modusPonens(1, 0)) {
                return;
            }
            throw mismatch("expected A → " + target + " and A among the cited lines.");
        }

        private boolean modusPonens(int conditional, int antecedent) {
            Formula c = formula(conditional);
            if (!(c instanceof Formula.Implies)) {
                return false;
            }
            Formula.Implies implies = (Formula.Implies) c;
            return implies.left().equals(formula(antecedent)) && implies.right().equals(target);
        }

        private void checkIffIntro() {
            if (!(target instanceof Formula.Iff)) {
                throw mismatch("expected a biconditional, found " + target + ".");
            }
            Formula.Iff iff = (Formula.Iff) target;
            ClosedSubproof first = ranges.get(0);
            ClosedSubproof second = ranges.get(1);
            if (!(runs(first, iff.left(), iff.right()) && runs(second, iff.right(), iff.left()))
                && !(runs(first, iff.right(), iff.left()) && runs(second, iff.left(), iff.right()))) {
                throw mismatch("expected subproofs from " + iff.left() + " to " + iff.right()
                    + " and from " + iff.right() + " to " + iff.left() + ".");
            }
        }

        private void checkIffElim() {
            if (biconditionalStep(0, 1) || biconditionalStep(1, 0)) {
                return;
            }
            throw mismatch("expected a biconditional with " + target + " on one side and the other side cited.");
        }

        private boolean biconditionalStep(int iffLine, int sideLine) {
            Formula c = formula(iffLine);
            if (!(c instanceof Formula.Iff)) {
                return false;
            }
            Formula.Iff iff = (Formula.Iff) c;
            Formula side = formula(sideLine);
            return (iff.left().equals(side) && iff.right().equals(target))
                || (iff.right().equals(side) && iff.left().equals(target));
        }

        private void checkNotIntro() {
            ClosedSubproof sub = ranges.get(0);
            requireBottom(sub);
            expect(new Formula.Not(sub.getAssumption()), "the negation of the assumption of " + sub.describeRange());
        }

        private void checkNotElim() {
            if (!(target instanceof Formula.Bottom)) {
                throw mismatch("¬E concludes ⊥, found " + target + ".");
            }
            Formula a = formula(0);
            Formula b = formula(1);
            if (!b.equals(new Formula.Not(a)) && !a.equals(new Formula.Not(b))) {
                throw mismatch(a + " and " + b + " are not a formula and its negation.");
            }
        }

        private void checkIndirectProof() {
            ClosedSubproof sub = ranges.get(0);
            requireBottom(sub);
            Formula assumption = sub.getAssumption();
            if (!assumption.equals(new Formula.Not(target))) {
                throw mismatch("subproof " + sub.describeRange() + " must assume " + new Formula.Not(target)
                    + ", found " + assumption + ".");
            }
        }

        private void checkDisjunctiveSyllogism() {
            if (disjunctiveSyllogism(0, 1) || disjunctiveSyllogism(1, 0)) {
                return;
            }
            throw mismatch("expected a disjunction with " + target + " as one disjunct and the negation of the other.");
        }

        private boolean disjunctiveSyllogism(int orLine, int negLine) {
            Formula c = formula(orLine);
            if (!(c instanceof Formula.Or)) {
                return false;
            }
            Formula.Or or = (Formula.Or) c;
            Formula negation = formula(negLine);
            return (negation.equals(new Formula.Not(or.left())) && or.right().equals(target))
                || (negation.equals(new Formula.Not(or.right())) && or.left().equals(target));
        }

        private void checkModusTollens() {
            if (modusTollens(0, 1) || modusTollens(1, 0)) {
                return;
            }
            throw mismatch("expected A → B and ¬B yielding ¬A, found " + target + ".");
        }

        private boolean modusTollens(int conditional, int negLine) {
            Formula c = formula(conditional);
            if (!(c instanceof Formula.Implies)) {
                return false;
            }
            Formula.Implies implies = (Formula.Implies) c;
            return formula(negLine).equals(new Formula.Not(implies.right()))
                && target.equals(new Formula.Not(implies.left()));
        }

        private void checkDoubleNegation() {
            Formula cited = formula(0);
            if (!cited.equals(new Formula.Not(new Formula.Not(target)))) {
                throw mismatch("line " + lineNo(0) + " must be " + new Formula.Not(new Formula.Not(target))
                    + ", found " + cited + ".");
            }
        }

        private void checkExcludedMiddle() {
            ClosedSubproof first = ranges.get(0);
            ClosedSubproof second = ranges.get(1);
            boolean complementary = Objects.equals(second.getAssumption(), new Formula.Not(first.getAssumption()))
                || Objects.equals(first.getAssumption(), new Formula.Not(second.getAssumption()));
            if (!complementary) {
                throw mismatch("the subproofs must assume a formula and its negation.");
            }
            concludesTarget(first);
            concludesTarget(second);
        }

        private void checkForallIntro() {
            Formula.ForAll forall = castTarget(Formula.ForAll.class, "a universal formula");
            Formulas.Instance instance = match(forall.body(), forall.variable(), formula(0));
            if (!instance.isMatched()) {
                throw mismatch(target + " does not generalize line " + lineNo(0) + ".");
            }
            if (instance.isVacuous()) {
                return;
            }
            Term term = instance.getTerm();
            if (!(term instanceof Term.Constant)) {
                throw mismatch("only a constant can be generalized, found " + term + ".");
            }
            if (Formulas.containsTerm(target, term)) {
                throw fail(ErrorKind.FRESHNESS_VIOLATION, "constant " + term + " still occurs in " + target + ".");
            }
            for (Formula hypothesis : context.openHypotheses()) {
                if (Formulas.containsTerm(hypothesis, term)) {
                    throw fail(ErrorKind.FRESHNESS_VIOLATION, "constant " + term
                        + " occurs in the premise or open assumption " + hypothesis + ".");
                }
            }
        }

        private void checkForallElim() {
            Formula.ForAll forall = cast(formula(0), Formula.ForAll.class, 0, "a universal formula");
            if (!match(forall.body(), forall.variable(), target).isMatched()) {
                throw mismatch(target + " is not an instance of " + forall + ".");
            }
        }

        private void checkExistsIntro() {
            Formula.Exists exists = castTarget(Formula.Exists.class, "an existential formula");
            String variable = exists.variable().name();
            if (Formulas.variableNames(formula(0)).contains(variable)) {
                throw mismatch("variable " + variable + " already occurs in " + formula(0) + ".");
            }
            if (!match(exists.body(), exists.variable(), formula(0)).isMatched()) {
                throw mismatch(formula(0) + " is not an instance of " + target + ".");
            }
        }

        private void checkExistsElim() {
            Formula.Exists exists = cast(formula(0), Formula.Exists.class, 0, "an existential formula");
            ClosedSubproof sub = ranges.get(0);
            Formulas.Instance instance = match(exists.body(), exists.variable(), sub.getAssumption());
            if (!instance.isMatched()) {
                throw mismatch("subproof " + sub.describeRange() + " must assume an instance of " + exists + ".");
            }
            concludesTarget(sub);
            if (instance.isVacuous()) {
                return;
            }
            Term term = instance.getTerm();
            if (!(term instanceof Term.Constant)) {
                throw mismatch("the instance must use a constant, found " + term + ".");
            }
            if (Formulas.containsTerm(exists, term)) {
                throw fail(ErrorKind.FRESHNESS_VIOLATION, "constant " + term + " occurs in " + exists + ".");
            }
            if (Formulas.containsTerm(target, term)) {
                throw fail(ErrorKind.FRESHNESS_VIOLATION, "constant " + term + " occurs in " + target + ".");
            }
            for (ProofLine line : context.availableLines()) {
                if (Formulas.containsTerm(line.getFormula(), term)) {
                    throw fail(ErrorKind.FRESHNESS_VIOLATION, "constant " + term + " already occurs on line "
                        + line.getIndex() + ".");
                }
            }
        }

        private void checkIdentityIntro() {
            if (target instanceof Formula.Atom) {
                Formula.Atom atom = (Formula.Atom) target;
                if (atom.isIdentity() && atom.terms().get(0).equals(atom.terms().get(1))) {
                    return;
                }
            }
            throw mismatch("=I concludes t = t, found " + target + ".");
        }

        private void checkIdentityElim() {
            if (rewrites(0, 1) || rewrites(1, 0)) {
                return;
            }
            throw mismatch(target + " does not follow by substituting equals.");
        }

        private boolean rewrites(int identityLine, int sourceLine) {
            Formula eq = formula(identityLine);
            if (!(eq instanceof Formula.Atom) || !((Formula.Atom) eq).isIdentity()) {
                return false;
            }
            Term a = ((Formula.Atom) eq).terms().get(0);
            Term b = ((Formula.Atom) eq).terms().get(1);
            Formula source = formula(sourceLine);
            return Formulas.replacesSome(source, target, a, b) || Formulas.replacesSome(source, target, b, a);
        }

        private void checkBoxElim() {
            expect(necessityBody(0), "the formula under □ on line " + lineNo(0));
            int distance = lines.get(0).distance;
            if (!discipline.allowsNecessityTransfer(distance)) {
                throw fail(ErrorKind.SCOPE_ERROR, "□E cannot use line " + lineNo(0) + " from "
                    + describeDistance(distance) + " in " + logic.name() + ".");
            }
        }

        private void checkDiamondElim() {
            Formula.Possibly possibly = cast(formula(0), Formula.Possibly.class, 0, "a ♢ formula");
            ClosedSubproof sub = ranges.get(0);
            if (!possibly.inner().equals(sub.getAssumption())) {
                throw mismatch("subproof " + sub.describeRange() + " must assume " + possibly.inner() + ".");
            }
            expect(new Formula.Possibly(sub.getConclusion()), "♢ applied to the conclusion of " + sub.describeRange());
        }

        private void checkTransitivity() {
            cast(formula(0), Formula.Necessarily.class, 0, "a □ formula");
            expect(formula(0), "the cited formula");
            if (lines.get(0).distance == 0) {
                throw mismatch("R4 carries a □ formula into a strict subproof; within one world use R.");
            }
        }

        private void checkEuclidean() {
            Formula cited = formula(0);
            boolean notNecessary = cited instanceof Formula.Not
                && ((Formula.Not) cited).inner() instanceof Formula.Necessarily;
            if (!notNecessary && !(cited instanceof Formula.Possibly)) {
                throw mismatch("R5 carries only ¬□A or ♢A, found " + cited + ".");
            }
            expect(cited, "the cited formula");
        }

        private Formula necessityBody(int index) {
            return cast(formula(index), Formula.Necessarily.class, index, "a □ formula").inner();
        }

        private Formulas.Instance match(Formula pattern, Term.Variable variable, Formula instance) {
            try {
                return Formulas.matchInstance(pattern, variable, instance);
            } catch (Formulas.CaptureException e) {
                throw mismatch(e.getMessage());
            }
        }

        private void concludesTarget(ClosedSubproof sub) {
            if (!target.equals(sub.getConclusion())) {
                throw mismatch("subproof " + sub.describeRange() + " concludes " + sub.getConclusion()
                    + ", not " + target + ".");
            }
        }

        private void requireBottom(ClosedSubproof sub) {
            if (!(sub.getConclusion() instanceof Formula.Bottom)) {
                throw mismatch("subproof " + sub.describeRange() + " must end in ⊥, found " + sub.getConclusion() + ".");
            }
        }

        private boolean runs(ClosedSubproof sub, Formula from, Formula to) {
            return from.equals(sub.getAssumption()) && to.equals(sub.getConclusion());
        }

        private void expect(Formula expected, String description) {
            if (!target.equals(expected)) {
                throw mismatch("expected " + expected + " (" + description + "), found " + target + ".");
            }
        }

        private Formula formula(int index) {
            return lines.get(index).formula();
        }

        private int lineNo(int index) {
            return lines.get(index).line.getIndex();
        }

        private <T extends Formula> T cast(Formula formula, Class<T> type, int index, String description) {
            if (!type.isInstance(formula)) {
                throw mismatch("line " + lineNo(index) + " must be " + description + ", found " + formula + ".");
            }
            return type.cast(formula);
        }

        private <T extends Formula> T castTarget(Class<T> type, String description) {
            if (!type.isInstance(target)) {
                throw mismatch("expected " + description + ", found " + target + ".");
            }
            return type.cast(target);
        }

        private VerificationException mismatch(String detail) {
            return fail(ErrorKind.RULE_MISMATCH, detail);
        }

        private VerificationException fail(ErrorKind kind, String detail) {
            return new VerificationException(kind, at, rule.getSymbol() + ": " + detail);
        }
    }

    private static String describeDistance(int distance) {
        switch (distance) {
            case 0:
                return "the same world";
            case 1:
                return "the enclosing world";
            default:
                return distance + " worlds out";
        }
    }

    private static boolean deMorgan(Formula negated, Formula expanded) {
        if (!(negated instanceof Formula.Not)) {
            return false;
        }
        Formula inner = ((Formula.Not) negated).inner();
        if (inner instanceof Formula.Or && expanded instanceof Formula.And) {
            Formula.Or or = (Formula.Or) inner;
            Formula.And and = (Formula.And) expanded;
            return and.left().equals(new Formula.Not(or.left())) && and.right().equals(new Formula.Not(or.right()));
        }
        if (inner instanceof Formula.And && expanded instanceof Formula.Or) {
            Formula.And and = (Formula.And) inner;
            Formula.Or or = (Formula.Or) expanded;
            return or.left().equals(new Formula.Not(and.left())) && or.right().equals(new Formula.Not(and.right()));
        }
        return false;
    }

    private static boolean quantifierDual(Formula quantified, Formula negated) {
        if (!(quantified instanceof Formula.Quantified) || !(negated instanceof Formula.Not)) {
            return false;
        }
        Formula.Quantified q = (Formula.Quantified) quantified;
        if (!(q.body() instanceof Formula.Not)) {
            return false;
        }
        Formula body = ((Formula.Not) q.body()).inner();
        Formula.Kind dual = q.kind() == Formula.Kind.FORALL ? Formula.Kind.EXISTS : Formula.Kind.FORALL;
        return ((Formula.Not) negated).inner().equals(Formula.Quantified.of(dual, q.variable(), body));
    }

    private static boolean diamondDefinition(Formula possibly, Formula rewritten) {
        if (!(possibly instanceof Formula.Possibly)) {
            return false;
        }
        Formula inner = ((Formula.Possibly) possibly).inner();
        return rewritten.equals(new Formula.Not(new Formula.Necessarily(new Formula.Not(inner))));
    }

    private static boolean modalConversion(Formula negated, Formula converted) {
        if (!(negated instanceof Formula.Not)) {
            return false;
        }
        Formula inner = ((Formula.Not) negated).inner();
        if (inner instanceof Formula.Necessarily) {
            return converted.equals(new Formula.Possibly(new Formula.Not(((Formula.Necessarily) inner).inner())));
        }
        if (inner instanceof Formula.Possibly) {
            return converted.equals(new Formula.Necessarily(new Formula.Not(((Formula.Possibly) inner).inner())));
        }
        return false;
    }
}
