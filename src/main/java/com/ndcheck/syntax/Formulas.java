package com.ndcheck.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structural queries over formulas: free variables, term occurrence
 * and instance matching for the quantifier and identity rules.
 */
public final class Formulas {

    private Formulas() {
    }

    public static Set<String> freeVariables(Formula formula) {
        Set<String> out = new LinkedHashSet<>();
        collectFree(formula, new ArrayDeque<>(), out);
        return out;
    }

    private static void collectFree(Formula formula, Deque<String> bound, Set<String> out) {
        if (formula instanceof Formula.Atom) {
            for (Term term : ((Formula.Atom) formula).terms()) {
                for (String v : term.variables()) {
                    if (!bound.contains(v)) {
                        out.add(v);
                    }
                }
            }
        } else if (formula instanceof Formula.Unary) {
            collectFree(((Formula.Unary) formula).inner(), bound, out);
        } else if (formula instanceof Formula.Binary) {
            Formula.Binary binary = (Formula.Binary) formula;
            collectFree(binary.left(), bound, out);
            collectFree(binary.right(), bound, out);
        } else if (formula instanceof Formula.Quantified) {
            Formula.Quantified q = (Formula.Quantified) formula;
            bound.push(q.variable().name());
            collectFree(q.body(), bound, out);
            bound.pop();
        }
    }

    /**
     * Every variable name appearing in the formula, bound or free.
     */
    public static Set<String> variableNames(Formula formula) {
        Set<String> out = new LinkedHashSet<>();
        collectVariableNames(formula, out);
        return out;
    }

    private static void collectVariableNames(Formula formula, Set<String> out) {
        if (formula instanceof Formula.Atom) {
            for (Term term : ((Formula.Atom) formula).terms()) {
                out.addAll(term.variables());
            }
        } else if (formula instanceof Formula.Unary) {
            collectVariableNames(((Formula.Unary) formula).inner(), out);
        } else if (formula instanceof Formula.Binary) {
            collectVariableNames(((Formula.Binary) formula).left(), out);
            collectVariableNames(((Formula.Binary) formula).right(), out);
        } else if (formula instanceof Formula.Quantified) {
            Formula.Quantified q = (Formula.Quantified) formula;
            out.add(q.variable().name());
            collectVariableNames(q.body(), out);
        }
    }

    /**
     * Whether {@code term} occurs anywhere in the formula, inside function
     * applications included.
     */
    public static boolean containsTerm(Formula formula, Term term) {
        if (formula instanceof Formula.Atom) {
            for (Term t : ((Formula.Atom) formula).terms()) {
                if (t.contains(term)) {
                    return true;
                }
            }
            return false;
        }
        if (formula instanceof Formula.Unary) {
            return containsTerm(((Formula.Unary) formula).inner(), term);
        }
        if (formula instanceof Formula.Binary) {
            Formula.Binary binary = (Formula.Binary) formula;
            return containsTerm(binary.left(), term) || containsTerm(binary.right(), term);
        }
        if (formula instanceof Formula.Quantified) {
            return containsTerm(((Formula.Quantified) formula).body(), term);
        }
        return false;
    }

    /**
     * Find the term t with {@code pattern[x := t] == target}. Positions of the pattern
     * that do not hold a free x must match the target exactly.
     *
     * @throws CaptureException if the term would be captured by a quantifier of the pattern
     */
    public static Instance matchInstance(Formula pattern, Term.Variable x, Formula target) {
        Term[] binding = new Term[1];
        if (!match(pattern, target, x, binding, new ArrayDeque<>())) {
            return Instance.NONE;
        }
        return new Instance(true, binding[0]);
    }

    private static boolean match(Formula p, Formula t, Term.Variable x, Term[] binding, Deque<String> bound) {
        if (p.kind() != t.kind()) {
            return false;
        }
        switch (p.kind()) {
            case ATOM:
                Formula.Atom pa = (Formula.Atom) p;
                Formula.Atom ta = (Formula.Atom) t;
                if (!pa.predicate().equals(ta.predicate()) || pa.terms().size() != ta.terms().size()) {
                    return false;
                }
                for (int i = 0; i < pa.terms().size(); i++) {
                    if (!matchTerm(pa.terms().get(i), ta.terms().get(i), x, binding, bound)) {
                        return false;
                    }
                }
                return true;
            case BOTTOM:
                return true;
            case NOT:
            case NECESSARILY:
            case POSSIBLY:
                return match(((Formula.Unary) p).inner(), ((Formula.Unary) t).inner(), x, binding, bound);
            case AND:
            case OR:
            case IMPLIES:
            case IFF:
                Formula.Binary pb = (Formula.Binary) p;
                Formula.Binary tb = (Formula.Binary) t;
                return match(pb.left(), tb.left(), x, binding, bound)
                    && match(pb.right(), tb.right(), x, binding, bound);
            case FORALL:
            case EXISTS:
                Formula.Quantified pq = (Formula.Quantified) p;
                Formula.Quantified tq = (Formula.Quantified) t;
                if (!pq.variable().equals(tq.variable())) {
                    return false;
                }
                if (pq.variable().equals(x)) {
                    // x is rebound here, nothing below is substituted
                    return pq.body().equals(tq.body());
                }
                bound.push(pq.variable().name());
                boolean result = match(pq.body(), tq.body(), x, binding, bound);
                bound.pop();
                return result;
            default:
                return false;
        }
    }

    private static boolean matchTerm(Term p, Term t, Term.Variable x, Term[] binding, Deque<String> bound) {
        if (p.equals(x)) {
            for (String v : t.variables()) {
                if (bound.contains(v)) {
                    throw new CaptureException("Substituting " + t + " for " + x + " would capture the variable " + v + ".");
                }
            }
            if (binding[0] == null) {
                binding[0] = t;
                return true;
            }
            return binding[0].equals(t);
        }
        if (p instanceof Term.FunctionApplication && t instanceof Term.FunctionApplication) {
            Term.FunctionApplication pf = (Term.FunctionApplication) p;
            Term.FunctionApplication tf = (Term.FunctionApplication) t;
            if (!pf.name().equals(tf.name()) || pf.arguments().size() != tf.arguments().size()) {
                return false;
            }
            for (int i = 0; i < pf.arguments().size(); i++) {
                if (!matchTerm(pf.arguments().get(i), tf.arguments().get(i), x, binding, bound)) {
                    return false;
                }
            }
            return true;
        }
        return p.equals(t);
    }

    /**
     * Whether {@code result} is {@code source} with zero or more occurrences of
     * {@code from} replaced by {@code to}.
     */
    public static boolean replacesSome(Formula source, Formula result, Term from, Term to) {
        if (source.kind() != result.kind()) {
            return false;
        }
        switch (source.kind()) {
            case ATOM:
                Formula.Atom sa = (Formula.Atom) source;
                Formula.Atom ra = (Formula.Atom) result;
                if (!sa.predicate().equals(ra.predicate()) || sa.terms().size() != ra.terms().size()) {
                    return false;
                }
                for (int i = 0; i < sa.terms().size(); i++) {
                    if (!replacesSomeTerm(sa.terms().get(i), ra.terms().get(i), from, to)) {
                        return false;
                    }
                }
                return true;
            case BOTTOM:
                return true;
            case NOT:
            case NECESSARILY:
            case POSSIBLY:
                return replacesSome(((Formula.Unary) source).inner(), ((Formula.Unary) result).inner(), from, to);
            case AND:
            case OR:
            case IMPLIES:
            case IFF:
                Formula.Binary sb = (Formula.Binary) source;
                Formula.Binary rb = (Formula.Binary) result;
                return replacesSome(sb.left(), rb.left(), from, to) && replacesSome(sb.right(), rb.right(), from, to);
            case FORALL:
            case EXISTS:
                Formula.Quantified sq = (Formula.Quantified) source;
                Formula.Quantified rq = (Formula.Quantified) result;
                return sq.variable().equals(rq.variable()) && replacesSome(sq.body(), rq.body(), from, to);
            default:
                return false;
        }
    }

    private static boolean replacesSomeTerm(Term source, Term result, Term from, Term to) {
        if (source.equals(result)) {
            return true;
        }
        if (source.equals(from) && result.equals(to)) {
            return true;
        }
        if (source instanceof Term.FunctionApplication && result instanceof Term.FunctionApplication) {
            Term.FunctionApplication sf = (Term.FunctionApplication) source;
            Term.FunctionApplication rf = (Term.FunctionApplication) result;
            if (!sf.name().equals(rf.name()) || sf.arguments().size() != rf.arguments().size()) {
                return false;
            }
            for (int i = 0; i < sf.arguments().size(); i++) {
                if (!replacesSomeTerm(sf.arguments().get(i), rf.arguments().get(i), from, to)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Outcome of {@link #matchInstance}. A match with no term means the variable does
     * not occur and the pattern equals the target.
     */
    public static final class Instance {
        static final Instance NONE = new Instance(false, null);

        private final boolean matched;
        private final Term term;

        Instance(boolean matched, Term term) {
            this.matched = matched;
            this.term = term;
        }

        public boolean isMatched() {
            return matched;
        }

        public boolean isVacuous() {
            return matched && term == null;
        }

        public Term getTerm() {
            return term;
        }
    }

    /**
     * A substituted term would fall under a quantifier binding one of its variables.
     */
    public static class CaptureException extends RuntimeException {
        public CaptureException(String message) {
            super(message);
        }
    }
}
