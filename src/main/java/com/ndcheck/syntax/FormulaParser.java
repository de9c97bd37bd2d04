package com.ndcheck.syntax;

import com.ndcheck.logic.Logic;
import com.ndcheck.logic.LogicRegistry;
import com.ndcheck.logic.Operator;
import com.ndcheck.syntax.FormulaLexer.Token;
import com.ndcheck.syntax.FormulaLexer.Type;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for formulas of every supported logic.
 *
 * <p>Binding strength, tightest first: the unary operators {@code ¬ □ ♢ ∀x ∃x}, then
 * {@code ∧}, {@code ∨}, {@code →}, {@code ↔}. Conjunction and disjunction group to the
 * left; a chain of conditionals or biconditionals needs parentheses. Operators are
 * checked against the logic as they are read, so the first forbidden one is reported.
 */
public class FormulaParser {

    private static final String NONE_MARKER = "NA";

    private final LogicRegistry registry;

    public FormulaParser() {
        this(LogicRegistry.standard());
    }

    public FormulaParser(LogicRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parse a closed formula.
     *
     * @throws SyntaxException on malformed text, shadowed or free variables
     * @throws OperatorNotSupportedException on an operator the logic does not admit
     */
    public Formula parseFormula(String text, Logic logic) {
        if (text == null || text.isBlank()) {
            throw new SyntaxException("Empty formula.");
        }
        Cursor cursor = new Cursor(FormulaLexer.tokenize(text), logic, registry.operatorsFor(logic));
        Formula formula = cursor.parseIff();
        Token rest = cursor.peek();
        if (rest.type == Type.RPAREN) {
            throw new SyntaxException("Unbalanced parentheses: unexpected ')' at position " + (rest.position + 1) + ".", ")");
        }
        if (rest.type != Type.EOF) {
            throw new SyntaxException("Unexpected " + rest + " at position " + (rest.position + 1) + ".", rest.text);
        }
        Set<String> free = Formulas.freeVariables(formula);
        if (!free.isEmpty()) {
            String variable = free.iterator().next();
            throw new SyntaxException("Variable " + variable + " is not bound by any quantifier.", variable);
        }
        return formula;
    }

    /**
     * Parse a premise list separated by top-level commas or semicolons. Blank text and
     * the marker {@code NA} stand for no premises.
     */
    public List<Formula> parsePremises(String text, Logic logic) {
        List<Formula> premises = new ArrayList<>();
        if (text == null || text.isBlank() || NONE_MARKER.equalsIgnoreCase(text.trim())) {
            return premises;
        }
        for (String part : splitTopLevel(text)) {
            if (!part.isBlank()) {
                premises.add(parseFormula(part, logic));
            }
        }
        return premises;
    }

    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if ((ch == ',' || ch == ';') && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private final Logic logic;
        private final Set<Operator> allowed;
        private final Deque<String> bound = new ArrayDeque<>();
        private int pos;

        Cursor(List<Token> tokens, Logic logic, Set<Operator> allowed) {
            this.tokens = tokens;
            this.logic = logic;
            this.allowed = allowed;
        }

        Token peek() {
            return tokens.get(pos);
        }

        Token next() {
            Token token = tokens.get(pos);
            if (token.type != Type.EOF) {
                pos++;
            }
            return token;
        }

        void require(Operator operator) {
            if (!allowed.contains(operator)) {
                throw new OperatorNotSupportedException(operator, logic);
            }
        }

        Formula parseIff() {
            Formula left = parseImplies();
            if (peek().type != Type.IFF) {
                return left;
            }
            next();
            require(Operator.IFF);
            Formula right = parseImplies();
            if (peek().type == Type.IFF) {
                throw new SyntaxException("↔ does not associate; add parentheses at position " + (peek().position + 1) + ".", "↔");
            }
            return new Formula.Iff(left, right);
        }

        Formula parseImplies() {
            Formula left = parseOr();
            if (peek().type != Type.IMPLIES) {
                return left;
            }
            next();
            require(Operator.IMPLIES);
            Formula right = parseOr();
            if (peek().type == Type.IMPLIES) {
                throw new SyntaxException("→ does not associate; add parentheses at position " + (peek().position + 1) + ".", "→");
            }
            return new Formula.Implies(left, right);
        }

        Formula parseOr() {
            Formula left = parseAnd();
            while (peek().type == Type.OR) {
                next();
                require(Operator.OR);
                left = new Formula.Or(left, parseAnd());
            }
            return left;
        }

        Formula parseAnd() {
            Formula left = parseUnary();
            while (peek().type == Type.AND) {
                next();
                require(Operator.AND);
                left = new Formula.And(left, parseUnary());
            }
            return left;
        }

        Formula parseUnary() {
            Token token = peek();
            switch (token.type) {
                case NOT:
                    next();
                    require(Operator.NOT);
                    return new Formula.Not(parseUnary());
                case BOX:
                    next();
                    require(Operator.NECESSARILY);
                    return new Formula.Necessarily(parseUnary());
                case DIAMOND:
                    next();
                    require(Operator.POSSIBLY);
                    return new Formula.Possibly(parseUnary());
                case FORALL:
                    next();
                    require(Operator.FORALL);
                    return parseQuantified(Formula.Kind.FORALL, token);
                case EXISTS:
                    next();
                    require(Operator.EXISTS);
                    return parseQuantified(Formula.Kind.EXISTS, token);
                default:
                    return parsePrimary();
            }
        }

        private Formula parseQuantified(Formula.Kind kind, Token quantifier) {
            Token variable = next();
            if (variable.type != Type.LOWER || !Term.isVariableName(variable.letter())) {
                throw new SyntaxException("Quantifier " + quantifier.text + " at position " + (quantifier.position + 1)
                    + " must be followed by a variable (s-z), found " + variable + ".", variable.text);
            }
            if (bound.contains(variable.text)) {
                throw new SyntaxException("Variable " + variable.text + " is already bound by an enclosing quantifier.", variable.text);
            }
            bound.push(variable.text);
            Formula body = parseUnary();
            bound.pop();
            return Formula.Quantified.of(kind, new Term.Variable(variable.text), body);
        }

        Formula parsePrimary() {
            Token token = peek();
            switch (token.type) {
                case LPAREN:
                    next();
                    Formula inner = parseIff();
                    Token close = next();
                    if (close.type != Type.RPAREN) {
                        throw new SyntaxException("Unbalanced parentheses: '(' at position " + (token.position + 1)
                            + " is never closed.", "(");
                    }
                    return inner;
                case BOTTOM:
                    next();
                    require(Operator.BOTTOM);
                    return new Formula.Bottom();
                case UPPER:
                    next();
                    List<Term> terms = new ArrayList<>();
                    while (peek().type == Type.LOWER) {
                        terms.add(parseTerm());
                    }
                    require(terms.isEmpty() ? Operator.SENTENCE_LETTER : Operator.PREDICATE);
                    return new Formula.Atom(token.text, terms);
                case LOWER:
                    Term left = parseTerm();
                    Token equals = next();
                    if (equals.type != Type.EQUALS) {
                        throw new SyntaxException("Expected '=' after term " + left + ", found " + equals + ".", equals.text);
                    }
                    require(Operator.IDENTITY);
                    return Formula.identity(left, parseTerm());
                case RPAREN:
                    throw new SyntaxException("Unbalanced parentheses: unexpected ')' at position " + (token.position + 1) + ".", ")");
                case EOF:
                    throw new SyntaxException("Missing operand at end of input.");
                default:
                    throw new SyntaxException("Missing operand before " + token + " at position " + (token.position + 1) + ".", token.text);
            }
        }

        Term parseTerm() {
            Token token = next();
            if (token.type != Type.LOWER) {
                throw new SyntaxException("Expected a term, found " + token + ".", token.text);
            }
            if (Term.isVariableName(token.letter())) {
                if (peek().type == Type.LPAREN) {
                    throw new SyntaxException("Variable " + token.text + " cannot take arguments.", token.text);
                }
                return new Term.Variable(token.text);
            }
            if (peek().type != Type.LPAREN) {
                return new Term.Constant(token.text);
            }
            require(Operator.FUNCTION);
            next();
            List<Term> arguments = new ArrayList<>();
            arguments.add(parseTerm());
            while (peek().type == Type.COMMA) {
                next();
                arguments.add(parseTerm());
            }
            Token close = next();
            if (close.type != Type.RPAREN) {
                throw new SyntaxException("Unbalanced parentheses in the arguments of " + token.text + ".", token.text);
            }
            return new Term.FunctionApplication(token.text, arguments);
        }
    }
}
