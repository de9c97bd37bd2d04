package com.ndcheck.syntax;

import java.util.stream.Collectors;

/**
 * Canonical text for formulas. The output parses back to an equal tree: every binary
 * subformula of a compound formula is parenthesized.
 */
public final class FormulaPrinter {

    private FormulaPrinter() {
    }

    public static String print(Formula formula) {
        StringBuilder sb = new StringBuilder();
        append(sb, formula);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Formula formula) {
        if (formula instanceof Formula.Atom) {
            Formula.Atom atom = (Formula.Atom) formula;
            if (atom.isIdentity() && atom.terms().size() == 2) {
                sb.append(atom.terms().get(0)).append(" = ").append(atom.terms().get(1));
            } else {
                sb.append(atom.predicate());
                sb.append(atom.terms().stream().map(Term::toString).collect(Collectors.joining()));
            }
        } else if (formula instanceof Formula.Bottom) {
            sb.append(Formula.Kind.BOTTOM.getSymbol());
        } else if (formula instanceof Formula.Unary) {
            Formula.Unary unary = (Formula.Unary) formula;
            sb.append(unary.kind().getSymbol());
            appendOperand(sb, unary.inner());
        } else if (formula instanceof Formula.Quantified) {
            Formula.Quantified quantified = (Formula.Quantified) formula;
            sb.append(quantified.kind().getSymbol()).append(quantified.variable().name());
            appendOperand(sb, quantified.body());
        } else if (formula instanceof Formula.Binary) {
            Formula.Binary binary = (Formula.Binary) formula;
            appendOperand(sb, binary.left());
            sb.append(' ').append(binary.kind().getSymbol()).append(' ');
            appendOperand(sb, binary.right());
        }
    }

    private static void appendOperand(StringBuilder sb, Formula operand) {
        if (operand instanceof Formula.Binary) {
            sb.append('(');
            append(sb, operand);
            sb.append(')');
        } else {
            append(sb, operand);
        }
    }
}
