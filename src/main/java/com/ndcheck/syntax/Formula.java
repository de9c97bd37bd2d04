package com.ndcheck.syntax;

import java.util.Arrays;
import java.util.List;

/**
 * Formula syntax tree. Equality is structural: bound variables must carry the same
 * names for two formulas to be equal.
 */
public sealed interface Formula permits Formula.Atom, Formula.Bottom, Formula.Unary, Formula.Binary, Formula.Quantified {

    enum Kind {
        ATOM(""),
        BOTTOM("⊥"),
        NOT("¬"),
        AND("∧"),
        OR("∨"),
        IMPLIES("→"),
        IFF("↔"),
        FORALL("∀"),
        EXISTS("∃"),
        NECESSARILY("□"),
        POSSIBLY("♢");

        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    Kind kind();

    /**
     * Predicate applied to terms. A sentence letter has no terms; identity uses the
     * predicate {@code =} with exactly two.
     */
    record Atom(String predicate, List<Term> terms) implements Formula {
        public static final String IDENTITY = "=";

        public Atom {
            terms = List.copyOf(terms);
        }

        public boolean isIdentity() {
            return IDENTITY.equals(predicate);
        }

        @Override
        public Kind kind() {
            return Kind.ATOM;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Bottom() implements Formula {
        @Override
        public Kind kind() {
            return Kind.BOTTOM;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    sealed interface Unary extends Formula permits Not, Necessarily, Possibly {
        Formula inner();
    }

    sealed interface Binary extends Formula permits And, Or, Implies, Iff {
        Formula left();

        Formula right();
    }

    sealed interface Quantified extends Formula permits ForAll, Exists {
        Term.Variable variable();

        Formula body();

        static Quantified of(Kind kind, Term.Variable variable, Formula body) {
            switch (kind) {
                case FORALL:
                    return new ForAll(variable, body);
                case EXISTS:
                    return new Exists(variable, body);
                default:
                    throw new IllegalArgumentException("Not a quantifier: " + kind);
            }
        }
    }

    record Not(Formula inner) implements Unary {
        @Override
        public Kind kind() {
            return Kind.NOT;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Necessarily(Formula inner) implements Unary {
        @Override
        public Kind kind() {
            return Kind.NECESSARILY;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Possibly(Formula inner) implements Unary {
        @Override
        public Kind kind() {
            return Kind.POSSIBLY;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record And(Formula left, Formula right) implements Binary {
        @Override
        public Kind kind() {
            return Kind.AND;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Or(Formula left, Formula right) implements Binary {
        @Override
        public Kind kind() {
            return Kind.OR;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Implies(Formula left, Formula right) implements Binary {
        @Override
        public Kind kind() {
            return Kind.IMPLIES;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Iff(Formula left, Formula right) implements Binary {
        @Override
        public Kind kind() {
            return Kind.IFF;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record ForAll(Term.Variable variable, Formula body) implements Quantified {
        @Override
        public Kind kind() {
            return Kind.FORALL;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    record Exists(Term.Variable variable, Formula body) implements Quantified {
        @Override
        public Kind kind() {
            return Kind.EXISTS;
        }

        @Override
        public String toString() {
            return FormulaPrinter.print(this);
        }
    }

    static Atom letter(String name) {
        return new Atom(name, List.of());
    }

    static Atom predicate(String name, Term... terms) {
        return new Atom(name, Arrays.asList(terms));
    }

    static Atom identity(Term left, Term right) {
        return new Atom(Atom.IDENTITY, List.of(left, right));
    }
}
