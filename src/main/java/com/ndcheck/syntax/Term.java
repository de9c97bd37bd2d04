package com.ndcheck.syntax;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * First-order terms. Variables are the letters s-z, constants and function symbols
 * the letters a-r.
 */
public sealed interface Term permits Term.Variable, Term.Constant, Term.FunctionApplication {

    String name();

    /**
     * Variables occurring anywhere in the term.
     */
    Set<String> variables();

    /**
     * Whether {@code other} occurs in this term, the term itself included.
     */
    boolean contains(Term other);

    record Variable(String name) implements Term {
        @Override
        public Set<String> variables() {
            return Set.of(name);
        }

        @Override
        public boolean contains(Term other) {
            return equals(other);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Constant(String name) implements Term {
        @Override
        public Set<String> variables() {
            return Set.of();
        }

        @Override
        public boolean contains(Term other) {
            return equals(other);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record FunctionApplication(String name, List<Term> arguments) implements Term {
        public FunctionApplication {
            arguments = List.copyOf(arguments);
        }

        @Override
        public Set<String> variables() {
            return arguments.stream()
                .flatMap(t -> t.variables().stream())
                .collect(Collectors.toSet());
        }

        @Override
        public boolean contains(Term other) {
            if (equals(other)) {
                return true;
            }
            for (Term argument : arguments) {
                if (argument.contains(other)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            return name + arguments.stream().map(Term::toString).collect(Collectors.joining(",", "(", ")"));
        }
    }

    static boolean isVariableName(char c) {
        return c >= 's' && c <= 'z';
    }
}
