package com.ndcheck.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into single-character tokens. Whitespace is dropped; any
 * character outside the logical alphabet is rejected.
 */
final class FormulaLexer {

    enum Type {
        NOT, AND, OR, IMPLIES, IFF, BOTTOM, FORALL, EXISTS, BOX, DIAMOND,
        EQUALS, LPAREN, RPAREN, COMMA, UPPER, LOWER, EOF
    }

    static final class Token {
        final Type type;
        final String text;
        final int position;

        Token(Type type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        char letter() {
            return text.charAt(0);
        }

        @Override
        public String toString() {
            return type == Type.EOF ? "end of input" : "'" + text + "'";
        }
    }

    private FormulaLexer() {
    }

    static List<Token> tokenize(String src) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < src.length(); i++) {
            char ch = src.charAt(i);
            if (Character.isWhitespace(ch)) {
                continue;
            }
            Type type = classify(ch);
            if (type == null) {
                throw new SyntaxException("Unknown symbol '" + ch + "' at position " + (i + 1) + ".", String.valueOf(ch));
            }
            tokens.add(new Token(type, String.valueOf(ch), i));
        }
        tokens.add(new Token(Type.EOF, "", src.length()));
        return tokens;
    }

    private static Type classify(char ch) {
        switch (ch) {
            case '¬':
                return Type.NOT;
            case '∧':
                return Type.AND;
            case '∨':
                return Type.OR;
            case '→':
                return Type.IMPLIES;
            case '↔':
                return Type.IFF;
            case '⊥':
                return Type.BOTTOM;
            case '∀':
                return Type.FORALL;
            case '∃':
                return Type.EXISTS;
            case '□':
                return Type.BOX;
            case '♢':
            case '◇':
                return Type.DIAMOND;
            case '=':
                return Type.EQUALS;
            case '(':
                return Type.LPAREN;
            case ')':
                return Type.RPAREN;
            case ',':
                return Type.COMMA;
            default:
                break;
        }
        if (ch >= 'A' && ch <= 'Z') {
            return Type.UPPER;
        }
        if (ch >= 'a' && ch <= 'z') {
            return Type.LOWER;
        }
        return null;
    }
}
