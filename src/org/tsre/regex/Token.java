/*
 * @LICENSE@
 */

package org.tsre.regex;

/**
 * One element of the token sequence the {@linkplain RegexParser parser}
 * produces and the {@linkplain NFA NFA builder} consumes. The sequence is
 * operand-first like a postfix form, but the parser never emits a
 * {@link Kind#CONCAT} on its own: adjacent operands stay separate fragments
 * unless the pattern asks for concatenation with an explicit <code>.</code>
 * after them (e.g. <code>ab.</code>).
 * <p>
 * Tokens are immutable values.
 */
public final class Token {

    /**
     * The closed set of token kinds. Each kind knows the number of operand
     * fragments it pops off the builder's stack.
     */
    public enum Kind {
        /** A single literal char. */
        LITERAL(0, '\0'),
        /**
         * The verbatim contents of a bracket expression, matched as a single
         * symbol. <code>[abc]</code> matches the symbol "abc", not one of a, b,
         * or c.
         */
        CLASS(0, '\0'),
        CONCAT(2, '.'),
        ALTERNATION(2, '|'),
        STAR(1, '*'),
        PLUS(1, '+'),
        OPTIONAL(1, '?'),
        /**
         * Negation of the top fragment, or a start anchor when there is no
         * fragment yet.
         */
        CARET(1, '^'),
        /** End anchor; needs exactly one fragment on the stack. */
        DOLLAR(1, '$'),
        /**
         * Opens a bracket class in a raw token stream. Parsed patterns never
         * contain it since the parser collects classes itself.
         */
        BRACKET_OPEN(0, '['),
        BRACKET_CLOSE(0, ']');

        private final int arity;
        private final char symbol;

        Kind(int arity, char symbol) {
            this.arity = arity;
            this.symbol = symbol;
        }

        public int arity() {
            return arity;
        }

        /**
         * The pattern char of an operator kind; <code>'\0'</code> for
         * {@link #LITERAL} and {@link #CLASS}.
         */
        public char symbol() {
            return symbol;
        }

        boolean isOperand() {
            return this == LITERAL || this == CLASS;
        }

        static Kind forOperator(char c) {
            for (Kind kind : values()) {
                if (!kind.isOperand() && kind.symbol == c) return kind;
            }
            throw new IllegalArgumentException("not an operator: " + c);
        }
    }

    private final Kind kind;
    private final String text;

    private Token(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static Token literal(char c) {
        return new Token(Kind.LITERAL, String.valueOf(c));
    }

    public static Token charClass(String members) {
        if (members == null) throw new NullPointerException("members");
        return new Token(Kind.CLASS, members);
    }

    /**
     * A payload free token.
     *
     * @throws IllegalArgumentException
     *             for {@link Kind#LITERAL} and {@link Kind#CLASS}, which need
     *             a payload.
     */
    public static Token of(Kind kind) {
        if (kind.isOperand()) {
            throw new IllegalArgumentException(kind + " needs a payload");
        }
        return new Token(kind, String.valueOf(kind.symbol));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The symbol an operand token matches, or the pattern char of an
     * operator.
     */
    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token that = (Token) o;
        return kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + text.hashCode();
    }

    @Override
    public String toString() {
        switch (kind) {
        case LITERAL:
            return Misc.Esc.RXP.esc(text);
        case CLASS:
            return "[" + Misc.Esc.RX.esc(text) + "]";
        default:
            return text;
        }
    }
}
