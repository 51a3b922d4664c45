/* @LICENSE@
 */
package org.tsre.regex;

import java.util.List;

/**
 * A runtime exception thrown when a token sequence can't be assembled into an
 * NFA: an operator found fewer fragments on the stack than it needs, or the
 * tokens left no fragment, or more than one.
 */
public final class StructuralException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Token token;
    private final transient List<Token> tokens;

    public StructuralException(String msg, Token token, List<Token> tokens) {
        super(msg);
        this.token = token;
        this.tokens = tokens;
    }

    /**
     * The operator that was short of operands, or <code>null</code> when the
     * final stack was at fault.
     */
    public Token token() {
        return token;
    }

    /**
     * The whole token sequence being assembled.
     */
    public List<Token> tokens() {
        return tokens;
    }
}
