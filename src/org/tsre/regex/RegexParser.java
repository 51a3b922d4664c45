/* @LICENSE@
 */

package org.tsre.regex;

import static org.tsre.regex.Misc.CharScanner.charOf;
import static org.tsre.regex.Misc.CharScanner.escaped;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tsre.regex.Misc.CharScanner;
import org.tsre.regex.Token.Kind;

/**
 * Turns a pattern into a {@link Token} sequence with a shunting-yard pass over
 * an output queue and an operator stack. Never fails: unbalanced parens and
 * brackets fall through (see {@link #parse(String)}).
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.tsre.regex");
    private static final Level level = Level.FINEST;

    private static final int EOX = -1;  // no operator

    /*
     * aux fields for parsing
     */
    private final List<Token> output = new ArrayList<Token>();
    private final Deque<Character> operators = new ArrayDeque<Character>();
    private final StringBuilder members = new StringBuilder();
    private boolean inClass;

    private void init() {
        output.clear();
        operators.clear();
        Misc.clear(members);
        inClass = false;
    }

    /**
     * True for the operators and for the scope closers <code>)</code> and
     * <code>]</code>, which have no precedence of their own.
     */
    static boolean isOperator(char c) {
        return precedence(c) != EOX || c == ')' || c == ']';
    }

    /**
     * Operator precedence; higher binds tighter. <code>(</code> and
     * <code>[</code> are scope markers and never popped by precedence.
     */
    static int precedence(char c) {
        switch (c) {
        case '|': return 1;
        case '+': return 2;
        case '?': return 3;
        case '*': return 4;
        case '^': return 5;
        case '$': return 6;
        case '.': return 7; // concatenation; only ever emitted in place
        case '(':
        case '[': return 8;
        default:  return EOX;
        }
    }

    private static boolean isScopeMarker(char c) {
        return c == '(' || c == '[';
    }

    /**
     * Parse <code>regex</code>:
     * <ul>
     * <li>an escaped char is a {@link Kind#LITERAL}; a trailing lone backslash
     * is dropped.</li>
     * <li><code>[...]</code> is collected verbatim, up to the first unescaped
     * <code>]</code>, into one {@link Kind#CLASS} token. An unterminated class
     * is closed at end of input.</li>
     * <li><code>)</code> pops operators up to the matching <code>(</code>; with
     * no <code>(</code> on the stack it empties the stack. A stray <code>]</code>
     * does the same against <code>[</code>.</li>
     * <li>an unescaped <code>.</code> is a {@link Kind#CONCAT}, in place.</li>
     * <li>a <code>(</code> still on the stack at the end comes out as a
     * literal.</li>
     * </ul>
     */
    List<Token> parse(String regex) {

        init();
        for (int c : new CharScanner(regex)) {
            char ch = charOf(c);
            if (escaped(c)) {
                if (inClass) {
                    members.append(ch);
                } else {
                    output.add(Token.literal(ch));
                }
            } else if (ch == '\\') {
                continue;   // trailing lone backslash
            } else if (inClass) {
                if (ch == ']') {
                    output.add(Token.charClass(members.toString()));
                    inClass = false;
                } else {
                    members.append(ch);
                }
            } else if (ch == '[') {
                Misc.clear(members);
                inClass = true;
            } else if (ch == '.') {
                output.add(Token.of(Kind.CONCAT));
            } else if (isOperator(ch)) {
                operator(ch);
            } else {
                output.add(Token.literal(ch));
            }
        }
        if (inClass) {
            output.add(Token.charClass(members.toString()));
        }
        while (!operators.isEmpty()) {
            emit(operators.pop());
        }

        List<Token> ret = new ArrayList<Token>(output);
        logger.log(level, "tokens: " + ret);
        return ret;
    }

    private void operator(char c) {
        switch (c) {
        case '(':
            operators.push(c);
            break;
        case ')':
            closeScope('(');
            break;
        case ']':
            closeScope('[');
            break;
        default:
            while (!operators.isEmpty()
                    && !isScopeMarker(operators.peek())
                    && precedence(operators.peek()) >= precedence(c)) {
                emit(operators.pop());
            }
            operators.push(c);
        }
    }

    private void closeScope(char open) {
        while (!operators.isEmpty() && operators.peek() != open) {
            emit(operators.pop());
        }
        if (!operators.isEmpty()) {
            operators.pop();
        }
    }

    private void emit(char op) {
        output.add(op == '(' ? Token.literal(op) : Token.of(Kind.forOperator(op)));
    }
}
