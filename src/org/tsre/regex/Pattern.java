/*
 * @LICENSE@
 */

package org.tsre.regex;

import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.tsre.regex.Misc.FlagMgr;

/**
 * A compiled representation of a pattern over a fixed {@link Alphabet}. The
 * pattern is parsed into {@linkplain Token tokens}, the tokens are assembled
 * into an NFA by Thompson construction, and the NFA is turned into a DFA by
 * subset construction. Instances are immutable and thread safe.
 * <p>
 * <strong>Syntax:</strong>
 * <ul>
 * <li><code>|</code>, <code>*</code>, <code>+</code>, <code>?</code> with
 * the usual meaning, applied to fragments in token order. Grouping with
 * <code>( )</code> only changes operator order.</li>
 * <li>Concatenation is <em>not</em> implicit: <code>ab</code> leaves two
 * fragments and fails to compile. Write it postfix with an explicit
 * <code>.</code>: <code>ab.</code> matches "ab".</li>
 * <li><code>^</code> negates the preceding fragment against the alphabet
 * (<code>^a</code> is any one symbol but <code>a</code>); with nothing to
 * negate it anchors the following fragment, which changes nothing since
 * matching is always whole-string. <code>$</code> likewise.</li>
 * <li><code>[abc]</code> is a single symbol "abc". Since input is read one
 * char at a time, a class of more than one char never matches.</li>
 * <li><code>\c</code> is always the literal <code>c</code>.</li>
 * </ul>
 * Matching is whole-string only. Input chars outside the alphabet are simply
 * not matched.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.tsre.regex");
    private static final Level level = Level.FINEST;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * When the tokens leave more than one fragment, use the topmost one
     * instead of throwing {@link StructuralException}. With this flag
     * <code>ab</code> compiles, and matches "b".
     */
    public static final int X_TOP_FRAGMENT = flagMgr.next("X_TOP_FRAGMENT");

    static final int FLAG_COUNT =
            flagMgr.freezeAndCount();

    final String regex;
    final Alphabet alphabet;
    final int flags;
    private final List<Token> tokens;
    final DFA dfa;

    private Pattern(String regex, Alphabet alphabet, int flags) {

        flagMgr.check(flags);
        this.regex = regex;
        logger.log(level, "regex: " + regex);
        this.alphabet = alphabet;
        logger.log(level, "alphabet: " + alphabet);
        this.flags = flags;
        logger.log(level, "flags: " + flagMgr.stringFrom(flags));
        this.tokens = Collections.unmodifiableList(new RegexParser().parse(regex));
        NFA nfa = new NFA(tokens, alphabet, flags);
        this.dfa = new DFA(nfa, alphabet);
    }

    public static Pattern compile(String regex, Alphabet alphabet) {
        return compile(regex, alphabet, 0);
    }

    /**
     * @param regex
     *            the pattern to be compiled.
     * @param alphabet
     *            the symbols the automata are built over.
     * @param flags
     *            {@link #X_TOP_FRAGMENT}, or 0.
     * @return the pattern.
     * @throws StructuralException
     *             if the tokens of <code>regex</code> don't assemble into a
     *             single automaton.
     * @throws IllegalArgumentException
     *             for unknown flags.
     */
    public static Pattern compile(String regex, Alphabet alphabet, int flags) {
        if (regex == null) throw new NullPointerException("regex");
        if (alphabet == null) throw new NullPointerException("alphabet");
        return new Pattern(regex, alphabet, flags);
    }

    /**
     * Compiles <code>regex</code> afresh and matches the whole of
     * <code>input</code> against it.
     */
    public static boolean matches(String regex, CharSequence input, Alphabet alphabet) {
        return matches(regex, input, alphabet, 0);
    }

    public static boolean matches(
            String regex, CharSequence input, Alphabet alphabet, int flags) {
        return compile(regex, alphabet, flags).matches(input);
    }

    /**
     * @return true if the whole of <code>input</code> is in the language of
     *         this pattern.
     */
    public boolean matches(CharSequence input) {
        if (input == null) throw new NullPointerException("input");
        return dfa.accepts(input);
    }

    public int flags() {
        return flags;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * The token sequence the pattern was parsed into.
     *
     * @return an unmodifiable list.
     */
    public List<Token> tokens() {
        return tokens;
    }

    public String pattern() {
        return toString();
    }

    @Override
    public String toString() {
        return regex;
    }
}
