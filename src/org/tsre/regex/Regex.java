/*
 * @LICENSE@
 */
package org.tsre.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static match, search, split and substitution over a {@link Pattern}.
 * <p>
 * Every probe compiles the pattern again, nothing is kept between calls.
 * Searching is brute force: each non-empty substring
 * <code>input[i, j)</code> is matched whole, for ascending <code>i</code> and
 * then ascending <code>j</code>. The matches found this way may overlap and
 * repeat; that is what {@link #findAll} returns. {@link #split} and
 * {@link #sub} re-locate each match by its <em>value</em>, searching forward
 * from the end of the previous one, so a value that recurs earlier than the
 * occurrence actually matched is taken at the earlier spot.
 */
public final class Regex {

    private static final Logger logger = Logger.getLogger("org.tsre.regex");
    private static final Level level = Level.FINER;

    private Regex() {}  // not instantiable.

    /*
     * up front, since an empty input never reaches Pattern.compile
     */
    private static void checkArgs(String regex, String input, Alphabet alphabet) {
        if (regex == null) throw new NullPointerException("regex");
        if (input == null) throw new NullPointerException("input");
        if (alphabet == null) throw new NullPointerException("alphabet");
    }

    public static boolean match(String regex, String input, Alphabet alphabet) {
        return match(regex, input, alphabet, 0);
    }

    public static boolean match(String regex, String input, Alphabet alphabet, int flags) {
        return Pattern.matches(regex, input, alphabet, flags);
    }

    public static List<String> findAll(String regex, String input, Alphabet alphabet) {
        return findAll(regex, input, alphabet, 0);
    }

    /**
     * Every non-empty substring of <code>input</code> that the pattern
     * matches, by ascending start, then ascending end.
     */
    public static List<String> findAll(
            String regex, String input, Alphabet alphabet, int flags) {
        checkArgs(regex, input, alphabet);
        List<String> ret = new ArrayList<String>();
        final int n = input.length();
        for (int i = 0; i < n; ++i) {
            for (int j = i + 1; j <= n; ++j) {
                String s = input.substring(i, j);
                if (match(regex, s, alphabet, flags)) ret.add(s);
            }
        }
        logger.log(level, "findAll " + regex + " in \"" + input + "\": " + ret);
        return ret;
    }

    public static int search(String regex, String input, Alphabet alphabet) {
        return search(regex, input, alphabet, 0);
    }

    /**
     * @return the start of the first matching substring, or -1.
     */
    public static int search(String regex, String input, Alphabet alphabet, int flags) {
        checkArgs(regex, input, alphabet);
        final int n = input.length();
        for (int i = 0; i < n; ++i) {
            for (int j = i + 1; j <= n; ++j) {
                if (match(regex, input.substring(i, j), alphabet, flags)) return i;
            }
        }
        return -1;
    }

    public static List<String> split(String regex, String input, Alphabet alphabet) {
        return split(regex, input, alphabet, 0);
    }

    /**
     * The text around the matches, always one more piece than the matches
     * actually located. <code>split("a", "aaab")</code> is
     * <code>["", "", "", "b"]</code>.
     */
    public static List<String> split(String regex, String input, Alphabet alphabet, int flags) {
        final List<String> ret = new ArrayList<String>();
        String tail = new Walker(input) {
            @Override
            void piece(String before, String match) {
                ret.add(before);
            }
        }.walk(findAll(regex, input, alphabet, flags));
        ret.add(tail);
        return ret;
    }

    public static String sub(String regex, String replacement, String input, Alphabet alphabet) {
        return sub(regex, replacement, input, alphabet, 0);
    }

    /**
     * <code>input</code> with every located match replaced by
     * <code>replacement</code>, taken literally.
     */
    public static String sub(
            String regex, final String replacement, String input, Alphabet alphabet, int flags) {
        if (replacement == null) throw new NullPointerException("replacement");
        final StringBuilder sb = new StringBuilder();
        String tail = new Walker(input) {
            @Override
            void piece(String before, String match) {
                sb.append(before).append(replacement);
            }
        }.walk(findAll(regex, input, alphabet, flags));
        return sb.append(tail).toString();
    }

    /*
     * Locates each match value by indexOf from the end of the previous one.
     * A value with no occurrence at or after that point overlapped an earlier
     * match and is skipped.
     */
    private static abstract class Walker {

        private final String input;

        Walker(String input) {
            this.input = input;
        }

        abstract void piece(String before, String match);

        final String walk(List<String> matches) {
            int lastEnd = 0;
            for (String match : matches) {
                int start = input.indexOf(match, lastEnd);
                if (start < 0) continue;
                piece(input.substring(lastEnd, start), match);
                lastEnd = start + match.length();
            }
            return input.substring(lastEnd);
        }
    }
}
