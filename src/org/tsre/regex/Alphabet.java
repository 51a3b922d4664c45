/*
 * @LICENSE@
 */

package org.tsre.regex;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The finite set of input symbols a {@link Pattern} is compiled against.
 * Automata only ever have arcs on members of their alphabet, so an input
 * char outside the alphabet can never be matched; this is not an error.
 * <p>
 * Instances are immutable. Iteration is in ascending <code>char</code> order,
 * which fixes the order in which the subset construction visits symbols.
 */
public final class Alphabet implements Iterable<Character> {

    /**
     * The lower case ASCII letters, <code>a</code> through <code>z</code>.
     */
    public static final Alphabet LOWERCASE = range('a', 'z');

    private final char[] symbols;   // sorted, distinct

    private Alphabet(char[] symbols) {
        this.symbols = symbols;
    }

    /**
     * An alphabet of every distinct char in <code>csq</code>.
     */
    public static Alphabet of(CharSequence csq) {
        SortedSet<Character> set = new TreeSet<Character>();
        for (int i = 0; i < csq.length(); ++i) {
            set.add(csq.charAt(i));
        }
        char[] symbols = new char[set.size()];
        int i = 0;
        for (char c : set) {
            symbols[i++] = c;
        }
        return new Alphabet(symbols);
    }

    /**
     * An alphabet of the chars from <code>first</code> to <code>last</code>,
     * inclusive.
     */
    public static Alphabet range(char first, char last) {
        if (last < first) {
            throw new IllegalArgumentException(
                "empty range: " + first + "-" + last);
        }
        char[] symbols = new char[last - first + 1];
        for (int i = 0; i < symbols.length; ++i) {
            symbols[i] = (char) (first + i);
        }
        return new Alphabet(symbols);
    }

    public boolean contains(char c) {
        return Arrays.binarySearch(symbols, c) >= 0;
    }

    public int size() {
        return symbols.length;
    }

    public Iterator<Character> iterator() {
        return new Iterator<Character>() {
            private int i = 0;

            public boolean hasNext() {
                return i < symbols.length;
            }

            public Character next() {
                if (!hasNext()) throw new NoSuchElementException();
                return symbols[i++];
            }

            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Alphabet
                && Arrays.equals(symbols, ((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        return "{" + Misc.Esc.RX.esc(new String(symbols)) + "}";
    }
}
