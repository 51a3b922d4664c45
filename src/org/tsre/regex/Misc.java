/*
 * @LICENSE@
 */

package org.tsre.regex;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    /*
     * set of handles as "{0,3,7}"
     */
    static String stringFrom(BitSet handles) {
        StringBuilder sb = new StringBuilder("{");
        for (int i = handles.nextSetBit(0); i >= 0; i = handles.nextSetBit(i + 1)) {
            if (sb.length() > 1) sb.append(',');
            sb.append(i);
        }
        return sb.append('}').toString();
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    };

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper rxEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t")
                .map('\b', "\\b").map('\f', "\\f").map('\\', "\\\\");
    private static final MapEscaper rxpEscaper =
            new MapEscaper().map('.', "\\.").map('^', "\\^").map('$', "\\$")
                .map('[', "\\[").map(']', "\\]").map('|', "\\|")
                .map('(', "\\(").map(')', "\\)").map('*', "\\*")
                .map('+', "\\+").map('?', "\\?");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Regex escaper - escapes backslash and some ASCII ctl, non-printable
         * ASCII and beyond -> \\u codes
         */
        RX(rxEscaper, unicodeEscaper),
        /**
         * Regex Pattern escaper - escapes as RX plus the operator chars
         * (like '*'), so the result reads back as a literal.
         */
        RXP(rxEscaper, rxpEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
            return sb.toString();
        }
    }

    /*
     * Scans a pattern one char at a time; an escaped char comes back with
     * BACKSLASH (bit 31) set. A backslash with nothing after it comes back
     * unescaped.
     */
    static final class CharScanner implements Iterable<Integer> {
        static final int BACKSLASH = 0x80000000;
        private final CharSequence cs;
        CharScanner(CharSequence cs) {this.cs = cs;}
        public Iterator<Integer> iterator() {
            return new Iterator<Integer>() {
                int i = 0;
                public boolean hasNext() {
                    return i < cs.length();
                }
                public Integer next() {
                    if (!hasNext()) throw new NoSuchElementException();
                    int c = cs.charAt(i++);
                    if (c == '\\' && i < cs.length()) {
                        c = cs.charAt(i++);
                        c |= BACKSLASH;
                    }
                    return c;
                }
                public void remove() {
                    throw new UnsupportedOperationException();
                }
            };
        }
        static boolean escaped(int c) {
            return (c & BACKSLASH) != 0;
        }
        static char charOf(int c) {
            return (char) (c & ~BACKSLASH);
        }
    }
}
