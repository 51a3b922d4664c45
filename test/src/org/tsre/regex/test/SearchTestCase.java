/* @LICENSE@
 */

package org.tsre.regex.test;

import static org.tsre.regex.RegexAssert.*;

import static java.util.Arrays.asList;

import java.util.Collections;

import org.tsre.regex.AbstractRxTestCase;
import org.tsre.regex.Alphabet;
import org.tsre.regex.Pattern;
import org.tsre.regex.Regex;
import org.tsre.regex.StructuralException;

public class SearchTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(SearchTestCase.class);
    }

    public SearchTestCase(String name) {
        super(name);
    }

    public void testFindAll() {
        assertFindAll("a", "aaab", LOWER, "a", "a", "a");
        assertFalse(Regex.findAll("a", "aaab", LOWER).contains("aa"));
        assertFindAll("b", "aaab", LOWER, "b");
        assertFindAll("c", "aaab", LOWER);
    }

    public void testFindAllOverlapsAndOrder() {
        // ascending start, then ascending end
        assertFindAll("a+", "aaa", LOWER, "a", "aa", "aaa", "a", "aa", "a");
        assertFindAll("a*", "aab", LOWER, "a", "aa", "a");
        assertFindAll("a|b", "abab", LOWER, "a", "b", "a", "b");
        assertFindAll("ab.", "xabyab", LOWER, "ab", "ab");
    }

    public void testFindAllSkipsEmpty() {
        assertTrue(Regex.match("a*", "", LOWER));
        assertFindAll("a*", "", LOWER);
        assertFindAll("a?", "b", LOWER);
    }

    public void testSearch() {
        assertEquals(0, Regex.search("a", "aaab", LOWER));
        assertEquals(3, Regex.search("b", "aaab", LOWER));
        assertEquals(-1, Regex.search("c", "aaab", LOWER));
        assertEquals(1, Regex.search("ab.", "xabyab", LOWER));
        assertEquals(-1, Regex.search("a*", "", LOWER));
    }

    public void testSearchAgreesWithFindAll() {
        String[] regexes = { "a", "b", "a*", "a+", "a|c", "^a", "ab.", "[ab]" };
        String[] inputs = { "", "a", "b", "aaab", "xyz", "ba", "cab" };
        for (String regex : regexes) {
            for (String input : inputs) {
                assertEquals(regex + " / " + input,
                    Regex.findAll(regex, input, LOWER).isEmpty(),
                    Regex.search(regex, input, LOWER) == -1);
            }
        }
    }

    public void testSplit() {
        assertEquals(asList("", "", "", "b"), Regex.split("a", "aaab", LOWER));
        assertEquals(asList("a", "c", "d"), Regex.split("b", "abcbd", LOWER));
        assertEquals(asList("abc"), Regex.split("x", "abc", LOWER));
        assertEquals(asList("x", "y", ""), Regex.split("ab.", "xabyab", LOWER));
        assertEquals(Collections.singletonList(""), Regex.split("a", "", LOWER));
    }

    public void testSub() {
        assertEquals("xxxb", Regex.sub("a", "x", "aaab", LOWER));
        assertEquals("axcxd", Regex.sub("b", "x", "abcbd", LOWER));
        assertEquals("abc", Regex.sub("x", "y", "abc", LOWER));
        assertEquals("x-y-", Regex.sub("ab.", "-", "xabyab", LOWER));
        assertEquals("", Regex.sub("a", "x", "", LOWER));
        assertEquals("$1\\b", Regex.sub("a", "$1\\", "ab", LOWER));   // literal
    }

    public void testOverlappingMatchesSkipped() {
        // aa, aaa, a, aa, a all start inside text already consumed
        assertEquals(asList("", "", ""), Regex.split("a+", "aaa", LOWER));
        assertEquals("xx", Regex.sub("a+", "x", "aaa", LOWER));
    }

    public void testRelocatedByValue() {
        /*
         * findAll gives [ab, b, b]: the "b" found at 1 lies inside "ab", so
         * looking it up by value from 2 lands on the "b" at 2 instead, and the
         * real second "b" has nowhere left to go.
         */
        assertEquals(asList("ab", "b", "b"), Regex.findAll("ab.|b", "abb", LOWER));
        assertEquals(asList("", "", ""), Regex.split("ab.|b", "abb", LOWER));
        assertEquals("xx", Regex.sub("ab.|b", "x", "abb", LOWER));
    }

    public void testOutOfAlphabet() {
        Alphabet ab = Alphabet.of("ab");
        assertEquals(asList("a", "a"), Regex.findAll("a", "aca", ab));
        assertEquals(asList("b"), Regex.findAll("^a", "abc", ab));
        assertEquals(asList("b", "c"), Regex.findAll("^a", "abc", LOWER));
    }

    public void testStructuralOnlyWhenProbed() {
        try {
            Regex.findAll("*", "abc", LOWER);
            fail("should throw");
        } catch (StructuralException expected) {}
        try {
            Regex.sub("a|", "x", "abc", LOWER);
            fail("should throw");
        } catch (StructuralException expected) {}
        // nothing to probe, nothing to compile
        assertTrue(Regex.findAll("*", "", LOWER).isEmpty());
        assertEquals(-1, Regex.search("*", "", LOWER));
    }

    public void testNullsOnEmptyInput() {
        try {
            Regex.findAll(null, "", LOWER);
            fail("should throw");
        } catch (NullPointerException expected) {}
        try {
            Regex.findAll("a", "", null);
            fail("should throw");
        } catch (NullPointerException expected) {}
        try {
            Regex.search(null, "", LOWER);
            fail("should throw");
        } catch (NullPointerException expected) {}
        try {
            Regex.search("a", "", null);
            fail("should throw");
        } catch (NullPointerException expected) {}
        try {
            Regex.split(null, "", LOWER);
            fail("should throw");
        } catch (NullPointerException expected) {}
        try {
            Regex.sub(null, "x", "", LOWER);
            fail("should throw");
        } catch (NullPointerException expected) {}
        try {
            Regex.sub("a", null, "", LOWER);
            fail("should throw");
        } catch (NullPointerException expected) {}
    }

    public void testFlags() {
        int flags = Pattern.X_TOP_FRAGMENT;
        assertEquals(asList("b", "b"), Regex.findAll("ab", "abab", LOWER, flags));
        assertEquals(1, Regex.search("ab", "abab", LOWER, flags));
        assertEquals(asList("a", "a", ""), Regex.split("ab", "abab", LOWER, flags));
        assertEquals("axax", Regex.sub("ab", "x", "abab", LOWER, flags));
    }
}
