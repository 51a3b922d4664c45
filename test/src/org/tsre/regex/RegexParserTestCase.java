/* @LICENSE@
 */

package org.tsre.regex;

import static org.tsre.regex.RegexAssert.*;

import java.util.List;

import org.tsre.regex.Token.Kind;

public class RegexParserTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    public void testOperand() {
        assertTokens("", "[]");
        assertTokens("a", "[a]");
        assertTokens("ab", "[a, b]");      // no implicit concatenation
    }

    public void testPostfix() {
        assertTokens("a*", "[a, *]");
        assertTokens("a+", "[a, +]");
        assertTokens("a?", "[a, ?]");
        assertTokens("a|b", "[a, b, |]");
        assertTokens("(a|b)*", "[a, b, |, *]");
        assertTokens("^a", "[a, ^]");
        assertTokens("a$", "[a, $]");
    }

    public void testPrecedence() {
        assertTokens("a*b|c", "[a, b, *, c, |]");
        assertTokens("a*|b", "[a, *, b, |]");
        assertTokens("a|b*", "[a, b, *, |]");
        assertTokens("a+b*", "[a, b, *, +]");
        assertTokens("a*b+", "[a, b, *, +]");
        assertTokens("a|b|c", "[a, b, |, c, |]");   // left associative
        assertTokens("a*?", "[a, *, ?]");
        assertTokens("a?*", "[a, *, ?]");       // ? binds looser than *
    }

    public void testConcat() {
        List<Token> tokens = tokensOf("ab.");
        assertEquals(3, tokens.size());
        assertEquals(Kind.LITERAL, tokens.get(0).kind());
        assertEquals(Kind.LITERAL, tokens.get(1).kind());
        assertEquals(Kind.CONCAT, tokens.get(2).kind());
        assertTokens("ab|c.", "[a, b, c, ., |]");
        assertTokens("ab.*", "[a, b, ., *]");
        assertTokens("a\\.", "[a, \\.]");
    }

    public void testEscape() {
        List<Token> tokens = tokensOf("\\*\\(\\]\\\\");
        assertEquals(4, tokens.size());
        for (Token token : tokens) {
            assertEquals(Kind.LITERAL, token.kind());
        }
        assertEquals("*", tokens.get(0).text());
        assertEquals("(", tokens.get(1).text());
        assertEquals("]", tokens.get(2).text());
        assertEquals("\\", tokens.get(3).text());
        assertEquals("[\\*, \\(, \\], \\\\]", tokens.toString());
    }

    public void testTrailingBackslash() {
        assertTokens("a\\", "[a]");
        assertTokens("\\", "[]");
    }

    public void testClass() {
        List<Token> tokens = tokensOf("[abc]");
        assertEquals(1, tokens.size());
        assertEquals(Kind.CLASS, tokens.get(0).kind());
        assertEquals("abc", tokens.get(0).text());
        assertTokens("[abc]*", "[[abc], *]");

        // verbatim, no nesting, operators are just chars
        assertEquals("a[b", tokensOf("[a[b]").get(0).text());
        assertEquals("^a", tokensOf("[^a]").get(0).text());
        assertEquals("a|*", tokensOf("[a|*]").get(0).text());
        assertEquals("a]b", tokensOf("[a\\]b]").get(0).text());
        assertEquals("", tokensOf("[]").get(0).text());
    }

    public void testUnterminatedClass() {
        List<Token> tokens = tokensOf("a[bc");
        assertEquals(2, tokens.size());
        assertEquals(Token.charClass("bc"), tokens.get(1));
    }

    public void testUnbalanced() {
        assertTokens("a)*", "[a, *]");          // ')' with no '('
        assertTokens("a*)b", "[a, *, b]");      // ... flushes the stack
        assertTokens("a*]b", "[a, *, b]");      // stray ']' does the same
        assertTokens("(a", "[a, \\(]");         // leftover '(' comes out literal
        assertTokens("((a|b)", "[a, b, |, \\(]");
    }

    public void testScopeMarkerNotPoppedByPrecedence() {
        assertTokens("(a|b)|c", "[a, b, |, c, |]");
        assertTokens("a|(b|c)", "[a, b, c, |, |]");
        assertTokens("(a*)", "[a, *]");
    }

    public void testLoneOperators() {
        assertTokens("*", "[*]");
        assertTokens("^", "[^]");
        assertTokens("|", "[|]");
    }

    public void testPrecedenceTable() {
        assertTrue(RegexParser.precedence('|') < RegexParser.precedence('+'));
        assertTrue(RegexParser.precedence('+') < RegexParser.precedence('?'));
        assertTrue(RegexParser.precedence('?') < RegexParser.precedence('*'));
        assertTrue(RegexParser.precedence('*') < RegexParser.precedence('^'));
        assertTrue(RegexParser.precedence('^') < RegexParser.precedence('$'));
        assertTrue(RegexParser.precedence('$') < RegexParser.precedence('.'));
        assertEquals(RegexParser.precedence('('), RegexParser.precedence('['));
        assertFalse(RegexParser.isOperator('a'));
        assertTrue(RegexParser.isOperator(')'));
        assertTrue(RegexParser.isOperator(']'));
        assertEquals(-1, RegexParser.precedence(')'));
    }

    public void testGroupCloses() {
        // the closer pops back to its '(' and is never an operand itself
        assertTokens("(ab)", "[a, b]");
        assertTokens("(ab.)*", "[a, b, ., *]");
        assertTokens("(a|b)*", "[a, b, |, *]");
        for (Token token : tokensOf("((a|b)*)|(c)")) {
            assertFalse(token.toString(), "(".equals(token.text()));
            assertFalse(token.toString(), ")".equals(token.text()));
        }
        assertTokens("((a|b)*)|(c)", "[a, b, |, *, c, |]");
        assertTokens("a*]b", "[a, *, b]");
    }

    public void testParserReuse() {
        RegexParser rxp = new RegexParser();
        assertEquals("[a, *]", rxp.parse("a*").toString());
        assertEquals("[b]", rxp.parse("b").toString());
        assertEquals("[[x]]", rxp.parse("[x").toString());
        assertEquals("[y]", rxp.parse("y").toString());
    }
}
