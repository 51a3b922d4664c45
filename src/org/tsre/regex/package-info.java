/*
 * @LICENSE@
 */

/**
 * <h3><b>tsre</b> - textbook finite automata regex over a fixed alphabet.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * A pattern goes through three stages, all rebuilt from scratch on each
 * compilation:
 * <ol>
 * <li>the parser turns the pattern into a {@linkplain Token token} sequence
 * with a shunting-yard pass;</li>
 * <li>the tokens are assembled into an NFA by Thompson construction, one
 * fragment per operand and operator, combined on a stack;</li>
 * <li>the NFA becomes a DFA by subset construction, each DFA state being the
 * epsilon-closed set of NFA states reachable on the input so far.</li>
 * </ol>
 * The DFA then decides whole-string membership one char at a time.
 * <p>
 * All automata are built over a caller supplied {@link Alphabet}; the
 * alphabet is what the subset construction enumerates and what negation is
 * taken against.
 * <p>
 * <h4>Differences with conventional regex packages.</h4>
 * <ul>
 * <li>Concatenation is never implied. <code>ab</code> is two fragments and
 * fails to compile; <code>ab.</code> concatenates.</li>
 * <li><code>[abc]</code> is the single symbol "abc".</li>
 * <li><code>^</code> after an operand is a (shallow) negation.</li>
 * <li>{@link Regex#findAll} returns every matching substring, overlaps
 * included, rather than leftmost non-overlapping matches.</li>
 * </ul>
 * See {@link Pattern} for the syntax and {@link Regex} for searching.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For an introduction to the theory behind regular expression and their
 * implementation as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>, on Thompson's construction.
 * </ul>
 */
package org.tsre.regex;
