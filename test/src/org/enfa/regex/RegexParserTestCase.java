/* @LICENSE@
 */

package org.enfa.regex;

import static org.enfa.regex.RegexAssert.assertAccepts;
import static org.enfa.regex.RegexAssert.assertRejects;
import static org.enfa.regex.RegexAssert.assertSameLanguage;
import static org.enfa.regex.RegexAssert.assertSyntaxError;

public class RegexParserTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexParserTestCase.class);
    }

    public RegexParserTestCase(String name) {
        super(name);
    }

    public void testSingleLiteral() {
        CompositeAutomaton lit = new RegexParser().parse("a");
        assertEquals(2, lit.size());
        assertEquals(Thompson.literal('a').toAutomaton(), lit.toAutomaton());
    }

    public void testStarBindsTighterThanConcat() {
        assertAccepts("ab*", "a", "ab", "abbb");
        assertRejects("ab*", "", "abab", "b");
    }

    public void testConcatBindsTighterThanUnion() {
        assertAccepts("ab|cd", "ab", "cd");
        assertRejects("ab|cd", "abd", "acd", "abcd", "");
    }

    public void testGrouping() {
        assertAccepts("(ab)*", "", "ab", "abab");
        assertRejects("(ab)*", "a", "aba", "b");
        assertAccepts("a(b|c)d", "abd", "acd");
        assertRejects("a(b|c)d", "ad", "abcd");
        assertAccepts("((a))", "a");
    }

    public void testExplicitConcatIsImplicitConcat() {
        String symbols = "abc";
        assertSameLanguage(automatonOf("ab*c"), automatonOf("a.b*.c"), symbols, 5);
        assertSameLanguage(automatonOf("(a|b)c"), automatonOf("(a|b).c"), symbols, 5);
        assertEquals(automatonOf("ab"), automatonOf("a.b"));
    }

    public void testPlusIsUnion() {
        assertEquals(automatonOf("a|b"), automatonOf("a+b"));
        assertAccepts("(0+1)*", "", "0", "1", "0110");
    }

    public void testUnionIsLeftAssociative() {
        // ((a|b)|c): the first union gets the lower identifiers
        Automaton abc = automatonOf("a|b|c");
        CompositeAutomaton expected = Thompson.union(
            Thompson.union(Thompson.literal('a'), Thompson.literal('b')),
            Thompson.literal('c'));
        assertEquals(expected.toAutomaton(), abc);
    }

    public void testConcatIsLeftAssociative() {
        CompositeAutomaton expected = Thompson.concat(
            Thompson.concat(Thompson.literal('a'), Thompson.literal('b')),
            Thompson.literal('c'));
        assertEquals(expected.toAutomaton(), automatonOf("abc"));
        assertEquals(expected.toAutomaton(), automatonOf("a.b.c"));
    }

    public void testDefaultExample() {
        assertAccepts("(01*1)*1", "1", "011", "0111", "0110111", "0111111");
        assertRejects("(01*1)*1", "", "0", "01", "11", "0110");
    }

    public void testCustomAlphabet() {
        RegexParser rxp = new RegexParser(Alphabet.of("xy-"));
        assertTrue(Simulator.accepts(rxp.parse("x-y*"), "x-yy"));
        assertEquals(Alphabet.of("xy-"), rxp.alphabet());
        try {
            rxp.parse("a");
            fail("'a' is outside the alphabet");
        } catch (RegexSyntaxException e) {
            assertEquals('a', e.offending());
        }
    }

    public void testNullArguments() {
        try {
            new RegexParser(null);
            fail("should throw");
        } catch (NullPointerException e) {}
        try {
            new RegexParser().parse(null);
            fail("should throw");
        } catch (NullPointerException e) {}
    }

    public void testLeadingOperators() {
        RegexSyntaxException e = assertSyntaxError("*a", '*', "start of expression");
        assertEquals(0, e.getIndex());
        assertTrue(e.getDescription(), e.getDescription().startsWith("Error processing '*'"));
        assertSyntaxError("|a", '|', "start of expression");
        assertSyntaxError(".a", '.', "start of expression");
        assertSyntaxError(")", ')', "empty stack");
    }

    public void testMisplacedOperators() {
        assertSyntaxError("a||b", '|', "'|'");
        assertSyntaxError("a|.b", '.', "'|'");
        assertSyntaxError("(|a)", '|', "'('");
        assertSyntaxError("(*a)", '*', "'('");
        assertSyntaxError("a|*", '*', "'|'");
        RegexSyntaxException e = assertSyntaxError("a**", '*', "'*'");
        assertEquals(2, e.getIndex());
        assertSyntaxError("(a|)", ')', "'|'");
    }

    public void testEmptyGroup() {
        assertSyntaxError("()", ')', "'('");
        assertSyntaxError("a()", ')', "'('");
    }

    public void testUnbalancedParentheses() {
        RegexSyntaxException e = assertSyntaxError("(a", '(', "end of expression");
        assertEquals(0, e.getIndex());
        assertTrue(e.getDescription(), e.getDescription().startsWith("Unbalanced parenthesis"));
        e = assertSyntaxError("a(b", '(', "end of expression");
        assertEquals(1, e.getIndex());
        e = assertSyntaxError("a)", ')', "empty stack");
        assertEquals(1, e.getIndex());
        assertSyntaxError("(a))", ')', "empty stack");
    }

    public void testTrailingBinaryOperator() {
        RegexSyntaxException e = assertSyntaxError("a|", '|', "inadequate operands");
        assertEquals(1, e.getIndex());
        assertTrue(e.getDescription(), e.getDescription().endsWith("Inadequate operands"));
        assertSyntaxError("ab.", '.', "inadequate operands");
        assertSyntaxError("a+", '+', "inadequate operands");
    }

    public void testSymbolNotAllowed() {
        RegexSyntaxException e = assertSyntaxError("a-b", '-', "'a'");
        assertEquals(1, e.getIndex());
        assertEquals("Symbol '-' is not allowed", e.getDescription());
        assertSyntaxError(" ", ' ', "start of expression");
        assertSyntaxError("a?", '?', "'a'");
    }

    public void testEmptyExpression() {
        RegexSyntaxException e = assertSyntaxError("", RegexSyntaxException.END,
            "start of expression");
        assertEquals("Empty expression", e.getDescription());
        assertEquals(-1, e.getIndex());
    }

    public void testMessageCarriesRegex() {
        RegexSyntaxException e = assertSyntaxError("ab)c", ')', "empty stack");
        assertTrue(e.getMessage(), e.getMessage().contains("ab)c"));
    }
}
