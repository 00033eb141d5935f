package gr.imsi.athenarc.regexnfa.regex;

import static org.junit.Assert.*;

import org.junit.Test;

public class PostfixCompilerTest {

    private static final char C = RegexOperators.CONCAT;

    private final ConcatenationExpander expander = new ConcatenationExpander();
    private final PostfixCompiler compiler = new PostfixCompiler();

    private String postfix(String regex) {
        return compiler.toPostfix(expander.expand(regex));
    }

    @Test
    public void testUnion() {
        assertEquals("ab|", postfix("a|b"));
        assertEquals("Union is left associative", "ab|c|", postfix("a|b|c"));
    }

    @Test
    public void testUnaryBindsTighterThanConcatenation() {
        assertEquals("ab*" + C, postfix("ab*"));
        assertEquals("a?b" + C, postfix("a?b"));
    }

    @Test
    public void testConcatenationBindsTighterThanUnion() {
        assertEquals("abc" + C + "|", postfix("a|bc"));
        assertEquals("ab" + C + "c|", postfix("ab|c"));
    }

    @Test
    public void testGroupsRemoveParentheses() {
        assertEquals("ab" + C + "+", postfix("(ab)+"));
        assertEquals("ab|c" + C, postfix("(a|b)c"));
        assertEquals("abc" + C + "*" + C + "d" + C, postfix("a(bc)*d"));
    }

    @Test
    public void testMalformedArityIsPassedThrough() {
        assertEquals("a|", postfix("a|"));
        assertEquals("", postfix("()"));
    }
}
