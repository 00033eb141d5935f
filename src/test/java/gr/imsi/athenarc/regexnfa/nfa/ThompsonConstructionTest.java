package gr.imsi.athenarc.regexnfa.nfa;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

import gr.imsi.athenarc.regexnfa.regex.ConcatenationExpander;
import gr.imsi.athenarc.regexnfa.regex.PostfixCompiler;
import gr.imsi.athenarc.regexnfa.regex.RegexOperators;

public class ThompsonConstructionTest {

    private static final char C = RegexOperators.CONCAT;

    private final ThompsonConstruction construction = new ThompsonConstruction();

    private NFA fromRegex(String regex) throws NFAConstructionException {
        return construction.build(new PostfixCompiler().toPostfix(new ConcatenationExpander().expand(regex)));
    }

    @Test
    public void testLiteralFragment() throws NFAConstructionException {
        NFA nfa = construction.build("a");
        assertEquals("A literal allocates two states", 2, nfa.size());
        assertEquals(new HashSet<>(Arrays.asList(nfa.getAcceptIndex())), nfa.getStartState().getTargets('a'));
        assertTrue(nfa.getStartState().getEpsilonTargets().isEmpty());
        assertTrue(nfa.isFrozen());
    }

    @Test
    public void testStarFragment() throws NFAConstructionException {
        NFA nfa = construction.build("a*");
        assertEquals(4, nfa.size());
        // inner literal is 0 -> 1, the star adds 2 (start) and 3 (accept)
        assertEquals(2, nfa.getStartIndex());
        assertEquals(3, nfa.getAcceptIndex());
        assertEquals(new HashSet<>(Arrays.asList(0, 3)), nfa.getStartState().getEpsilonTargets());
        assertEquals("Inner accept loops back and exits",
                     new HashSet<>(Arrays.asList(0, 3)), nfa.getState(1).getEpsilonTargets());
    }

    @Test
    public void testPlusFragmentHasNoBypass() throws NFAConstructionException {
        NFA nfa = construction.build("a+");
        assertEquals(new HashSet<>(Arrays.asList(0)), nfa.getStartState().getEpsilonTargets());
        assertEquals(new HashSet<>(Arrays.asList(0, 3)), nfa.getState(1).getEpsilonTargets());
    }

    @Test
    public void testOptionalFragmentHasNoLoop() throws NFAConstructionException {
        NFA nfa = construction.build("a?");
        assertEquals(new HashSet<>(Arrays.asList(0, 3)), nfa.getStartState().getEpsilonTargets());
        assertEquals(new HashSet<>(Arrays.asList(3)), nfa.getState(1).getEpsilonTargets());
    }

    @Test
    public void testUnionFragment() throws NFAConstructionException {
        NFA nfa = construction.build("ab|");
        assertEquals(6, nfa.size());
        assertEquals(new HashSet<>(Arrays.asList(0, 2)), nfa.getStartState().getEpsilonTargets());
        assertEquals(new HashSet<>(Arrays.asList(5)), nfa.getState(1).getEpsilonTargets());
        assertEquals(new HashSet<>(Arrays.asList(5)), nfa.getState(3).getEpsilonTargets());
    }

    @Test
    public void testConcatenationAllocatesNoStates() throws NFAConstructionException {
        NFA nfa = construction.build("ab" + C);
        assertEquals(4, nfa.size());
        assertEquals(0, nfa.getStartIndex());
        assertEquals(3, nfa.getAcceptIndex());
        assertEquals(new HashSet<>(Arrays.asList(2)), nfa.getState(1).getEpsilonTargets());
    }

    /**
     * The designated accept state is never left through an edge, for every construction rule.
     */
    @Test
    public void testAcceptStateHasNoOutgoingEdges() throws NFAConstructionException {
        for (String regex : new String[] {"a", "ab", "a|b", "a*", "a+", "a?", "(ab)+c", "a(b|c)*d?", "((a*)*)+"}) {
            NFA nfa = fromRegex(regex);
            assertTrue(regex, nfa.getAcceptState().getTransitions().isEmpty());
            assertTrue(regex, nfa.getAcceptState().getEpsilonTargets().isEmpty());
            assertNotEquals(regex, nfa.getStartIndex(), nfa.getAcceptIndex());
        }
    }

    @Test
    public void testTrailingUnionUnderflows() {
        try {
            fromRegex("a|");
            fail("Expected stack underflow");
        } catch (NFAConstructionException e) {
            assertEquals(ConstructionErrorType.STACK_UNDERFLOW, e.getErrorType());
        }
    }

    @Test
    public void testLeadingOperatorsUnderflow() {
        for (String regex : new String[] {"*a", "|a", ".a", "a.", "()", "(|)"}) {
            try {
                fromRegex(regex);
                fail("Expected stack underflow for " + regex);
            } catch (NFAConstructionException e) {
                assertEquals(regex, ConstructionErrorType.STACK_UNDERFLOW, e.getErrorType());
            }
        }
    }

    @Test
    public void testLeftoverFragments() {
        try {
            construction.build("ab");
            fail("Expected leftover fragments");
        } catch (NFAConstructionException e) {
            assertEquals(ConstructionErrorType.LEFTOVER_FRAGMENTS, e.getErrorType());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testBuiltNfaIsFrozen() throws NFAConstructionException {
        NFA nfa = construction.build("a");
        nfa.addEpsilon(0, 1);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testBuiltTransitionTargetsAreReadOnly() throws NFAConstructionException {
        NFA nfa = construction.build("a");
        nfa.getStartState().getTransitions().get('a').clear();
    }

    @Test
    public void testUnknownPostfixTokenIsRejected() {
        for (String postfix : new String[] {"ab.", "a(", "a b" + C}) {
            try {
                construction.build(postfix);
                fail("Expected invalid token for " + postfix);
            } catch (NFAConstructionException e) {
                assertEquals(postfix, ConstructionErrorType.INVALID_TOKEN, e.getErrorType());
            }
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testStartStateNeedsDesignation() {
        NFA nfa = new NFA();
        nfa.createState();
        nfa.getStartState();
    }
}
