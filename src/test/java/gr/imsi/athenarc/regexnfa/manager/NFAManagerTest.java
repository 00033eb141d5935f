package gr.imsi.athenarc.regexnfa.manager;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.Test;

import gr.imsi.athenarc.regexnfa.config.NFAConfiguration;
import gr.imsi.athenarc.regexnfa.nfa.ConstructionErrorType;
import gr.imsi.athenarc.regexnfa.nfa.NFAConstructionException;
import gr.imsi.athenarc.regexnfa.regex.InvalidRegexException;
import gr.imsi.athenarc.regexnfa.regex.RegexOperators;
import gr.imsi.athenarc.regexnfa.regex.ValidationErrorType;

public class NFAManagerTest {

    private final NFAManager manager = NFAManager.createDefault();

    @Test
    public void testBuildReturnsPostfixAndAutomaton() throws Exception {
        CompiledRegex compiled = manager.buildAutomaton("ab*");
        assertEquals("ab*", compiled.getExpression());
        assertEquals("a" + RegexOperators.CONCAT + "b*", compiled.getExpanded());
        assertEquals("ab*" + RegexOperators.CONCAT, compiled.getPostfix());
        assertTrue(manager.simulate(compiled, "abbb"));
        assertFalse(manager.simulate(compiled, "b"));
    }

    @Test
    public void testValidationFailureStopsBeforeConstruction() throws NFAConstructionException {
        try {
            manager.buildAutomaton("a#b");
            fail("Expected validation failure");
        } catch (InvalidRegexException e) {
            assertEquals(ValidationErrorType.INVALID_CHARACTER, e.getErrorType());
            assertFalse(e.getResult().isValid());
        }
    }

    @Test
    public void testConstructionFailureIsDistinct() throws InvalidRegexException {
        try {
            manager.buildAutomaton("a|");
            fail("Expected construction failure");
        } catch (NFAConstructionException e) {
            assertEquals(ConstructionErrorType.STACK_UNDERFLOW, e.getErrorType());
        }
    }

    @Test
    public void testValidate() {
        assertTrue(manager.validate("(a|b)c").isValid());
        assertEquals(ValidationErrorType.EMPTY_INPUT, manager.validate("").getErrorType());
    }

    @Test
    public void testDescribe() throws Exception {
        CompiledRegex compiled = manager.buildAutomaton("a|b");
        assertEquals("S0", manager.describe(compiled).getStartId());
        assertEquals(compiled.getNfa().size(), manager.describe(compiled).getDisplayOrder().size());
    }

    /**
     * Lines are trimmed, blank lines skipped and input order kept.
     */
    @Test
    public void testRunTestSuite() throws Exception {
        CompiledRegex compiled = manager.buildAutomaton("a|b");
        TestSuiteResult suite = manager.runTestSuite(compiled, Arrays.asList(" a ", "", "ab", "   ", "b"));

        assertEquals(3, suite.size());
        assertEquals("a", suite.getResults().get(0).getInput());
        assertEquals("Accepted", suite.getResults().get(0).getVerdict());
        assertEquals("ab", suite.getResults().get(1).getInput());
        assertEquals("Rejected", suite.getResults().get(1).getVerdict());
        assertEquals("b", suite.getResults().get(2).getInput());
        assertEquals(2, suite.getAcceptedCount());
        assertEquals(1, suite.getRejectedCount());
        assertEquals("a|b", suite.getExpression());
    }

    @Test
    public void testParallelSuiteKeepsOrder() throws Exception {
        NFAManager parallel = NFAManager.fromConfiguration(
            new NFAConfiguration.Builder().parallelSuite(true).build());
        CompiledRegex compiled = parallel.buildAutomaton("(ab)+");
        List<String> inputs = IntStream.range(0, 500)
            .mapToObj(i -> i % 2 == 0 ? "ab".repeat(i % 7 + 1) : "ab".repeat(i % 5) + "a")
            .collect(Collectors.toList());

        TestSuiteResult suite = parallel.runTestSuite(compiled, inputs);
        assertEquals(inputs.size(), suite.size());
        for (int i = 0; i < inputs.size(); i++) {
            assertEquals(inputs.get(i), suite.getResults().get(i).getInput());
            assertEquals(inputs.get(i), i % 2 == 0, suite.getResults().get(i).isAccepted());
        }
    }

    @Test(expected = NullPointerException.class)
    public void testSimulateWithoutAutomaton() {
        manager.simulate((CompiledRegex) null, "a");
    }
}
