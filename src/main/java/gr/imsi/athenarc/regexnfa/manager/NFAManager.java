package gr.imsi.athenarc.regexnfa.manager;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

import gr.imsi.athenarc.regexnfa.config.NFAConfiguration;
import gr.imsi.athenarc.regexnfa.describe.NFADescriber;
import gr.imsi.athenarc.regexnfa.describe.NFADescription;
import gr.imsi.athenarc.regexnfa.nfa.NFA;
import gr.imsi.athenarc.regexnfa.nfa.NFAConstructionException;
import gr.imsi.athenarc.regexnfa.nfa.NFASimulator;
import gr.imsi.athenarc.regexnfa.nfa.ThompsonConstruction;
import gr.imsi.athenarc.regexnfa.regex.ConcatenationExpander;
import gr.imsi.athenarc.regexnfa.regex.InvalidRegexException;
import gr.imsi.athenarc.regexnfa.regex.PostfixCompiler;
import gr.imsi.athenarc.regexnfa.regex.RegexValidator;
import gr.imsi.athenarc.regexnfa.regex.ValidationResult;

/**
 * Entry point for front-ends: runs the validate, expand, compile and build
 * pipeline and evaluates strings against the result. Holds no automaton itself;
 * callers keep the {@link CompiledRegex} they get back.
 */
public class NFAManager {
    private static final Logger LOG = LoggerFactory.getLogger(NFAManager.class);

    private final RegexValidator validator;
    private final ConcatenationExpander expander;
    private final PostfixCompiler compiler;
    private final ThompsonConstruction construction;
    private final NFASimulator simulator;
    private final NFADescriber describer;
    private final boolean parallelSuite;

    // Private constructor used by builder
    private NFAManager(Builder builder) {
        this.validator = builder.validator;
        this.expander = builder.expander;
        this.compiler = builder.compiler;
        this.construction = builder.construction;
        this.simulator = builder.simulator;
        this.describer = builder.describer;
        this.parallelSuite = builder.parallelSuite;
    }

    public ValidationResult validate(String regex) {
        return validator.validate(regex);
    }

    /**
     * Validates the expression, then expands, compiles and builds it.
     *
     * @param regex the expression typed by the user
     * @return the automaton with its postfix form
     * @throws InvalidRegexException if validation fails; nothing is built in that case
     * @throws NFAConstructionException if the expression is valid but operators lack operands
     */
    public CompiledRegex buildAutomaton(String regex) throws InvalidRegexException, NFAConstructionException {
        ValidationResult validation = validator.validate(regex);
        if (!validation.isValid()) {
            LOG.info("Regex '{}' failed validation: {}", regex, validation.getMessage());
            throw new InvalidRegexException(validation);
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        String expanded = expander.expand(regex);
        String postfix = compiler.toPostfix(expanded);
        NFA nfa = construction.build(postfix);
        LOG.info("Built NFA for '{}' (postfix '{}') with {} states in {} us",
            regex, postfix, nfa.size(), stopwatch.elapsed(TimeUnit.MICROSECONDS));
        return new CompiledRegex(regex, expanded, postfix, nfa);
    }

    public boolean simulate(CompiledRegex compiled, String input) {
        Preconditions.checkNotNull(compiled, "No NFA available. Process a regex first.");
        return simulate(compiled.getNfa(), input);
    }

    public boolean simulate(NFA nfa, String input) {
        return simulator.accepts(nfa, input);
    }

    public NFADescription describe(CompiledRegex compiled) {
        Preconditions.checkNotNull(compiled, "No NFA available. Process a regex first.");
        return describe(compiled.getNfa());
    }

    public NFADescription describe(NFA nfa) {
        return describer.describe(nfa);
    }

    /**
     * Runs every non-blank line against the automaton. Lines are trimmed first.
     */
    public TestSuiteResult runTestSuite(CompiledRegex compiled, List<String> lines) {
        Preconditions.checkNotNull(compiled, "No NFA available. Process a regex first.");
        return runTestSuite(compiled.getExpression(), compiled.getNfa(), lines);
    }

    public TestSuiteResult runTestSuite(String expression, NFA nfa, List<String> lines) {
        Preconditions.checkNotNull(lines, "Test strings must not be null");
        Stopwatch stopwatch = Stopwatch.createStarted();

        Stream<String> inputs = parallelSuite ? lines.parallelStream() : lines.stream();
        List<TestCaseResult> results = inputs
            .filter(line -> line != null && !line.trim().isEmpty())
            .map(String::trim)
            .map(input -> new TestCaseResult(input, simulator.accepts(nfa, input)))
            .collect(Collectors.toList());

        TestSuiteResult suite = new TestSuiteResult(expression, results, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOG.info("Test suite for '{}': {} accepted, {} rejected", expression,
            suite.getAcceptedCount(), suite.getRejectedCount());
        return suite;
    }

    /**
     * Creates a new builder for NFAManager
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new NFAManager with default settings
     * @return A new NFAManager instance
     */
    public static NFAManager createDefault() {
        return builder().build();
    }

    public static NFAManager fromConfiguration(NFAConfiguration configuration) {
        return builder()
            .withDescriber(new NFADescriber(configuration.getEpsilonLabel()))
            .withParallelSuite(configuration.isParallelSuite())
            .build();
    }

    /**
     * Builder class for NFAManager that allows replacing individual stages
     */
    public static class Builder {
        private RegexValidator validator = new RegexValidator();
        private ConcatenationExpander expander = new ConcatenationExpander();
        private PostfixCompiler compiler = new PostfixCompiler();
        private ThompsonConstruction construction = new ThompsonConstruction();
        private NFASimulator simulator = new NFASimulator();
        private NFADescriber describer = new NFADescriber();
        private boolean parallelSuite = false;

        public Builder withValidator(RegexValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder withExpander(ConcatenationExpander expander) {
            this.expander = expander;
            return this;
        }

        public Builder withCompiler(PostfixCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        public Builder withConstruction(ThompsonConstruction construction) {
            this.construction = construction;
            return this;
        }

        public Builder withSimulator(NFASimulator simulator) {
            this.simulator = simulator;
            return this;
        }

        public Builder withDescriber(NFADescriber describer) {
            this.describer = describer;
            return this;
        }

        /**
         * Evaluates test suites with a parallel stream. Safe because simulation only reads the NFA.
         *
         * @param parallelSuite True to evaluate suites in parallel
         * @return The builder instance
         */
        public Builder withParallelSuite(boolean parallelSuite) {
            this.parallelSuite = parallelSuite;
            return this;
        }

        public NFAManager build() {
            return new NFAManager(this);
        }
    }
}
