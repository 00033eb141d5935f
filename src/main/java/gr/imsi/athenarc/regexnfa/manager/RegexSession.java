package gr.imsi.athenarc.regexnfa.manager;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.regexnfa.describe.NFADescription;
import gr.imsi.athenarc.regexnfa.nfa.NFA;
import gr.imsi.athenarc.regexnfa.nfa.NFAConstructionException;
import gr.imsi.athenarc.regexnfa.persistence.NFAStore;
import gr.imsi.athenarc.regexnfa.persistence.SavedNFA;
import gr.imsi.athenarc.regexnfa.regex.InvalidRegexException;

/**
 * The automaton a front-end is currently working with. Simulation, test suites
 * and saving are refused until a regex has been built; a failed build keeps the
 * previous automaton.
 */
public class RegexSession {
    private static final Logger LOG = LoggerFactory.getLogger(RegexSession.class);

    static final String NO_NFA_MESSAGE = "No NFA available. Process a regex first.";

    private final NFAManager manager;
    private final NFAStore store;
    private CompiledRegex current;

    public RegexSession(NFAManager manager, NFAStore store) {
        this.manager = manager;
        this.store = store;
    }

    public CompiledRegex convert(String regex) throws InvalidRegexException, NFAConstructionException {
        CompiledRegex compiled = manager.buildAutomaton(regex);
        this.current = compiled;
        return compiled;
    }

    public boolean hasAutomaton() {
        return current != null;
    }

    public CompiledRegex getCurrent() {
        return current;
    }

    public NFADescription describe() {
        return manager.describe(requireAutomaton());
    }

    public boolean simulate(String input) {
        return manager.simulate(requireAutomaton(), input);
    }

    public TestSuiteResult runTestSuite(List<String> lines) {
        return manager.runTestSuite(requireAutomaton(), lines);
    }

    public SavedNFA save(Path file) throws IOException {
        CompiledRegex compiled = requireAutomaton();
        SavedNFA saved = SavedNFA.from(compiled.getExpression(), compiled.getPostfix(), compiled.getNfa(),
            manager.describe(compiled));
        store.save(saved, file);
        return saved;
    }

    /**
     * Loads a saved automaton for display. If the file carries the state graph the
     * loaded automaton also becomes the current one.
     *
     * @throws IOException if the file is missing, unreadable, or carries an inconsistent graph
     */
    public SavedNFA load(Path file) throws IOException {
        SavedNFA saved = store.load(file);
        if (saved.isSimulatable()) {
            NFA nfa;
            try {
                nfa = saved.toNFA();
            } catch (IllegalStateException e) {
                throw new IOException("Saved NFA at " + file + " has an inconsistent state graph", e);
            }
            current = new CompiledRegex(saved.getRegex(), null, saved.getPostfix(), nfa);
        } else {
            LOG.warn("{} has no state graph; keeping the current automaton", file);
        }
        return saved;
    }

    private CompiledRegex requireAutomaton() {
        if (current == null) {
            throw new IllegalStateException(NO_NFA_MESSAGE);
        }
        return current;
    }
}
