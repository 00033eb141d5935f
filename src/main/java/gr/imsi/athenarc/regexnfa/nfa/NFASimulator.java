package gr.imsi.athenarc.regexnfa.nfa;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Decides acceptance by tracking the set of states the automaton could be in.
 * Only reads the graph, so one frozen NFA can serve any number of callers.
 */
public class NFASimulator {
    private static final Logger LOG = LoggerFactory.getLogger(NFASimulator.class);

    public boolean accepts(NFA nfa, String input) {
        Preconditions.checkNotNull(nfa, "No NFA to simulate");
        Preconditions.checkNotNull(input, "Input string must not be null");
        Preconditions.checkArgument(nfa.isFrozen(), "NFA must be fully built before simulation");

        Set<Integer> current = epsilonClosure(nfa, Collections.singleton(nfa.getStartIndex()));
        for (int i = 0; i < input.length(); i++) {
            char symbol = input.charAt(i);
            Set<Integer> reachable = new HashSet<>();
            for (int index : current) {
                reachable.addAll(nfa.getState(index).getTargets(symbol));
            }
            current = epsilonClosure(nfa, reachable);
            if (current.isEmpty()) {
                LOG.trace("No live states after '{}' at position {} of '{}'", symbol, i, input);
            }
        }

        boolean accepted = current.contains(nfa.getAcceptIndex());
        LOG.debug("Input '{}' {}", input, accepted ? "accepted" : "rejected");
        return accepted;
    }

    /**
     * All states reachable from {@code seeds} through epsilon edges alone, seeds included.
     * Terminates on cyclic epsilon graphs since each state is expanded once.
     */
    public Set<Integer> epsilonClosure(NFA nfa, Set<Integer> seeds) {
        Set<Integer> closure = new HashSet<>(seeds);
        Deque<Integer> pending = new ArrayDeque<>(seeds);
        while (!pending.isEmpty()) {
            int index = pending.pop();
            for (int next : nfa.getState(index).getEpsilonTargets()) {
                if (closure.add(next)) {
                    pending.push(next);
                }
            }
        }
        return closure;
    }
}
