package gr.imsi.athenarc.regexnfa.nfa;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.collect.Maps;

/**
 * A node of the automaton graph. Edges point to other states by their index in
 * the owning {@link NFA}, so cycles never hold object references to each other.
 */
public class NFAState {
    private final int index;
    private final Map<Character, Set<Integer>> transitions = new TreeMap<>();
    private final Set<Integer> epsilonTargets = new LinkedHashSet<>();

    NFAState(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Symbol-labelled edges, ordered by symbol. Targets keep insertion order.
     * Both the map and its target sets are read-only views.
     */
    public Map<Character, Set<Integer>> getTransitions() {
        return Collections.unmodifiableMap(Maps.transformValues(transitions, Collections::unmodifiableSet));
    }

    public Set<Integer> getTargets(char symbol) {
        Set<Integer> targets = transitions.get(symbol);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    public Set<Integer> getEpsilonTargets() {
        return Collections.unmodifiableSet(epsilonTargets);
    }

    void addTransition(char symbol, int target) {
        transitions.computeIfAbsent(symbol, s -> new LinkedHashSet<>()).add(target);
    }

    void addEpsilon(int target) {
        epsilonTargets.add(target);
    }

    @Override
    public String toString() {
        return "NFAState@" + index + " (transitions=" + transitions + ", epsilon=" + epsilonTargets + ")";
    }
}
