package gr.imsi.athenarc.regexnfa.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import gr.imsi.athenarc.regexnfa.describe.NFADescription;
import gr.imsi.athenarc.regexnfa.nfa.NFA;
import gr.imsi.athenarc.regexnfa.nfa.NFAState;

/**
 * What the save action writes: postfix form, rendered transitions, start and accept
 * display ids, and the state graph so a loaded automaton can be simulated again.
 * Files written without {@code states} can still be redisplayed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SavedNFA {
    private String regex;
    private String postfix;
    private String transitions;
    private String start;
    private String accept;
    private List<SavedState> states;

    public static SavedNFA from(String regex, String postfix, NFA nfa, NFADescription description) {
        SavedNFA saved = new SavedNFA();
        saved.regex = regex;
        saved.postfix = postfix;
        saved.transitions = description.render();
        saved.start = description.getStartId();
        saved.accept = description.getAcceptId();

        List<Integer> order = description.getDisplayOrder();
        Map<Integer, Integer> position = new HashMap<>();
        for (int k = 0; k < order.size(); k++) {
            position.put(order.get(k), k);
        }

        List<SavedState> savedStates = new ArrayList<>(order.size());
        for (int index : order) {
            NFAState state = nfa.getState(index);
            SavedState savedState = new SavedState();
            for (Map.Entry<Character, Set<Integer>> entry : state.getTransitions().entrySet()) {
                List<Integer> targets = new ArrayList<>();
                for (int target : entry.getValue()) {
                    targets.add(position.get(target));
                }
                savedState.getSymbols().put(String.valueOf(entry.getKey()), targets);
            }
            for (int target : state.getEpsilonTargets()) {
                savedState.getEpsilon().add(position.get(target));
            }
            savedStates.add(savedState);
        }
        saved.states = savedStates;
        return saved;
    }

    @JsonIgnore
    public boolean isSimulatable() {
        return states != null && !states.isEmpty();
    }

    /**
     * Rebuilds the live graph. State {@code k} of the result is the one displayed as {@code Sk}.
     *
     * @throws IllegalStateException if the record carries no graph or the graph is inconsistent
     */
    public NFA toNFA() {
        if (!isSimulatable()) {
            throw new IllegalStateException("Saved NFA has no state graph; it can be displayed but not simulated");
        }
        NFA nfa = new NFA();
        for (int k = 0; k < states.size(); k++) {
            nfa.createState();
        }
        try {
            for (int k = 0; k < states.size(); k++) {
                SavedState savedState = states.get(k);
                if (savedState == null || savedState.getSymbols() == null || savedState.getEpsilon() == null) {
                    throw new IllegalStateException("Saved state " + k + " is missing its edges");
                }
                for (Map.Entry<String, List<Integer>> entry : savedState.getSymbols().entrySet()) {
                    if (entry.getKey().length() != 1) {
                        throw new IllegalStateException("Transition label '" + entry.getKey() + "' is not a single symbol");
                    }
                    for (Integer target : targets(k, entry.getValue())) {
                        nfa.addTransition(k, entry.getKey().charAt(0), target);
                    }
                }
                for (Integer target : targets(k, savedState.getEpsilon())) {
                    nfa.addEpsilon(k, target);
                }
            }
            nfa.designate(displayPosition(start), displayPosition(accept));
        } catch (IndexOutOfBoundsException e) {
            throw new IllegalStateException("Saved NFA refers to a missing state", e);
        }
        return nfa;
    }

    private static List<Integer> targets(int state, List<Integer> targets) {
        if (targets == null || targets.contains(null)) {
            throw new IllegalStateException("Saved state " + state + " has a missing edge target");
        }
        return targets;
    }

    private static int displayPosition(String id) {
        if (id == null || id.length() < 2 || id.charAt(0) != 'S') {
            throw new IllegalStateException("Malformed state id: " + id);
        }
        try {
            return Integer.parseInt(id.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Malformed state id: " + id, e);
        }
    }

    public String getRegex() {
        return regex;
    }

    public void setRegex(String regex) {
        this.regex = regex;
    }

    public String getPostfix() {
        return postfix;
    }

    public void setPostfix(String postfix) {
        this.postfix = postfix;
    }

    public String getTransitions() {
        return transitions;
    }

    public void setTransitions(String transitions) {
        this.transitions = transitions;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getAccept() {
        return accept;
    }

    public void setAccept(String accept) {
        this.accept = accept;
    }

    public List<SavedState> getStates() {
        return states;
    }

    public void setStates(List<SavedState> states) {
        this.states = states;
    }
}
