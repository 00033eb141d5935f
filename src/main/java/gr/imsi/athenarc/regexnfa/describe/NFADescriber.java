package gr.imsi.athenarc.regexnfa.describe;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.regexnfa.nfa.NFA;
import gr.imsi.athenarc.regexnfa.nfa.NFAState;

/**
 * Assigns display ids {@code S0, S1, ...} in depth-first pre-order from the start
 * state and lists every edge. The same NFA always yields the same description.
 */
public class NFADescriber {
    public static final String DEFAULT_EPSILON_LABEL = "ε";

    private final String epsilonLabel;

    public NFADescriber() {
        this(DEFAULT_EPSILON_LABEL);
    }

    public NFADescriber(String epsilonLabel) {
        this.epsilonLabel = Preconditions.checkNotNull(epsilonLabel);
    }

    @NotNull
    public NFADescription describe(NFA nfa) {
        Preconditions.checkArgument(nfa.isFrozen(), "NFA must be fully built before it is described");

        List<Integer> order = preOrder(nfa);
        Map<Integer, String> ids = new HashMap<>();
        for (int k = 0; k < order.size(); k++) {
            ids.put(order.get(k), "S" + k);
        }

        List<String> lines = new ArrayList<>();
        for (int index : order) {
            NFAState state = nfa.getState(index);
            String src = ids.get(index);
            for (Map.Entry<Character, Set<Integer>> entry : state.getTransitions().entrySet()) {
                for (int target : entry.getValue()) {
                    lines.add(line(src, String.valueOf(entry.getKey()), ids.get(target)));
                }
            }
            for (int target : state.getEpsilonTargets()) {
                lines.add(line(src, epsilonLabel, ids.get(target)));
            }
        }
        return new NFADescription(lines, ids.get(nfa.getStartIndex()), ids.get(nfa.getAcceptIndex()), order);
    }

    private static String line(String src, String label, String dst) {
        return src + " -- " + label + " --> " + dst;
    }

    // symbol edges first (by symbol), then epsilon edges, matching a recursive walk
    private static List<Integer> preOrder(NFA nfa) {
        List<Integer> order = new ArrayList<>(nfa.size());
        boolean[] visited = new boolean[nfa.size()];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(nfa.getStartIndex());

        while (!stack.isEmpty()) {
            int index = stack.pop();
            if (visited[index]) {
                continue;
            }
            visited[index] = true;
            order.add(index);

            NFAState state = nfa.getState(index);
            List<Integer> children = new ArrayList<>();
            for (Set<Integer> targets : state.getTransitions().values()) {
                children.addAll(targets);
            }
            children.addAll(state.getEpsilonTargets());
            for (int i = children.size() - 1; i >= 0; i--) {
                if (!visited[children.get(i)]) {
                    stack.push(children.get(i));
                }
            }
        }
        return order;
    }
}
