package gr.imsi.athenarc.regexnfa.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One state of a saved graph. Targets are positions in {@link SavedNFA#getStates()},
 * which follow display id order.
 */
public class SavedState {
    private Map<String, List<Integer>> symbols = new TreeMap<>();
    private List<Integer> epsilon = new ArrayList<>();

    public Map<String, List<Integer>> getSymbols() {
        return symbols;
    }

    public void setSymbols(Map<String, List<Integer>> symbols) {
        this.symbols = symbols;
    }

    public List<Integer> getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(List<Integer> epsilon) {
        this.epsilon = epsilon;
    }
}
