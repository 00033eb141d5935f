package gr.imsi.athenarc.regexnfa.nfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A Thompson automaton: an arena of states plus one designated start and one
 * designated accept state. Built once, then frozen and shared read-only.
 */
public class NFA {
    private final List<NFAState> states = new ArrayList<>();
    private int startIndex = -1;
    private int acceptIndex = -1;
    private boolean frozen;

    public NFAState createState() {
        checkMutable();
        NFAState s = new NFAState(states.size());
        states.add(s);
        return s;
    }

    public void addTransition(int from, char symbol, int to) {
        checkMutable();
        checkIndex(to);
        getState(from).addTransition(symbol, to);
    }

    public void addEpsilon(int from, int to) {
        checkMutable();
        checkIndex(to);
        getState(from).addEpsilon(to);
    }

    /**
     * Marks the start and accept states and freezes the graph.
     */
    public void designate(int start, int accept) {
        checkMutable();
        checkIndex(start);
        checkIndex(accept);
        this.startIndex = start;
        this.acceptIndex = accept;
        this.frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public NFAState getState(int index) {
        checkIndex(index);
        return states.get(index);
    }

    public List<NFAState> getStates() {
        return Collections.unmodifiableList(states);
    }

    public int size() {
        return states.size();
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getAcceptIndex() {
        return acceptIndex;
    }

    public NFAState getStartState() {
        Preconditions.checkState(frozen, "Start state is not designated until construction finishes");
        return getState(startIndex);
    }

    public NFAState getAcceptState() {
        Preconditions.checkState(frozen, "Accept state is not designated until construction finishes");
        return getState(acceptIndex);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("NFA is frozen after construction");
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= states.size()) {
            throw new IndexOutOfBoundsException("No state " + index + " in NFA of " + states.size() + " states");
        }
    }

    @Override
    public String toString() {
        return "NFA{states=" + states.size() + ", start=" + startIndex + ", accept=" + acceptIndex + "}";
    }
}
