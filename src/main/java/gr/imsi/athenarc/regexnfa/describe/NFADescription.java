package gr.imsi.athenarc.regexnfa.describe;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Display form of an NFA: transition lines {@code "SRC -- LABEL --> DST"} and the
 * display ids of the start and accept states.
 */
public class NFADescription {
    private final ImmutableList<String> transitions;
    private final String startId;
    private final String acceptId;
    private final ImmutableList<Integer> displayOrder;

    public NFADescription(List<String> transitions, String startId, String acceptId, List<Integer> displayOrder) {
        this.transitions = ImmutableList.copyOf(transitions);
        this.startId = startId;
        this.acceptId = acceptId;
        this.displayOrder = ImmutableList.copyOf(displayOrder);
    }

    public ImmutableList<String> getTransitions() {
        return transitions;
    }

    public String getStartId() {
        return startId;
    }

    public String getAcceptId() {
        return acceptId;
    }

    /**
     * Arena indices of the states in display id order: element {@code k} is the state shown as {@code Sk}.
     */
    public ImmutableList<Integer> getDisplayOrder() {
        return displayOrder;
    }

    /**
     * Text shown to the user and stored by the save action.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (String line : transitions) {
            sb.append(line).append('\n');
        }
        sb.append('\n').append("Start: ").append(startId).append('\n');
        sb.append("Accept: ").append(acceptId);
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
