package gr.imsi.athenarc.regexnfa.nfa;

// A sub-automaton with exactly one entry and one accepting exit.
class NFAFragment {
    final int start;
    final int accept;

    NFAFragment(int start, int accept) {
        this.start = start;
        this.accept = accept;
    }

    @Override
    public String toString() {
        return "NFAFragment{" + start + " -> " + accept + "}";
    }
}
