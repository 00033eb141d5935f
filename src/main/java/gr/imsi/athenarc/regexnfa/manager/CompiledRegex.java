package gr.imsi.athenarc.regexnfa.manager;

import gr.imsi.athenarc.regexnfa.nfa.NFA;

/**
 * A successfully built automaton together with the forms it was derived from.
 */
public class CompiledRegex {
    private final String expression;
    private final String expanded;
    private final String postfix;
    private final NFA nfa;

    public CompiledRegex(String expression, String expanded, String postfix, NFA nfa) {
        this.expression = expression;
        this.expanded = expanded;
        this.postfix = postfix;
        this.nfa = nfa;
    }

    /**
     * @return the source expression; null for an automaton loaded from a file that did not record it
     */
    public String getExpression() {
        return expression;
    }

    /**
     * @return the concatenation-expanded form; null for an automaton loaded from a file
     */
    public String getExpanded() {
        return expanded;
    }

    public String getPostfix() {
        return postfix;
    }

    public NFA getNfa() {
        return nfa;
    }

    @Override
    public String toString() {
        return "CompiledRegex{expression='" + expression + "', postfix='" + postfix + "', " + nfa + "}";
    }
}
