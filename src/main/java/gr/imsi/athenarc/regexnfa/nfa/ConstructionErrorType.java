package gr.imsi.athenarc.regexnfa.nfa;

public enum ConstructionErrorType {
    /** An operator found fewer fragments on the work stack than it needs. */
    STACK_UNDERFLOW,
    /** More than one fragment was left once all postfix tokens were consumed. */
    LEFTOVER_FRAGMENTS,
    /** A postfix token is neither an operator nor a symbol of the input alphabet. */
    INVALID_TOKEN
}
