package gr.imsi.athenarc.regexnfa.nfa;

/**
 * Thrown by {@link ThompsonConstruction} when the postfix form does not describe
 * a single well-formed automaton, typically an operator missing an operand.
 */
public class NFAConstructionException extends Exception {

    private final ConstructionErrorType errorType;

    public NFAConstructionException(ConstructionErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ConstructionErrorType getErrorType() {
        return errorType;
    }
}
