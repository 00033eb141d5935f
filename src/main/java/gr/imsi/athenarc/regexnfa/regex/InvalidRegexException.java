package gr.imsi.athenarc.regexnfa.regex;

/**
 * Thrown when an expression fails validation and no construction is attempted.
 */
public class InvalidRegexException extends Exception {

    private final ValidationResult result;

    public InvalidRegexException(ValidationResult result) {
        super(result.getMessage());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    public ValidationErrorType getErrorType() {
        return result.getErrorType();
    }
}
