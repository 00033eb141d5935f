package gr.imsi.athenarc.regexnfa.regex;

/**
 * Outcome of {@link RegexValidator#validate(String)}: either valid, or an error
 * type with a message that can be shown to the user as is.
 */
public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(null, "");

    private final ValidationErrorType errorType;
    private final String message;

    private ValidationResult(ValidationErrorType errorType, String message) {
        this.errorType = errorType;
        this.message = message;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(ValidationErrorType errorType, String message) {
        return new ValidationResult(errorType, message);
    }

    public boolean isValid() {
        return errorType == null;
    }

    /**
     * @return the error type, or null when the expression is valid
     */
    public ValidationErrorType getErrorType() {
        return errorType;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{" + errorType + ": " + message + "}";
    }
}
