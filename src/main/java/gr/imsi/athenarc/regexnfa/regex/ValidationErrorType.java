package gr.imsi.athenarc.regexnfa.regex;

/**
 * Reasons a regular expression is rejected before construction.
 */
public enum ValidationErrorType {
    UNBALANCED_PARENS,
    INVALID_CHARACTER,
    EMPTY_INPUT
}
