package gr.imsi.athenarc.regexnfa.regex;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Syntactic checks run before any construction work. Operator arity is not
 * checked here: an expression such as {@code a|} is accepted and fails later
 * in the builder.
 */
public class RegexValidator {
    private static final Logger LOG = LoggerFactory.getLogger(RegexValidator.class);

    /**
     * Checks, in order: parenthesis balance, the character alphabet, non-emptiness.
     *
     * @param regex the candidate expression, may be null (treated as empty)
     * @return the first failure found, or {@link ValidationResult#valid()}
     */
    public ValidationResult validate(String regex) {
        String expression = regex == null ? "" : regex;

        Deque<Character> stack = new ArrayDeque<>();
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == RegexOperators.OPEN_GROUP) {
                stack.push(c);
            } else if (c == RegexOperators.CLOSE_GROUP) {
                if (stack.isEmpty()) {
                    return reject(ValidationErrorType.UNBALANCED_PARENS,
                        "Unbalanced parentheses: too many closing parentheses", expression);
                }
                stack.pop();
            }
        }
        if (!stack.isEmpty()) {
            return reject(ValidationErrorType.UNBALANCED_PARENS,
                "Unbalanced parentheses: unclosed parentheses", expression);
        }

        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (!isAllowed(c)) {
                return reject(ValidationErrorType.INVALID_CHARACTER,
                    "Invalid character '" + c + "' at position " + i, expression);
            }
        }

        if (expression.isEmpty()) {
            return reject(ValidationErrorType.EMPTY_INPUT, "Regex cannot be empty", expression);
        }
        return ValidationResult.valid();
    }

    private static boolean isAllowed(char c) {
        return RegexOperators.isLiteral(c)
            || RegexOperators.isUnary(c)
            || c == RegexOperators.UNION
            || c == RegexOperators.OPEN_GROUP
            || c == RegexOperators.CLOSE_GROUP
            || c == RegexOperators.EXPLICIT_CONCAT;
    }

    private static ValidationResult reject(ValidationErrorType type, String message, String expression) {
        LOG.debug("Rejected regex '{}': {}", expression, message);
        return ValidationResult.invalid(type, message);
    }
}
