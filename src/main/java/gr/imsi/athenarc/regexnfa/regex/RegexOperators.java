package gr.imsi.athenarc.regexnfa.regex;

/**
 * Symbols and precedence levels shared by the parsing stages.
 */
public final class RegexOperators {

    public static final char STAR = '*';
    public static final char PLUS = '+';
    public static final char OPTIONAL = '?';
    public static final char UNION = '|';
    public static final char OPEN_GROUP = '(';
    public static final char CLOSE_GROUP = ')';

    /**
     * Concatenation as the user may write it. Rewritten to {@link #CONCAT}
     * by the expander.
     */
    public static final char EXPLICIT_CONCAT = '.';

    /**
     * Reserved concatenation marker, outside the input alphabet.
     */
    public static final char CONCAT = '·';

    private RegexOperators() {
    }

    public static boolean isLiteral(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9');
    }

    public static boolean isUnary(char c) {
        return c == STAR || c == PLUS || c == OPTIONAL;
    }

    public static boolean isOperator(char c) {
        return isUnary(c) || c == UNION || c == CONCAT;
    }

    /**
     * Higher binds tighter. Parentheses and non-operators have no precedence.
     */
    public static int precedence(char c) {
        if (isUnary(c)) {
            return 3;
        }
        if (c == CONCAT) {
            return 2;
        }
        if (c == UNION) {
            return 1;
        }
        return 0;
    }
}
