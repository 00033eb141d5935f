package gr.imsi.athenarc.regexnfa.regex;

/**
 * Makes every implicit concatenation explicit, e.g. {@code a*b} becomes {@code a*·b}.
 * A {@code .} written by the user is rewritten to the reserved marker and gets
 * no extra marker around it.
 */
public class ConcatenationExpander {

    public String expand(String regex) {
        StringBuilder builder = new StringBuilder(regex.length() * 2);

        for (int i = 0; i < regex.length(); i++) {
            char c = regex.charAt(i);
            builder.append(c == RegexOperators.EXPLICIT_CONCAT ? RegexOperators.CONCAT : c);

            if (i + 1 < regex.length() && endsOperand(c) && startsOperand(regex.charAt(i + 1))) {
                builder.append(RegexOperators.CONCAT);
            }
        }
        return builder.toString();
    }

    private static boolean endsOperand(char c) {
        return RegexOperators.isLiteral(c) || c == RegexOperators.CLOSE_GROUP || RegexOperators.isUnary(c);
    }

    private static boolean startsOperand(char c) {
        return RegexOperators.isLiteral(c) || c == RegexOperators.OPEN_GROUP;
    }
}
