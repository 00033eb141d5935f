package gr.imsi.athenarc.regexnfa.regex;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shunting-yard conversion of a concatenation-expanded expression to postfix.
 * Operators of equal precedence are emitted left to right. Arity is not
 * checked: a malformed expression produces postfix the builder will reject.
 */
public class PostfixCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(PostfixCompiler.class);

    public String toPostfix(String expanded) {
        StringBuilder output = new StringBuilder(expanded.length());
        Deque<Character> operators = new ArrayDeque<>();

        for (int i = 0; i < expanded.length(); i++) {
            char c = expanded.charAt(i);

            if (c == RegexOperators.OPEN_GROUP) {
                operators.push(c);
            } else if (c == RegexOperators.CLOSE_GROUP) {
                while (!operators.isEmpty() && operators.peek() != RegexOperators.OPEN_GROUP) {
                    output.append(operators.pop());
                }
                // discard the matching '('
                if (!operators.isEmpty()) {
                    operators.pop();
                }
            } else if (RegexOperators.isOperator(c)) {
                int current = RegexOperators.precedence(c);
                while (!operators.isEmpty()
                        && operators.peek() != RegexOperators.OPEN_GROUP
                        && RegexOperators.precedence(operators.peek()) >= current) {
                    output.append(operators.pop());
                }
                operators.push(c);
            } else {
                output.append(c);
            }
        }

        while (!operators.isEmpty()) {
            char op = operators.pop();
            if (op != RegexOperators.OPEN_GROUP) {
                output.append(op);
            }
        }

        String postfix = output.toString();
        LOG.debug("Compiled '{}' to postfix '{}'", expanded, postfix);
        return postfix;
    }
}
