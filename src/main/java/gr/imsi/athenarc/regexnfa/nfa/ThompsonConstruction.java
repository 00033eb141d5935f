package gr.imsi.athenarc.regexnfa.nfa;

import java.util.ArrayDeque;
import java.util.Deque;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.regexnfa.regex.RegexOperators;

/**
 * Builds an NFA from a postfix expression, one fragment per token.
 * Every fragment on the work stack has exactly one start and one accept state.
 */
public class ThompsonConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(ThompsonConstruction.class);

    /**
     * @param postfix output of {@link gr.imsi.athenarc.regexnfa.regex.PostfixCompiler}
     * @return a frozen NFA whose start/accept are those of the single remaining fragment
     * @throws NFAConstructionException if an operator lacks operands, a token is not in the
     *         alphabet, or fragments are left over
     */
    public NFA build(String postfix) throws NFAConstructionException {
        NFA nfa = new NFA();
        Deque<NFAFragment> stack = new ArrayDeque<>();

        for (int i = 0; i < postfix.length(); i++) {
            char c = postfix.charAt(i);
            switch (c) {
                case RegexOperators.STAR:
                    stack.push(star(nfa, pop(stack, c, i)));
                    break;
                case RegexOperators.PLUS:
                    stack.push(plus(nfa, pop(stack, c, i)));
                    break;
                case RegexOperators.OPTIONAL:
                    stack.push(optional(nfa, pop(stack, c, i)));
                    break;
                case RegexOperators.UNION: {
                    NFAFragment right = pop(stack, c, i);
                    NFAFragment left = pop(stack, c, i);
                    stack.push(union(nfa, left, right));
                    break;
                }
                case RegexOperators.CONCAT: {
                    NFAFragment right = pop(stack, c, i);
                    NFAFragment left = pop(stack, c, i);
                    stack.push(concat(nfa, left, right));
                    break;
                }
                default:
                    if (!RegexOperators.isLiteral(c)) {
                        throw new NFAConstructionException(ConstructionErrorType.INVALID_TOKEN,
                            "Unexpected token '" + c + "' at postfix position " + i);
                    }
                    stack.push(literal(nfa, c));
                    break;
            }
            LOG.debug("Token '{}' at {}: {} fragment(s) on stack, top {}", c, i, stack.size(), stack.peek());
        }

        if (stack.isEmpty()) {
            throw new NFAConstructionException(ConstructionErrorType.STACK_UNDERFLOW,
                "Empty postfix expression '" + postfix + "' produced no automaton");
        }
        if (stack.size() > 1) {
            throw new NFAConstructionException(ConstructionErrorType.LEFTOVER_FRAGMENTS,
                stack.size() + " fragments left after postfix '" + postfix + "', expected 1");
        }

        NFAFragment whole = stack.pop();
        nfa.designate(whole.start, whole.accept);
        LOG.debug("Built {} from postfix '{}'", nfa, postfix);
        return nfa;
    }

    private static NFAFragment pop(Deque<NFAFragment> stack, char token, int position)
            throws NFAConstructionException {
        if (stack.isEmpty()) {
            throw new NFAConstructionException(ConstructionErrorType.STACK_UNDERFLOW,
                "Operator '" + token + "' at postfix position " + position + " is missing an operand");
        }
        return stack.pop();
    }

    private static NFAFragment literal(NFA nfa, char symbol) {
        int start = nfa.createState().getIndex();
        int accept = nfa.createState().getIndex();
        nfa.addTransition(start, symbol, accept);
        return new NFAFragment(start, accept);
    }

    // zero or more, looping back through the inner start
    private static NFAFragment star(NFA nfa, NFAFragment inner) {
        int start = nfa.createState().getIndex();
        int accept = nfa.createState().getIndex();
        nfa.addEpsilon(start, inner.start);
        nfa.addEpsilon(start, accept);
        nfa.addEpsilon(inner.accept, inner.start);
        nfa.addEpsilon(inner.accept, accept);
        return new NFAFragment(start, accept);
    }

    // one or more: no bypass from the new start
    private static NFAFragment plus(NFA nfa, NFAFragment inner) {
        int start = nfa.createState().getIndex();
        int accept = nfa.createState().getIndex();
        nfa.addEpsilon(start, inner.start);
        nfa.addEpsilon(inner.accept, inner.start);
        nfa.addEpsilon(inner.accept, accept);
        return new NFAFragment(start, accept);
    }

    // zero or one: bypass, no loop
    private static NFAFragment optional(NFA nfa, NFAFragment inner) {
        int start = nfa.createState().getIndex();
        int accept = nfa.createState().getIndex();
        nfa.addEpsilon(start, inner.start);
        nfa.addEpsilon(start, accept);
        nfa.addEpsilon(inner.accept, accept);
        return new NFAFragment(start, accept);
    }

    private static NFAFragment union(NFA nfa, NFAFragment left, NFAFragment right) {
        int start = nfa.createState().getIndex();
        int accept = nfa.createState().getIndex();
        nfa.addEpsilon(start, left.start);
        nfa.addEpsilon(start, right.start);
        nfa.addEpsilon(left.accept, accept);
        nfa.addEpsilon(right.accept, accept);
        return new NFAFragment(start, accept);
    }

    private static NFAFragment concat(NFA nfa, NFAFragment left, NFAFragment right) {
        nfa.addEpsilon(left.accept, right.start);
        return new NFAFragment(left.start, right.accept);
    }
}
