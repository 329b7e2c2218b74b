package org.neuralchilli.symdag.core;

import org.neuralchilli.symdag.domain.OperatorKind;
import org.neuralchilli.symdag.util.Tokens;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns infix text into postfix tokens.
 * Tokenizing splits on whitespace and on each of + - * / ^ ( ), and the
 * shunting-yard pass orders operators by precedence and associativity.
 * Function names need no argument list syntax: "sin(x)" and "sin x" both
 * lower to "x sin".
 */
public class ExpressionParser {

    private static final String OPEN = "(";
    private static final String CLOSE = ")";

    /**
     * Split text into tokens. Every run of characters other than whitespace,
     * operators and parentheses is a single token.
     */
    public List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                flush(current, tokens);
            } else if (Tokens.isOperatorChar(c) || Tokens.isParenthesis(c)) {
                flush(current, tokens);
                tokens.add(String.valueOf(c));
            } else {
                current.append(c);
            }
        }

        flush(current, tokens);
        return tokens;
    }

    /**
     * Shunting-yard conversion to postfix.
     * A "-" at the start, after "(" or after another operator is unary and
     * becomes the "neg" token.
     *
     * @throws ParseException if a token is not recognised or parentheses do not balance
     */
    public List<String> toPostfix(List<String> tokens) {
        List<String> output = new ArrayList<>();
        Deque<String> operators = new ArrayDeque<>();
        Deque<Integer> precedences = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);

            if (token.equals("-") && isUnaryContext(tokens, i)) {
                token = OperatorKind.NEGATE.token();
            }

            OperatorKind op = OperatorKind.fromToken(token);

            if (Tokens.isNumber(token)) {
                output.add(token);
            } else if (op != OperatorKind.NONE) {
                int precedence = op.precedence();

                while (!operators.isEmpty() && !operators.peek().equals(OPEN)
                        && (precedences.peek() > precedence
                        || (precedences.peek() == precedence && op.isLeftAssociative()))) {
                    output.add(operators.pop());
                    precedences.pop();
                }

                operators.push(token);
                precedences.push(precedence);
            } else if (token.equals(OPEN)) {
                operators.push(token);
                precedences.push(0);
            } else if (token.equals(CLOSE)) {
                while (!operators.isEmpty() && !operators.peek().equals(OPEN)) {
                    output.add(operators.pop());
                    precedences.pop();
                }

                if (operators.isEmpty()) {
                    throw new ParseException(
                            ParseException.Reason.UNKNOWN_TOKEN,
                            "Unbalanced parenthesis: ')' without matching '('",
                            CLOSE
                    );
                }
                operators.pop();
                precedences.pop();

                // sin(x): the function waiting in front of the parenthesis applies now
                if (!operators.isEmpty() && OperatorKind.fromToken(operators.peek()).isUnary()) {
                    output.add(operators.pop());
                    precedences.pop();
                }
            } else if (Tokens.isVariable(token)) {
                output.add(token);
            } else {
                throw new ParseException(
                        ParseException.Reason.UNKNOWN_TOKEN,
                        "Unknown token: " + token,
                        token
                );
            }
        }

        while (!operators.isEmpty()) {
            String top = operators.pop();
            if (top.equals(OPEN)) {
                throw new ParseException(
                        ParseException.Reason.UNKNOWN_TOKEN,
                        "Unbalanced parenthesis: '(' is never closed",
                        OPEN
                );
            }
            output.add(top);
        }

        return output;
    }

    private boolean isUnaryContext(List<String> tokens, int index) {
        if (index == 0) {
            return true;
        }
        String previous = tokens.get(index - 1);
        return previous.equals(OPEN) || OperatorKind.isOperatorToken(previous);
    }

    private void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
