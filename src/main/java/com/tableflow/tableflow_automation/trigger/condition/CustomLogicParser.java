package com.tableflow.tableflow_automation.trigger.condition;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses custom logic such as {@code "(group_0 | 1) & !group_2"} into a {@link CustomLogicExpression}.
 *
 * <p>Operands are 0-based group indices or group ids. Operators, by precedence:
 * {@code !}, then {@code &} / {@code &&}, then {@code |} / {@code ||}. Parentheses group.
 * Any other character is rejected.
 */
@Component
public class CustomLogicParser {

    public CustomLogicExpression parse(String expression, List<String> groupIds) {
        if (expression == null || expression.isBlank()) {
            throw new CustomLogicParseException(String.valueOf(expression), "expression is empty");
        }
        return new Parser(expression, tokenize(expression), groupIds).parse();
    }

    // ── Tokenizer ─────────────────────────────────────────────────────────────

    enum TokenType { INDEX, NAME, AND, OR, NOT, LPAREN, RPAREN }

    record Token(TokenType type, String text, int position) {}

    static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == ' ') {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i++));
            } else if (c == '!') {
                tokens.add(new Token(TokenType.NOT, "!", i++));
            } else if (c == '&' || c == '|') {
                int start = i;
                i += (i + 1 < expression.length() && expression.charAt(i + 1) == c) ? 2 : 1;
                tokens.add(new Token(c == '&' ? TokenType.AND : TokenType.OR, expression.substring(start, i), start));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < expression.length() && Character.isDigit(expression.charAt(i))) i++;
                tokens.add(new Token(TokenType.INDEX, expression.substring(start, i), start));
            } else if (isNameStart(c)) {
                int start = i;
                while (i < expression.length() && isNamePart(expression.charAt(i))) i++;
                tokens.add(new Token(TokenType.NAME, expression.substring(start, i), start));
            } else {
                throw new CustomLogicParseException(expression, "unexpected character '" + c + "' at position " + i);
            }
        }
        return tokens;
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || Character.isDigit(c);
    }

    // ── Recursive descent ─────────────────────────────────────────────────────

    private static final class Parser {

        private final String expression;
        private final List<Token> tokens;
        private final List<String> groupIds;
        private int pos;

        Parser(String expression, List<Token> tokens, List<String> groupIds) {
            this.expression = expression;
            this.tokens = tokens;
            this.groupIds = groupIds;
        }

        CustomLogicExpression parse() {
            CustomLogicExpression result = parseOr();
            if (pos < tokens.size()) {
                Token extra = tokens.get(pos);
                throw new CustomLogicParseException(expression, "unexpected '" + extra.text() + "' at position " + extra.position());
            }
            return result;
        }

        private CustomLogicExpression parseOr() {
            CustomLogicExpression left = parseAnd();
            while (accept(TokenType.OR)) {
                left = new CustomLogicExpression.Or(left, parseAnd());
            }
            return left;
        }

        private CustomLogicExpression parseAnd() {
            CustomLogicExpression left = parseUnary();
            while (accept(TokenType.AND)) {
                left = new CustomLogicExpression.And(left, parseUnary());
            }
            return left;
        }

        private CustomLogicExpression parseUnary() {
            if (accept(TokenType.NOT)) {
                return new CustomLogicExpression.Not(parseUnary());
            }
            return parsePrimary();
        }

        private CustomLogicExpression parsePrimary() {
            if (pos >= tokens.size()) {
                throw new CustomLogicParseException(expression, "unexpected end of expression");
            }
            Token token = tokens.get(pos++);
            switch (token.type()) {
                case LPAREN -> {
                    CustomLogicExpression inner = parseOr();
                    if (!accept(TokenType.RPAREN)) {
                        throw new CustomLogicParseException(expression, "missing ')' for '(' at position " + token.position());
                    }
                    return inner;
                }
                case INDEX -> {
                    int index;
                    try {
                        index = Integer.parseInt(token.text());
                    } catch (NumberFormatException ex) {
                        throw new CustomLogicParseException(expression, "group index " + token.text() + " out of range");
                    }
                    if (index >= groupIds.size()) {
                        throw new CustomLogicParseException(expression, "group index " + index + " out of range");
                    }
                    return new CustomLogicExpression.GroupRef(index);
                }
                case NAME -> {
                    int index = groupIds.indexOf(token.text());
                    if (index < 0) {
                        throw new CustomLogicParseException(expression, "unknown group '" + token.text() + "'");
                    }
                    return new CustomLogicExpression.GroupRef(index);
                }
                default -> throw new CustomLogicParseException(expression,
                        "unexpected '" + token.text() + "' at position " + token.position());
            }
        }

        private boolean accept(TokenType type) {
            if (pos < tokens.size() && tokens.get(pos).type() == type) {
                pos++;
                return true;
            }
            return false;
        }
    }
}
