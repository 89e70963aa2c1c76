package com.pipe.config.expression;

import com.pipe.exception.ConditionParseException;

import java.util.ArrayList;
import java.util.List;

import static com.pipe.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for condition expressions.
 * Converts input string into a sequence of tokens. Everything between
 * operators is one item token.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                case AND -> {
                    advance();
                    tokens.add(new Token(TokenType.AND, "&", start));
                }
                case OR -> {
                    advance();
                    tokens.add(new Token(TokenType.OR, "|", start));
                }
                case NOT -> {
                    advance();
                    tokens.add(new Token(TokenType.NOT, "~", start));
                }
                default -> tokens.add(readItem());
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private Token readItem() {
        int start = pos;
        while (!isAtEnd() && !isOperator(peek())) {
            advance();
        }
        String text = input.substring(start, pos).trim();
        if (text.isEmpty()) {
            throw new ConditionParseException(input, start, "Empty condition item");
        }
        return new Token(TokenType.ITEM, text, start);
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }
}
