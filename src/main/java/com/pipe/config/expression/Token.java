package com.pipe.config.expression;

/**
 * Represents a token in a condition expression.
 *
 * @param type     Token type
 * @param text     Original text (trimmed for items)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
