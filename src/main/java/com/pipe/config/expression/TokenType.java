package com.pipe.config.expression;

/**
 * Token types for condition expressions.
 */
public enum TokenType {
    // Condition item, resolved through the registry
    ITEM,

    // Delimiters
    LPAREN,
    RPAREN,

    // Logical operators
    AND,
    OR,
    NOT,

    // Special
    EOF
}
