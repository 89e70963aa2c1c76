package com.pipe.config.expression;

/**
 * Operator symbols used in condition expressions.
 * Words are never operators, so items like "between 08:00 and 17:00" stay intact.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    public static final char LEFT_PAREN = '(';
    public static final char RIGHT_PAREN = ')';
    public static final char AND = '&';
    public static final char OR = '|';
    public static final char NOT = '~';

    /**
     * Check whether a character starts an operator or delimiter token.
     */
    public static boolean isOperator(char c) {
        return c == LEFT_PAREN || c == RIGHT_PAREN || c == AND || c == OR || c == NOT;
    }
}
