package com.pipe.config.expression;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionRegistry;
import com.pipe.condition.impl.AllCondition;
import com.pipe.condition.impl.AnyCondition;
import com.pipe.condition.impl.NotCondition;
import com.pipe.exception.ConditionParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for condition expressions.
 * Converts tokens into a Condition tree using recursive descent parsing;
 * items are handed to the {@link ConditionRegistry}.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('|' and)*
 * and        := not ('&amp;' not)*
 * not        := '~' not | primary
 * primary    := '(' expression ')' | item
 * </pre>
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private final ConditionRegistry registry;
    private int index;

    public ExpressionParser(String input, List<Token> tokens, ConditionRegistry registry) {
        this.input = input;
        this.tokens = tokens;
        this.registry = registry;
        this.index = 0;
    }

    /**
     * Parse the token stream into a Condition tree.
     *
     * @return Root condition
     */
    public Condition parse() {
        Condition result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private Condition parseExpression() {
        return parseOr();
    }

    private Condition parseOr() {
        Condition left = parseAnd();
        List<Condition> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }

        return conditions.size() == 1 ? left : AnyCondition.of(conditions);
    }

    private Condition parseAnd() {
        Condition left = parseNot();
        List<Condition> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.AND)) {
            conditions.add(parseNot());
        }

        return conditions.size() == 1 ? left : AllCondition.of(conditions);
    }

    private Condition parseNot() {
        if (match(TokenType.NOT)) {
            return NotCondition.of(parseNot());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        if (match(TokenType.LPAREN)) {
            Condition expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }

        Token item = consume(TokenType.ITEM, "Expected condition");
        try {
            return registry.parse(item.text());
        } catch (ConditionParseException e) {
            throw new ConditionParseException(input, item.position(), e.getMessage());
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ConditionParseException error(String message) {
        return new ConditionParseException(input, peek().position(), message);
    }
}
