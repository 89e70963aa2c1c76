package com.pipe.config;

import com.pipe.condition.Condition;
import com.pipe.condition.ConditionRegistry;
import com.pipe.condition.impl.AlwaysTrueCondition;
import com.pipe.config.expression.ExpressionParser;
import com.pipe.config.expression.ExpressionTokenizer;
import com.pipe.config.expression.Token;

import java.util.List;

/**
 * Facade for parsing condition expressions into Condition trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: {@code &} (AND), {@code |} (OR), {@code ~} (NOT)</li>
 *   <li>Parentheses for grouping</li>
 *   <li>Any item the {@link ConditionRegistry} understands</li>
 * </ul>
 * <p>
 * Precedence: NOT > AND > OR (parentheses override)
 */
public final class ConditionExpressionParser {

    private final ConditionRegistry registry;

    public ConditionExpressionParser(ConditionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parse a condition expression. A blank expression is always true.
     *
     * @param expression Expression string
     * @return Parsed condition
     */
    public Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return AlwaysTrueCondition.INSTANCE;
        }

        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        ExpressionParser parser = new ExpressionParser(expression, tokens, registry);
        return parser.parse();
    }
}
