package com.pipe.condition;

/**
 * Turns a single condition item such as {@code "daily between 08:00 and 17:00"}
 * into a {@link Condition}.
 */
public interface ConditionRegistry {

    /**
     * Parse one condition item.
     *
     * @param text Item text
     * @return Condition instance
     * @throws com.pipe.exception.ConditionParseException if no rule matches
     */
    Condition parse(String text);
}
