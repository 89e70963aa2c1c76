package com.pipe.config;

import com.pipe.condition.Condition;

/**
 * Configuration for one scheduled task's start condition.
 *
 * @param name       Task name
 * @param expression Condition expression as written in the configuration
 * @param condition  Parsed condition
 */
public record TaskConfig(String name, String expression, Condition condition) {
}
