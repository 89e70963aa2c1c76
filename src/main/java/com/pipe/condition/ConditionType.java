package com.pipe.condition;

/**
 * Supported condition types.
 */
public enum ConditionType {
    // Logical
    ANY,
    ALL,
    NOT,

    // Constant
    ALWAYS_TRUE,
    ALWAYS_FALSE,

    // Temporal
    TIME,

    // External check
    PROBE
}
