package com.pipe.exception;

/**
 * Exception thrown when text cannot be turned into a condition,
 * either because no registered rule matches an item or because
 * the surrounding expression is malformed.
 */
public class ConditionParseException extends PipeException {

    private final String input;
    private final int position;

    public ConditionParseException(String input, String message) {
        this(input, -1, message);
    }

    public ConditionParseException(String input, String message, Throwable cause) {
        super(message + ": '" + input + "'", cause);
        this.input = input;
        this.position = -1;
    }

    public ConditionParseException(String input, int position, String message) {
        super(position >= 0
                ? "Invalid condition at position " + position + ": " + message + " in '" + input + "'"
                : message + ": '" + input + "'");
        this.input = input;
        this.position = position;
    }

    public String getInput() {
        return input;
    }

    /**
     * Position of the error in the input, or -1 when not known.
     */
    public int getPosition() {
        return position;
    }
}
