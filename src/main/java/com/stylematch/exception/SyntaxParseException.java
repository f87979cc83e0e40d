package com.stylematch.exception;

/**
 * Exception thrown when a property syntax string is malformed.
 * Carries the position in the syntax text where parsing stopped.
 */
public class SyntaxParseException extends StyleMatchException {

    private final int position;

    public SyntaxParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
