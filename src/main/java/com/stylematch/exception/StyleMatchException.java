package com.stylematch.exception;

/**
 * Base exception for the style matcher.
 */
public class StyleMatchException extends RuntimeException {

    public StyleMatchException(String message) {
        super(message);
    }

    public StyleMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
