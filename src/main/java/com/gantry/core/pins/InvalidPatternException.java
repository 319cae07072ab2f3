package com.gantry.core.pins;

/**
 * Raised when a scope pattern is malformed. Surfaced at task creation, never at match time.
 */
public class InvalidPatternException extends RuntimeException {

    private final String pattern;

    public InvalidPatternException(String pattern, String message) {
        super("Invalid path pattern '" + pattern + "': " + message);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
