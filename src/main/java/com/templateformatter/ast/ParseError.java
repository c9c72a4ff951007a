package com.templateformatter.ast;

/**
 * A problem the parser found in the source.
 */
public final class ParseError {
    private final String message;
    private final Location location;

    public ParseError(String message, Location location) {
        this.message = message;
        this.location = location;
    }

    public String getMessage() { return message; }
    public Location getLocation() { return location; }

    @Override
    public String toString() {
        return message + " at " + location.getStart();
    }
}
