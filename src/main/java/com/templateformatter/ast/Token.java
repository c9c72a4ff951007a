package com.templateformatter.ast;

/**
 * An immutable terminal owned by exactly one node field.
 */
public final class Token {
    private final String value;
    private final Range range;
    private final Location location;
    private final TokenType type;

    public Token(String value, Range range, Location location, TokenType type) {
        this.value = value;
        this.range = range;
        this.location = location;
        this.type = type;
    }

    public String getValue() { return value; }
    public Range getRange() { return range; }
    public Location getLocation() { return location; }
    public TokenType getType() { return type; }

    /**
     * Returns a token of the same type and span carrying different text.
     */
    public Token withValue(String newValue) {
        return new Token(newValue, range, location, type);
    }

    @Override
    public String toString() {
        return type + "(\"" + value + "\")";
    }
}
