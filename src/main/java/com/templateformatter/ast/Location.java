package com.templateformatter.ast;

/**
 * Start and end position of a node or token.
 */
public final class Location {
    private final Position start;
    private final Position end;

    public Location(Position start, Position end) {
        this.start = start;
        this.end = end;
    }

    public Position getStart() { return start; }
    public Position getEnd() { return end; }

    /**
     * Creates a location spanning from the start of one location to the end of another.
     */
    public static Location between(Location first, Location last) {
        return new Location(first.start, last.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return "(" + start + ")-(" + end + ")";
    }
}
