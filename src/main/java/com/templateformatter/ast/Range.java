package com.templateformatter.ast;

/**
 * Half-open character offset range {@code [from, to)} into the source string.
 */
public final class Range {
    private final int from;
    private final int to;

    public Range(int from, int to) {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ")");
        }
        this.from = from;
        this.to = to;
    }

    public int getFrom() { return from; }
    public int getTo() { return to; }

    public int length() {
        return to - from;
    }

    public static Range between(Range first, Range last) {
        return new Range(first.from, last.to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Range)) return false;
        Range other = (Range) o;
        return from == other.from && to == other.to;
    }

    @Override
    public int hashCode() {
        return 31 * from + to;
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to + ")";
    }
}
