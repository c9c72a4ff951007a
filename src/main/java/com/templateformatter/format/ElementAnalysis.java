package com.templateformatter.format;

/**
 * Layout decision for one element: whether its open tag, content and close tag each stay on the
 * current line.
 */
public final class ElementAnalysis {
    static final ElementAnalysis PRESERVED = new ElementAnalysis(false, false, false);

    private final boolean openTagInline;
    private final boolean elementContentInline;
    private final boolean closeTagInline;

    public ElementAnalysis(boolean openTagInline, boolean elementContentInline, boolean closeTagInline) {
        this.openTagInline = openTagInline;
        this.elementContentInline = elementContentInline;
        this.closeTagInline = closeTagInline;
    }

    public boolean isOpenTagInline() { return openTagInline; }
    public boolean isElementContentInline() { return elementContentInline; }
    public boolean isCloseTagInline() { return closeTagInline; }

    public boolean isFullyInline() {
        return openTagInline && elementContentInline && closeTagInline;
    }

    public boolean isBlockFormat() {
        return !elementContentInline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementAnalysis)) return false;
        ElementAnalysis other = (ElementAnalysis) o;
        return openTagInline == other.openTagInline
                && elementContentInline == other.elementContentInline
                && closeTagInline == other.closeTagInline;
    }

    @Override
    public int hashCode() {
        return (openTagInline ? 4 : 0) | (elementContentInline ? 2 : 0) | (closeTagInline ? 1 : 0);
    }

    @Override
    public String toString() {
        return "ElementAnalysis(open=" + openTagInline + ", content=" + elementContentInline
                + ", close=" + closeTagInline + ")";
    }
}
