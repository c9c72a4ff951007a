package com.templateformatter.printer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Output state of one printer: the lines built so far, the indent level, the inline-mode flag
 * and the stack of open tag names.
 *
 * <p>Not thread-safe. {@link #capture(Runnable)} runs a nested rendering into a scratch buffer
 * and returns its lines without touching the outer buffer; it is how speculative single-line
 * renderings are measured.
 */
public class PrintContext {
    private final int indentWidth;
    private List<String> lines = new ArrayList<>();
    private int indentLevel = 0;
    private boolean inlineMode = false;
    private final Deque<String> tagStack = new ArrayDeque<>();

    public PrintContext() {
        this(2);
    }

    public PrintContext(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    /**
     * Appends text to the current line, starting one if there is none.
     */
    public void write(String text) {
        if (lines.isEmpty()) {
            lines.add(text);
        } else {
            int last = lines.size() - 1;
            lines.set(last, lines.get(last) + text);
        }
    }

    /**
     * Starts a new line at the current indent. Empty text yields an empty line, never an
     * indent-only one.
     */
    public void push(String text) {
        lines.add(text.isEmpty() ? "" : indentString() + text);
    }

    /**
     * Starts a new line without applying the indent.
     */
    public void pushRaw(String text) {
        lines.add(text);
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel == 0) {
            throw new IllegalStateException("Cannot dedent below zero");
        }
        indentLevel--;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public String indentString() {
        return " ".repeat(indentLevel * indentWidth);
    }

    /**
     * Number of columns taken by the current indent.
     */
    public int indentColumns() {
        return indentLevel * indentWidth;
    }

    public boolean isInlineMode() {
        return inlineMode;
    }

    public void setInlineMode(boolean inlineMode) {
        this.inlineMode = inlineMode;
    }

    public void enterTag(String tagName) {
        tagStack.push(tagName);
    }

    public void exitTag() {
        tagStack.pop();
    }

    public boolean isInsideTag(String tagName) {
        for (String open : tagStack) {
            if (open.equalsIgnoreCase(tagName)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getTagStack() {
        return new ArrayList<>(tagStack);
    }

    /**
     * Runs {@code rendering} against a fresh line buffer and returns what it produced. The outer
     * lines, indent level and inline mode are restored afterwards.
     */
    public List<String> capture(Runnable rendering) {
        List<String> saved = lines;
        int savedIndent = indentLevel;
        boolean savedInline = inlineMode;
        lines = new ArrayList<>();
        try {
            rendering.run();
            return lines;
        } finally {
            lines = saved;
            indentLevel = savedIndent;
            inlineMode = savedInline;
        }
    }

    public List<String> getLines() {
        return new ArrayList<>(lines);
    }

    public String getOutput() {
        return String.join("\n", lines);
    }

    public void reset() {
        lines = new ArrayList<>();
        indentLevel = 0;
        inlineMode = false;
        tagStack.clear();
    }
}
