package com.templateformatter.ast;

import java.util.List;

/**
 * The root document, the accumulated parse errors and the source it was parsed from.
 * Created once per input and shared by every analysis and fix phase of that input.
 */
public final class ParseResult {
    private final DocumentNode value;
    private final List<ParseError> errors;
    private final String source;

    public ParseResult(DocumentNode value, List<ParseError> errors, String source) {
        this.value = value;
        this.errors = List.copyOf(errors);
        this.source = source;
    }

    public DocumentNode getValue() { return value; }
    public List<ParseError> getErrors() { return errors; }
    public String getSource() { return source; }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
