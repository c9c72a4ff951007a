package com.templateformatter.printer;

import java.util.List;

import com.templateformatter.ast.Node;
import com.templateformatter.ast.ParseError;
import com.templateformatter.ast.ParseResult;
import com.templateformatter.ast.Visitor;

/**
 * Base class of visitors that turn a tree back into text through a {@link PrintContext}.
 */
public abstract class Printer extends Visitor {
    protected final PrintContext context;

    protected Printer(PrintContext context) {
        this.context = context;
    }

    public PrintContext getContext() {
        return context;
    }

    public String print(ParseResult result) {
        return print(result.getValue(), false);
    }

    public String print(Node node) {
        return print(node, false);
    }

    /**
     * Prints {@code node}. Unless {@code ignoreErrors} is set, a tree carrying parse errors is
     * rejected with a {@link PrintException}.
     */
    public String print(Node node, boolean ignoreErrors) {
        if (!ignoreErrors) {
            List<ParseError> errors = node.recursiveErrors();
            if (!errors.isEmpty()) {
                throw new PrintException("Cannot print a tree with parse errors (" + errors.size()
                        + " error(s) found, first: " + errors.get(0) + ")");
            }
        }
        context.reset();
        visit(node);
        return context.getOutput();
    }

    protected void write(String text) {
        if (text != null) {
            context.write(text);
        }
    }
}
