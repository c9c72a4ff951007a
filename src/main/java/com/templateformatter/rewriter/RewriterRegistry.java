package com.templateformatter.rewriter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

import com.templateformatter.util.LoggerUtil;

/**
 * Maps rewriter names to factories. Built-ins are registered on construction; a rewriter
 * registered later under the same name shadows the built-in.
 */
public class RewriterRegistry {
    private static final Logger logger = LoggerUtil.getLogger(RewriterRegistry.class);

    private final Map<String, Supplier<? extends AstRewriter>> astRewriters = new LinkedHashMap<>();
    private final Map<String, Supplier<? extends StringRewriter>> stringRewriters = new LinkedHashMap<>();

    public RewriterRegistry() {
        registerAstRewriter(TailwindClassSorter.NAME, TailwindClassSorter::new);
        registerStringRewriter(TrailingNewlineRewriter.NAME, TrailingNewlineRewriter::new);
    }

    public RewriterRegistry registerAstRewriter(String name, Supplier<? extends AstRewriter> factory) {
        astRewriters.put(_normalizeName(name), factory);
        return this;
    }

    public RewriterRegistry registerStringRewriter(String name, Supplier<? extends StringRewriter> factory) {
        stringRewriters.put(_normalizeName(name), factory);
        return this;
    }

    public boolean isRegistered(String name) {
        String key = _normalizeName(name);
        return astRewriters.containsKey(key) || stringRewriters.containsKey(key);
    }

    public AstRewriter resolveAstRewriter(String name) {
        Supplier<? extends AstRewriter> factory = astRewriters.get(_normalizeName(name));
        return factory == null ? null : factory.get();
    }

    public StringRewriter resolveStringRewriter(String name) {
        Supplier<? extends StringRewriter> factory = stringRewriters.get(_normalizeName(name));
        return factory == null ? null : factory.get();
    }

    /**
     * Instantiates the named AST rewriters in order. Unknown names are logged and skipped.
     */
    public List<AstRewriter> resolveAstRewriters(Collection<String> names) {
        List<AstRewriter> result = new ArrayList<>();
        for (String name : names) {
            AstRewriter rewriter = resolveAstRewriter(name);
            if (rewriter == null) {
                logger.warning("Unknown pre-format rewriter '" + name + "', skipping");
            } else {
                result.add(rewriter);
            }
        }
        return result;
    }

    /**
     * Instantiates the named string rewriters in order. Unknown names are logged and skipped.
     */
    public List<StringRewriter> resolveStringRewriters(Collection<String> names) {
        List<StringRewriter> result = new ArrayList<>();
        for (String name : names) {
            StringRewriter rewriter = resolveStringRewriter(name);
            if (rewriter == null) {
                logger.warning("Unknown post-format rewriter '" + name + "', skipping");
            } else {
                result.add(rewriter);
            }
        }
        return result;
    }

    // directories and file extensions are not part of the name
    private static String _normalizeName(String name) {
        String base = name.substring(Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\')) + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
