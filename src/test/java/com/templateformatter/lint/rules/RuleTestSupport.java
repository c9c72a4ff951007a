package com.templateformatter.lint.rules;

import java.nio.file.Paths;
import java.util.List;

import com.templateformatter.autofix.AutofixResult;
import com.templateformatter.autofix.Autofixer;
import com.templateformatter.lint.LintResult;
import com.templateformatter.lint.Linter;
import com.templateformatter.lint.Rule;

final class RuleTestSupport {

    private RuleTestSupport() {
    }

    static LintResult lint(Rule rule, String source) {
        return new Linter(List.of(rule)).lint(Paths.get("rule.html.erb"), source);
    }

    static String fix(Rule rule, String source) {
        return fix(rule, source, false);
    }

    static String fix(Rule rule, String source, boolean unsafe) {
        LintResult result = lint(rule, source);
        AutofixResult fixed = new Autofixer().apply(result.getParseResult(), result.getDiagnostics(), unsafe);
        return fixed.getSource();
    }
}
