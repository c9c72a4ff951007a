package com.templateformatter.lint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

import com.templateformatter.config.FormatterConfig;
import com.templateformatter.lint.rules.ErbNoEmptyTagsRule;
import com.templateformatter.lint.rules.ErbNoExtraNewlineRule;
import com.templateformatter.lint.rules.ErbNoTrailingWhitespaceRule;
import com.templateformatter.lint.rules.HtmlAttributeDoubleQuotesRule;
import com.templateformatter.lint.rules.HtmlNoDuplicateAttributesRule;
import com.templateformatter.lint.rules.HtmlNoSelfClosingRule;
import com.templateformatter.lint.rules.HtmlTagNameLowercaseRule;
import com.templateformatter.util.LoggerUtil;

/**
 * Maps rule names to factories. Each lint run gets fresh rule instances, since visitor rules
 * keep per-run state.
 */
public class RuleRegistry {
    private static final Logger logger = LoggerUtil.getLogger(RuleRegistry.class);

    private final Map<String, Supplier<Rule>> factories = new LinkedHashMap<>();

    public static RuleRegistry withBuiltIns() {
        RuleRegistry registry = new RuleRegistry();
        registry.register(HtmlTagNameLowercaseRule.NAME, HtmlTagNameLowercaseRule::new);
        registry.register(HtmlNoSelfClosingRule.NAME, HtmlNoSelfClosingRule::new);
        registry.register(HtmlAttributeDoubleQuotesRule.NAME, HtmlAttributeDoubleQuotesRule::new);
        registry.register(HtmlNoDuplicateAttributesRule.NAME, HtmlNoDuplicateAttributesRule::new);
        registry.register(ErbNoEmptyTagsRule.NAME, ErbNoEmptyTagsRule::new);
        registry.register(ErbNoExtraNewlineRule.NAME, ErbNoExtraNewlineRule::new);
        registry.register(ErbNoTrailingWhitespaceRule.NAME, ErbNoTrailingWhitespaceRule::new);
        return registry;
    }

    /**
     * Registers a rule factory, replacing any rule of the same name.
     */
    public RuleRegistry register(String name, Supplier<Rule> factory) {
        if (factories.put(name, factory) != null) {
            logger.fine("Rule '" + name + "' replaced");
        }
        return this;
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public Set<String> getRuleNames() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public Rule create(String name) {
        Supplier<Rule> factory = factories.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown rule: " + name);
        }
        return factory.get();
    }

    public List<Rule> createAll() {
        List<Rule> rules = new ArrayList<>();
        for (Supplier<Rule> factory : factories.values()) {
            rules.add(factory.get());
        }
        return rules;
    }

    /**
     * Creates every registered rule not switched off in the configuration. Switches naming
     * unknown rules are logged and ignored.
     */
    public List<Rule> createEnabled(FormatterConfig config) {
        for (String name : config.getRuleSwitches().keySet()) {
            if (!factories.containsKey(name)) {
                logger.warning("Unknown rule in configuration: " + name);
            }
        }
        List<Rule> rules = new ArrayList<>();
        for (Map.Entry<String, Supplier<Rule>> entry : factories.entrySet()) {
            if (config.isRuleEnabled(entry.getKey())) {
                rules.add(entry.getValue().get());
            }
        }
        return rules;
    }
}
