package com.templateformatter.rewriter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.templateformatter.format.FormatContext;

class RewriterRegistryTest {

    static class ShoutingRewriter extends StringRewriter {
        @Override
        public String getName() {
            return "trailing-newline";
        }

        @Override
        public String getDescription() {
            return "Upper-cases the output";
        }

        @Override
        public String rewrite(String formatted, FormatContext context) {
            return formatted.toUpperCase();
        }
    }

    @Test
    void testBuiltInsAreRegistered() {
        RewriterRegistry registry = new RewriterRegistry();

        assertThat(registry.isRegistered(TailwindClassSorter.NAME)).isTrue();
        assertThat(registry.isRegistered(TrailingNewlineRewriter.NAME)).isTrue();
        assertThat(registry.resolveAstRewriter(TailwindClassSorter.NAME)).isInstanceOf(TailwindClassSorter.class);
        assertThat(registry.resolveStringRewriter(TrailingNewlineRewriter.NAME))
                .isInstanceOf(TrailingNewlineRewriter.class);
    }

    @Test
    void testPhasesAreSeparate() {
        RewriterRegistry registry = new RewriterRegistry();

        assertThat(registry.resolveAstRewriter(TrailingNewlineRewriter.NAME)).isNull();
        assertThat(registry.resolveStringRewriter(TailwindClassSorter.NAME)).isNull();
    }

    @Test
    void testCustomRewriterShadowsBuiltIn() {
        RewriterRegistry registry = new RewriterRegistry()
                .registerStringRewriter("rewriters/trailing-newline.java", ShoutingRewriter::new);

        assertThat(registry.resolveStringRewriter("trailing-newline")).isInstanceOf(ShoutingRewriter.class);
    }

    @Test
    void testUnknownNamesAreSkipped() {
        RewriterRegistry registry = new RewriterRegistry();

        List<AstRewriter> pre = registry.resolveAstRewriters(List.of("missing", TailwindClassSorter.NAME));
        List<StringRewriter> post = registry.resolveStringRewriters(List.of(TrailingNewlineRewriter.NAME, "nope"));

        assertThat(pre).hasSize(1).first().isInstanceOf(TailwindClassSorter.class);
        assertThat(post).hasSize(1).first().isInstanceOf(TrailingNewlineRewriter.class);
    }
}
