package com.templateformatter.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultConfigEnablesAllRules() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getFormatterConfig("indentWidth", 0)).isEqualTo(2);
        assertThat(config.getFormatterConfig("maxLineLength", 0)).isEqualTo(80);
        assertThat(config.getFormatterList("contentPreservingElements", List.of()))
                .containsExactly("script", "style", "pre", "textarea");
        assertThat(config.getRuleSwitches()).hasSize(7).doesNotContainValue(false);
        assertThat(config.isUnsafeFixesEnabled()).isFalse();
        assertThat(config.getRewriters("pre")).isEmpty();
    }

    @Test
    void testNullOrMissingPathFallsBackToDefaults() {
        assertThat(ConfigurationLoader.loadConfig(null)).isSameAs(ConfigurationLoader.loadDefaultConfig());
        assertThat(ConfigurationLoader.loadConfig(tempDir.resolve("missing.yml")))
                .isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void testLoadsUserConfig() throws IOException {
        Path file = tempDir.resolve(ConfigurationLoader.CONFIG_FILE_NAME);
        Files.writeString(file, String.join("\n",
                "formatter:",
                "  indentWidth: 4",
                "  maxLineLength: 120",
                "  rewriters:",
                "    pre: [tailwind-class-sorter]",
                "    post: [trailing-newline]",
                "linter:",
                "  unsafeFixes: true",
                "  rules:",
                "    erb-no-empty-tags: false",
                ""));

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getFormatterConfig("indentWidth", 0)).isEqualTo(4);
        assertThat(config.getFormatterConfig("maxLineLength", 0)).isEqualTo(120);
        assertThat(config.getRewriters("pre")).containsExactly("tailwind-class-sorter");
        assertThat(config.getRewriters("post")).containsExactly("trailing-newline");
        assertThat(config.isUnsafeFixesEnabled()).isTrue();
        assertThat(config.isRuleEnabled("erb-no-empty-tags")).isFalse();
        assertThat(config.isRuleEnabled("html-no-self-closing")).isTrue();
        assertThat(config.getFormatterList("voidElements", List.of())).contains("br", "img");
    }

    @Test
    void testOutOfRangeValuesAreReplacedByDefaults() throws IOException {
        Path file = tempDir.resolve("range.yml");
        Files.writeString(file, "formatter:\n  indentWidth: 20\n  maxLineLength: 10\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getFormatterConfig("indentWidth", 0)).isEqualTo(2);
        assertThat(config.getFormatterConfig("maxLineLength", 0)).isEqualTo(80);
    }

    @Test
    void testMalformedFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "formatter: [unclosed\n  - : :\n");

        assertThat(ConfigurationLoader.loadConfig(file)).isSameAs(ConfigurationLoader.loadDefaultConfig());
    }

    @Test
    void testFindConfigWalksUpParents() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("app/views/users"));
        Path file = Files.writeString(tempDir.resolve(ConfigurationLoader.CONFIG_FILE_NAME), "formatter: {}\n");

        assertThat(ConfigurationLoader.findConfig(nested)).isEqualTo(file.toAbsolutePath());
    }

    @Test
    void testSaveThenLoad() throws IOException {
        Path file = tempDir.resolve("out/" + ConfigurationLoader.CONFIG_FILE_NAME);

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), file);
        FormatterConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertThat(Files.exists(file)).isTrue();
        assertThat(reloaded.getRuleSwitches()).isEqualTo(ConfigurationLoader.loadDefaultConfig().getRuleSwitches());
        assertThat(reloaded.getFormatterConfig("indentWidth", 0)).isEqualTo(2);
    }
}
