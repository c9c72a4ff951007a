package com.templateformatter.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatterCliTest {

    @TempDir
    Path tempDir;

    @Test
    void exitCodesForBasicInvocations() {
        assertThat(FormatterCli.run(new String[0])).isEqualTo(1);
        assertThat(FormatterCli.run(new String[] {"--version"})).isZero();
        assertThat(FormatterCli.run(new String[] {"--help"})).isZero();
        assertThat(FormatterCli.run(new String[] {"reformat"})).isEqualTo(1);
    }

    @Test
    void commandsRequireAnExistingPath() {
        assertThat(FormatterCli.run(new String[] {"format", "--no-color"})).isEqualTo(1);
        assertThat(FormatterCli.run(new String[] {"check", tempDir.resolve("missing.html.erb").toString()}))
                .isEqualTo(1);
    }

    @Test
    void checkThenFormatThenCheck() throws IOException {
        Path file = _write("page.html.erb", "<div><span>A</span></div>");
        String[] check = {"check", file.toString(), "--no-color", _config()};

        assertThat(FormatterCli.run(check)).isEqualTo(1);
        assertThat(Files.readString(file)).isEqualTo("<div><span>A</span></div>");

        assertThat(FormatterCli.run(new String[] {"format", file.toString(), "--no-color", _config()})).isZero();
        assertThat(Files.readString(file)).isEqualTo("<div><span>A</span></div>\n");

        assertThat(FormatterCli.run(check)).isZero();
    }

    @Test
    void formatsWholeDirectory() throws IOException {
        Path views = Files.createDirectories(tempDir.resolve("views/users"));
        Path show = Files.writeString(views.resolve("show.html.erb"), "<div><p>A</p></div>");
        Path index = Files.writeString(tempDir.resolve("views/index.html.erb"), "<%=x%>");
        Path ignored = Files.writeString(views.resolve("raw.html.erb"),
                "<%# herb:formatter ignore %>\n<div><p>A</p></div>");
        String[] check = {"check", tempDir.resolve("views").toString(), "--no-color", _config()};

        assertThat(FormatterCli.run(check)).isEqualTo(1);
        assertThat(Files.readString(show)).isEqualTo("<div><p>A</p></div>");

        assertThat(FormatterCli.run(new String[] {"format", tempDir.resolve("views").toString(), "--no-color",
                _config()})).isZero();
        assertThat(Files.readString(show)).isEqualTo("<div>\n  <p>A</p>\n</div>\n");
        assertThat(Files.readString(index)).isEqualTo("<%= x %>\n");
        assertThat(Files.readString(ignored)).isEqualTo("<%# herb:formatter ignore %>\n<div><p>A</p></div>");

        assertThat(FormatterCli.run(check)).isZero();
    }

    @Test
    void formatLeavesUnparsableTemplatesAlone() throws IOException {
        Path file = _write("broken.html.erb", "<div><span>A</div>");

        assertThat(FormatterCli.run(new String[] {"format", file.toString(), "--no-color", _config()}))
                .isEqualTo(1);
        assertThat(Files.readString(file)).isEqualTo("<div><span>A</div>");
    }

    @Test
    void fixRewritesSafeProblems() throws IOException {
        Path file = _write("fix.html.erb", "<DIV>a</DIV>\n");

        assertThat(FormatterCli.run(new String[] {"fix", file.toString(), "--no-color", _config()})).isZero();
        assertThat(Files.readString(file)).isEqualTo("<div>a</div>\n");
    }

    @Test
    void lintReportsFailureForErrors() throws IOException {
        Path file = _write("lint.html.erb", "<DIV>a</DIV>\n");

        assertThat(FormatterCli.run(new String[] {"lint", file.toString(), "--no-color", _config()})).isEqualTo(1);
        assertThat(Files.readString(file)).isEqualTo("<DIV>a</DIV>\n");
    }

    private Path _write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String _config() {
        return "--config=" + tempDir.resolve("absent.yml");
    }
}
