package com.optmodeler.cli;

import com.optmodeler.OptModelerCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RenderCommand} and {@link ValidateCommand}.
 */
class RenderCommandTest {

    private static final String BASIC_MODEL = """
        name: basic
        variables:
          - name: x
            lb: 0
        constraints:
          - name: c1
            terms: [{ variable: x }]
            sense: "<="
            rhs: 10
        objective:
          name: obj
          sense: max
          terms: [{ variable: x }]
        """;

    private static final String EXPECTED_PROGRAM = """
        proc optmodel;
            var x >= 0;
            con c1 : x <= 10;
            max obj = x;
        quit;
        """;

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @BeforeEach
    void captureOutput() {
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void render_withOutputDirectory_writesProgramFile() throws IOException {
        Path definition = writeDefinition("basic.yaml", BASIC_MODEL);
        Path outputDir = tempDir.resolve("out");

        int exitCode = OptModelerCLI.commandLine().execute(
            "-q", "render", definition.toString(), "-o", outputDir.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("basic.sas"))).isEqualTo(EXPECTED_PROGRAM);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("✓ Rendered basic.sas");
    }

    @Test
    void render_withoutOutputDirectory_printsProgram() throws IOException {
        Path definition = writeDefinition("basic.yaml", BASIC_MODEL);

        int exitCode = OptModelerCLI.commandLine().execute(
            "-q", "render", definition.toString(), "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(EXPECTED_PROGRAM);
    }

    @Test
    void render_withConfig_appliesIndentAndExtension() throws IOException {
        Path definition = writeDefinition("basic.yaml", BASIC_MODEL);
        Path config = writeDefinition("optmodeler.yaml", """
            render:
              indent: "  "
            output:
              extension: "txt"
            """);
        Path outputDir = tempDir.resolve("out");

        int exitCode = OptModelerCLI.commandLine().execute(
            "-q", "render", definition.toString(), "-o", outputDir.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("basic.txt"))).contains("\n  var x >= 0;\n");
    }

    @Test
    void render_missingDefinition_returnsError() {
        int exitCode = OptModelerCLI.commandLine().execute(
            "-q", "render", tempDir.resolve("missing.yaml").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("✗ Render failed:");
    }

    @Test
    void render_unknownGenerator_returnsError() throws IOException {
        Path definition = writeDefinition("basic.yaml", BASIC_MODEL);

        int exitCode = OptModelerCLI.commandLine().execute(
            "-q", "render", definition.toString(), "-g", "ampl");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("Code generator not found: ampl");
    }

    @Test
    void validate_validDefinition_reportsCounts() throws IOException {
        Path definition = writeDefinition("basic.yaml", BASIC_MODEL);

        int exitCode = OptModelerCLI.commandLine().execute("-q", "validate", definition.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8))
            .contains("✓ Model 'basic' is valid: 1 declaration(s), 2 statement(s)");
    }

    @Test
    void validate_unknownVariable_returnsError() throws IOException {
        Path definition = writeDefinition("broken.yaml", """
            name: broken
            constraints:
              - name: c
                terms: [{ variable: ghost }]
                sense: "<="
                rhs: 1
            """);

        int exitCode = OptModelerCLI.commandLine().execute("-q", "validate", definition.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).contains("ghost");
    }

    @Test
    void findGenerator_unknownId_throwsException() {
        assertThatThrownBy(() -> RenderCommand.findGenerator("nope"))
            .isInstanceOf(IllegalStateException.class);
    }

    private Path writeDefinition(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content);
        return file;
    }
}
