package com.optmodeler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OptModelerCLI}.
 */
class OptModelerCLITest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    void captureOutput() {
        stdout = new ByteArrayOutputStream();
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void execute_withoutArguments_printsBanner() {
        int exitCode = OptModelerCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(printed()).contains("OptModeler - PROC OPTMODEL program builder");
    }

    @Test
    void execute_quiet_printsNothing() {
        int exitCode = OptModelerCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(printed()).isEmpty();
    }

    @Test
    void execute_version_printsVersion() {
        int exitCode = OptModelerCLI.commandLine().execute("--version");

        assertThat(exitCode).isZero();
        assertThat(printed()).contains("OptModeler 1.0.0-SNAPSHOT");
    }

    @Test
    void execute_unknownSubcommand_returnsUsageError() {
        int exitCode = OptModelerCLI.commandLine().execute("optimize");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void listGenerators_printsOptmodelGenerator() {
        int exitCode = OptModelerCLI.commandLine().execute("list", "generators");

        assertThat(exitCode).isZero();
        assertThat(printed()).contains("(ID: optmodel)", "File Extension: .sas");
    }

    @Test
    void listRenderers_printsConsoleAndFilesystem() {
        int exitCode = OptModelerCLI.commandLine().execute("list", "renderers");

        assertThat(exitCode).isZero();
        assertThat(printed()).contains("console", "filesystem");
    }

    @Test
    void listFunctions_printsSolverNames() {
        int exitCode = OptModelerCLI.commandLine().execute("list", "functions");

        assertThat(exitCode).isZero();
        assertThat(printed()).contains("sqrt");
    }

    @Test
    void listUnknownType_returnsError() {
        int exitCode = OptModelerCLI.commandLine().execute("list", "solvers");

        assertThat(exitCode).isEqualTo(1);
    }

    private String printed() {
        return stdout.toString(StandardCharsets.UTF_8);
    }
}
