package com.optmodeler.core.renderer.impl;

import com.optmodeler.core.renderer.GeneratedFile;
import com.optmodeler.core.renderer.GeneratedOutput;
import com.optmodeler.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream buffer;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withHeaders_printsCommentHeaderAndSeparator() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.sas", "solve;\n", GeneratedOutput.SAS_CONTENT_TYPE),
            new GeneratedFile("b.sas", "quit;\n", GeneratedOutput.SAS_CONTENT_TYPE)));

        renderer.render(output, new RenderContext(".", Map.of()));

        String nl = System.lineSeparator();
        assertThat(printed()).isEqualTo("/* a.sas */" + nl + "solve;\n---" + nl + "/* b.sas */" + nl + "quit;\n");
    }

    @Test
    void render_withoutHeaders_printsContentOnly() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.sas", "proc optmodel;\nquit;\n", GeneratedOutput.SAS_CONTENT_TYPE)));

        renderer.render(output, RenderContext.plainConsole());

        assertThat(printed()).isEqualTo("proc optmodel;\nquit;\n");
    }

    @Test
    void render_customSeparator_isPrintedBetweenPrograms() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.sas", "solve;\n", GeneratedOutput.SAS_CONTENT_TYPE),
            new GeneratedFile("b.sas", "quit;\n", GeneratedOutput.SAS_CONTENT_TYPE)));

        renderer.render(output, new RenderContext(".",
            Map.of(RenderContext.SHOW_HEADERS, "false", RenderContext.SEPARATOR, "/* next */")));

        assertThat(printed()).isEqualTo("solve;\n/* next */" + System.lineSeparator() + "quit;\n");
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
