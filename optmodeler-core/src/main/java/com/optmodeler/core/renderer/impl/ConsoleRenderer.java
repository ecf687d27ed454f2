package com.optmodeler.core.renderer.impl;

import com.optmodeler.core.renderer.GeneratedFile;
import com.optmodeler.core.renderer.GeneratedOutput;
import com.optmodeler.core.renderer.OutputRenderer;
import com.optmodeler.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints generated programs to a console stream.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - print a header line before each program ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - separator between programs (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";
    private static final String HEADER_PREFIX = "/* ";
    private static final String HEADER_SUFFIX = " */";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault(RenderContext.SHOW_HEADERS, "true"));
        String separator = context.getSettingOrDefault(RenderContext.SEPARATOR, DEFAULT_SEPARATOR);

        logger.info("Rendering {} program(s) to console", output.files().size());

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                out.println(HEADER_PREFIX + file.relativePath() + HEADER_SUFFIX);
            }
            out.print(file.content());
            if (i < output.files().size() - 1) {
                out.println(separator);
            }
        }
        out.flush();
    }
}
