package com.optmodeler.core.renderer;

/**
 * Interface for renderers that deliver generated programs to a destination.
 *
 * <p>Renderers take the {@link GeneratedOutput} produced from one or more containers and
 * write it somewhere: the console, a directory, or any other sink.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         Path dir = Paths.get(context.outputDirectory());
 *         for (GeneratedFile file : output.files()) {
 *             Files.writeString(dir.resolve(file.relativePath()), file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.optmodeler.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, such as {@code console} or {@code filesystem}.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output generated programs to deliver
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
