package com.optmodeler.cli;

import com.optmodeler.core.config.ConfigLoader;
import com.optmodeler.core.config.ModelerConfig;
import com.optmodeler.core.container.Model;
import com.optmodeler.core.definition.DefinitionLoader;
import com.optmodeler.core.definition.ModelAssembler;
import com.optmodeler.core.generator.CodeGenerator;
import com.optmodeler.core.generator.GeneratedProgram;
import com.optmodeler.core.model.ModelDefinition;
import com.optmodeler.core.renderer.GeneratedFile;
import com.optmodeler.core.renderer.GeneratedOutput;
import com.optmodeler.core.renderer.OutputRenderer;
import com.optmodeler.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to render a model definition as a PROC OPTMODEL program.
 *
 * <p>Without {@code --output} the program is printed to the console; with it the program
 * is written to {@code <output>/<model name>.<extension>}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * optmodeler render transport.yaml
 * optmodeler render transport.json -o build/optmodel -c optmodeler.yaml
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a model definition as a PROC OPTMODEL program",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    private static final String CONSOLE_RENDERER = "console";
    private static final String FILESYSTEM_RENDERER = "filesystem";

    @Parameters(index = "0", description = "Model definition (YAML or JSON)")
    private Path definitionFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: optmodeler.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory; prints to the console when absent"
    )
    private Path outputDir;

    @Option(
        names = {"-g", "--generator"},
        description = "Generator ID (default: optmodel)"
    )
    private String generatorId = "optmodel";

    @Override
    public Integer call() {
        try {
            ModelerConfig config = ConfigLoader.load(configPath);
            ModelDefinition definition = DefinitionLoader.load(definitionFile);
            Model model = new ModelAssembler().assemble(definition);

            CodeGenerator generator = findGenerator(generatorId);
            GeneratedProgram program = generator.generate(model, config.toGeneratorConfig());
            log.debug("Generated {} characters with {}", program.content().length(), generator.getId());

            String fileName = program.name() + "." + config.output().extension();
            GeneratedOutput output = new GeneratedOutput(List.of(
                new GeneratedFile(fileName, program.content(), GeneratedOutput.SAS_CONTENT_TYPE)));

            if (outputDir == null) {
                findRenderer(CONSOLE_RENDERER).render(output, RenderContext.plainConsole());
            } else {
                findRenderer(FILESYSTEM_RENDERER).render(output,
                    new RenderContext(outputDir.toAbsolutePath().toString(), Map.of()));
                System.out.println("✓ Rendered " + fileName + " to: " + outputDir.toAbsolutePath());
            }
            return 0;
        } catch (Exception e) {
            log.error("Render failed", e);
            System.err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    static CodeGenerator findGenerator(String id) {
        log.debug("Discovering code generators via ServiceLoader");
        for (CodeGenerator generator : ServiceLoader.load(CodeGenerator.class)) {
            if (generator.getId().equals(id)) {
                return generator;
            }
        }
        throw new IllegalStateException("Code generator not found: " + id);
    }

    static OutputRenderer findRenderer(String id) {
        log.debug("Discovering output renderers via ServiceLoader");
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Output renderer not found: " + id);
    }
}
