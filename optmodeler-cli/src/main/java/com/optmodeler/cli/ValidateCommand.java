package com.optmodeler.cli;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.definition.DefinitionLoader;
import com.optmodeler.core.definition.ModelAssembler;
import com.optmodeler.core.exception.ModelingException;
import com.optmodeler.core.generator.GeneratorConfig;
import com.optmodeler.core.model.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to build a model definition and report structural errors without writing output.
 */
@Command(
    name = "validate",
    description = "Build a model definition and report structural errors",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Model definition (YAML or JSON)")
    private Path definitionFile;

    @Override
    public Integer call() {
        log.info("Validating model definition: {}", definitionFile);
        try {
            ModelDefinition definition = DefinitionLoader.load(definitionFile);
            Model model = new ModelAssembler().assemble(definition);
            // rendering runs the generator's own consistency checks
            RenderCommand.findGenerator("optmodel").generate(model, GeneratorConfig.defaults());
            System.out.printf("✓ Model '%s' is valid: %d declaration(s), %d statement(s)%n",
                model.getName(), model.getEntities().size(), model.getStatements().size());
            return 0;
        } catch (ModelingException e) {
            log.debug("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Validation failed", e);
            System.err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
