package com.optmodeler.core.generator;

import com.optmodeler.core.container.Container;

/**
 * Interface for generators that turn a model container into solver program text.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI). Generation is
 * deterministic: the same container always yields byte-identical text. Generating a
 * program seals the container against further structural changes.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * CodeGenerator generator = new OptmodelGenerator();
 * GeneratedProgram program = generator.generate(model, GeneratorConfig.defaults());
 * session.submit(program.content());
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.optmodeler.core.generator.CodeGenerator}
 *
 * @see GeneratorConfig
 * @see GeneratedProgram
 */
public interface CodeGenerator {

    /**
     * Returns unique identifier for this generator, such as {@code optmodel}.
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated programs, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates program text for a container and seals it.
     *
     * @param container model or workspace to render
     * @param config formatting settings
     * @return generated program
     * @throws com.optmodeler.core.exception.ModelingException if the container is inconsistent
     */
    GeneratedProgram generate(Container container, GeneratorConfig config);
}
