package com.optmodeler.core.session;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.generator.CodeGenerator;
import com.optmodeler.core.generator.GeneratedProgram;
import com.optmodeler.core.generator.GeneratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Renders a container, sends the text through a {@link SolverSession} and ingests the
 * returned values. Session failures propagate unchanged; there are no retries.
 */
public class ModelSubmitter {

    private static final Logger log = LoggerFactory.getLogger(ModelSubmitter.class);

    private final SolverSession session;
    private final CodeGenerator generator;
    private final GeneratorConfig config;
    private final ResultIngestor ingestor;

    public ModelSubmitter(SolverSession session, CodeGenerator generator, GeneratorConfig config) {
        this(session, generator, config, new ResultIngestor());
    }

    public ModelSubmitter(SolverSession session, CodeGenerator generator, GeneratorConfig config,
                          ResultIngestor ingestor) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.config = config != null ? config : GeneratorConfig.defaults();
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor must not be null");
    }

    public SubmissionResult submit(Container container) {
        GeneratedProgram program = generator.generate(container, config);
        log.info("Submitting '{}' ({} chars)", program.name(), program.content().length());
        return ingest(container, program, session.submit(program.content()));
    }

    /**
     * Submits and waits at most {@code timeout} for the answer.
     *
     * @param container container to render and submit
     * @param timeout maximum time to wait
     * @return submission result
     * @throws SolverTimeoutException if the solver does not answer in time
     */
    public SubmissionResult submit(Container container, Duration timeout) {
        GeneratedProgram program = generator.generate(container, config);
        log.info("Submitting '{}' with timeout {}", program.name(), timeout);
        return ingest(container, program, session.submitAndWait(program.content(), timeout));
    }

    private SubmissionResult ingest(Container container, GeneratedProgram program, ResponseTable response) {
        if (response == null) {
            throw new SolverSessionException("Solver session returned no response for '" + program.name() + "'");
        }
        log.debug("Solver status for '{}': {}", program.name(), response.status());
        IngestionReport report = ingestor.ingest(container, response.toValueRows());
        return new SubmissionResult(program, response, report);
    }
}
