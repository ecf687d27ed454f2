package com.optmodeler.core.session;

import com.optmodeler.core.generator.GeneratedProgram;

import java.util.Objects;

/**
 * Everything produced by one submission.
 *
 * @param program program text that was submitted
 * @param response raw solver response
 * @param report outcome of value ingestion
 */
public record SubmissionResult(GeneratedProgram program, ResponseTable response, IngestionReport report) {

    public SubmissionResult {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }
}
