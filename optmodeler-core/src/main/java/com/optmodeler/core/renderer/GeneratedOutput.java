package com.optmodeler.core.renderer;

import com.optmodeler.core.generator.GeneratedProgram;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Collection of files produced by a generation run.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /** Content type of SAS program files. */
    public static final String SAS_CONTENT_TYPE = "text/x-sas";

    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Wraps programs as files named {@code <name>.<extension>}.
     *
     * @param programs generated programs
     * @return output with one file per program
     */
    public static GeneratedOutput of(GeneratedProgram... programs) {
        return new GeneratedOutput(Arrays.stream(programs)
                .map(p -> new GeneratedFile(p.name() + "." + p.fileExtension(), p.content(), SAS_CONTENT_TYPE))
                .collect(Collectors.toList()));
    }
}
