package com.optmodeler.core.session;

import java.util.List;

/**
 * Outcome of merging solver values into a container.
 *
 * @param applied rows that updated a value slot
 * @param unmatched rows whose name or key matched nothing
 */
public record IngestionReport(List<ValueRow> applied, List<ValueRow> unmatched) {

    public IngestionReport {
        applied = applied == null ? List.of() : List.copyOf(applied);
        unmatched = unmatched == null ? List.of() : List.copyOf(unmatched);
    }

    public boolean isComplete() {
        return unmatched.isEmpty();
    }
}
