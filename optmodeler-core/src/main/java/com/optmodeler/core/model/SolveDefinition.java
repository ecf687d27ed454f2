package com.optmodeler.core.model;

import java.util.Map;

/**
 * Solve request of a definition file.
 *
 * @param solver solver name such as {@code lp} or {@code milp}, null for the default
 * @param options solver options in declaration order
 */
public record SolveDefinition(
    String solver,
    Map<String, Object> options
) {
    public SolveDefinition {
        if (options == null) {
            options = Map.of();
        }
    }
}
