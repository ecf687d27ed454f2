package com.optmodeler.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One weighted variable term of a linear expression in a definition file.
 *
 * @param variable variable or group name
 * @param index member key for groups, empty for scalars
 * @param coefficient multiplier, null means 1
 */
public record TermDefinition(
    String variable,
    List<Object> index,
    Double coefficient
) {
    public TermDefinition {
        Objects.requireNonNull(variable, "variable must not be null");
        if (index == null) {
            index = List.of();
        }
        if (coefficient == null) {
            coefficient = 1.0;
        }
    }
}
