package com.optmodeler.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of a scalar parameter or a parameter group.
 *
 * @param name parameter name
 * @param type {@code num} or {@code str}; null means {@code num}
 * @param over names of the sets indexing the group; empty for a scalar
 * @param init initial value, a number or a string
 * @param values per-member values keyed by the member key written as {@code a,1}
 */
public record ParameterDefinition(
    String name,
    String type,
    List<String> over,
    Object init,
    Map<String, Object> values
) {
    public ParameterDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (over == null) {
            over = List.of();
        }
        if (values == null) {
            values = Map.of();
        }
    }
}
