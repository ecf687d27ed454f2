package com.optmodeler.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a variable or variable group.
 *
 * @param name variable name
 * @param type {@code continuous}, {@code integer} or {@code binary}; null means continuous
 * @param lb lower bound, null for the type default
 * @param ub upper bound, null for the type default
 * @param init initial value, null for none
 * @param over set names or inline element lists indexing the group; empty for a scalar
 */
public record VariableDefinition(
    String name,
    String type,
    Double lb,
    Double ub,
    Double init,
    List<Object> over
) {
    public VariableDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (over == null) {
            over = List.of();
        }
    }
}
