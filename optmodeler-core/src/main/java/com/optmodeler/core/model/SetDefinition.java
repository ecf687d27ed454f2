package com.optmodeler.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declarative description of a set, as read from a model definition file.
 *
 * @param name set name
 * @param types element types ({@code num} or {@code str}) per tuple position; defaults to one {@code num}
 * @param values literal members; tuples are given as lists
 */
public record SetDefinition(
    String name,
    List<String> types,
    List<Object> values
) {
    public SetDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (types == null) {
            types = List.of();
        }
        if (values == null) {
            values = List.of();
        }
    }
}
