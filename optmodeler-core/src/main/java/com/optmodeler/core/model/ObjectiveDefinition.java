package com.optmodeler.core.model;

import java.util.List;

/**
 * Declarative linear objective.
 *
 * @param name objective name, null to synthesize
 * @param sense {@code min} or {@code max}
 * @param terms objective terms
 * @param constant constant offset
 */
public record ObjectiveDefinition(
    String name,
    String sense,
    List<TermDefinition> terms,
    Double constant
) {
    public ObjectiveDefinition {
        if (sense == null) {
            sense = "min";
        }
        if (terms == null) {
            terms = List.of();
        }
        if (constant == null) {
            constant = 0.0;
        }
    }
}
