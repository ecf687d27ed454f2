package com.optmodeler.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declarative linear constraint: {@code terms sense rhs}, or a range when both
 * {@code lower} and {@code upper} are given.
 *
 * @param name constraint name, null to synthesize
 * @param terms left-hand side terms
 * @param sense {@code <=}, {@code >=} or {@code =}; ignored for ranges
 * @param rhs right-hand side constant
 * @param lower range lower bound
 * @param upper range upper bound
 */
public record ConstraintDefinition(
    String name,
    List<TermDefinition> terms,
    String sense,
    Double rhs,
    Double lower,
    Double upper
) {
    public ConstraintDefinition {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("constraint needs at least one term");
        }
        terms = List.copyOf(terms);
        if (lower == null || upper == null) {
            Objects.requireNonNull(sense, "sense must not be null");
            if (rhs == null) {
                rhs = 0.0;
            }
        }
    }

    public boolean isRange() {
        return lower != null && upper != null;
    }
}
