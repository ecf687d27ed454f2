package com.optmodeler.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A complete linear model described as data, loaded from YAML or JSON by the CLI.
 *
 * @param name model name
 * @param sets set declarations
 * @param parameters parameter declarations
 * @param variables variable declarations
 * @param constraints constraints in rendering order
 * @param objective objective, null for a feasibility model
 * @param solve solve request, null to omit the solve statement
 * @param print names of components to print after solving
 */
public record ModelDefinition(
    String name,
    List<SetDefinition> sets,
    List<ParameterDefinition> parameters,
    List<VariableDefinition> variables,
    List<ConstraintDefinition> constraints,
    ObjectiveDefinition objective,
    SolveDefinition solve,
    List<String> print
) {
    public ModelDefinition {
        Objects.requireNonNull(name, "name must not be null");
        sets = sets == null ? List.of() : List.copyOf(sets);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        variables = variables == null ? List.of() : List.copyOf(variables);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        print = print == null ? List.of() : List.copyOf(print);
    }
}
