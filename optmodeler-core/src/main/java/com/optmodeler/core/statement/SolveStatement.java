package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Solve request: {@code solve;}, {@code solve with milp;} or
 * {@code solve with lso obj (f1 f2) / maxtime=60;}.
 *
 * @param solver solver name, null for the default
 * @param objectives objectives to optimize, empty for the active one
 * @param options solver options in insertion order
 */
public record SolveStatement(String solver, List<Objective> objectives, Map<String, Object> options) implements Statement {

    public SolveStatement {
        objectives = objectives == null ? List.of() : List.copyOf(objectives);
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
        if (solver != null && solver.isBlank()) {
            solver = null;
        }
    }

    public static SolveStatement defaults() {
        return new SolveStatement(null, List.of(), Map.of());
    }

    public static SolveStatement with(String solver) {
        return new SolveStatement(solver, List.of(), Map.of());
    }

    public SolveStatement withObjectives(Objective... objectives) {
        return new SolveStatement(solver, List.of(objectives), options);
    }

    public SolveStatement withOption(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(options);
        merged.put(key, value);
        return new SolveStatement(solver, objectives, merged);
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        return Set.of();
    }

    @Override
    public Set<Statement> getStatementDependencies() {
        return new LinkedHashSet<>(objectives);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitSolve(this);
    }
}
