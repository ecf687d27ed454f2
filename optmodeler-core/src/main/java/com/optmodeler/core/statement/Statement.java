package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Entity;

import java.util.Set;

/**
 * An ordered item of a container's body: constraints, objectives and solver actions.
 *
 * <p>Statements render in insertion order after all declarations and overrides.
 */
public interface Statement {

    /**
     * Returns the registered name, or null for unnamed actions such as {@code solve;}.
     *
     * @return name or null
     */
    String getName();

    /**
     * Returns the entities this statement refers to.
     *
     * @return referenced entities
     */
    Set<Entity> getDependencies();

    /**
     * Returns other statements this one refers to, such as the objectives named by a solve.
     *
     * @return referenced statements
     */
    default Set<Statement> getStatementDependencies() {
        return Set.of();
    }

    <R> R accept(StatementVisitor<R> visitor);
}
