package com.optmodeler.core.session;

import com.optmodeler.core.container.Container;
import com.optmodeler.core.container.Model;
import com.optmodeler.core.container.Workspace;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.ImplicitVariable;
import com.optmodeler.core.entity.Parameter;
import com.optmodeler.core.entity.ParameterGroup;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.entity.VariableGroup;
import com.optmodeler.core.entity.VariableMember;
import com.optmodeler.core.statement.Constraint;
import com.optmodeler.core.statement.ConstraintGroup;
import com.optmodeler.core.statement.Objective;
import com.optmodeler.core.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges solver values into the value slots of a container's entities.
 *
 * <p>Rows name entities the way they were rendered. Inside a workspace, names of sub-model
 * entities carry the {@code <model>_} prefix and are resolved back to the sub-model.
 * Variables receive primal values, constraints receive duals and objectives their value.
 * Rows that match nothing are reported and logged, never fatal.
 */
public class ResultIngestor {

    private static final Logger log = LoggerFactory.getLogger(ResultIngestor.class);

    /**
     * Applies value rows to a container.
     *
     * @param container model or workspace that was rendered
     * @param rows solver values
     * @return applied and unmatched rows
     */
    public IngestionReport ingest(Container container, List<ValueRow> rows) {
        List<ValueRow> applied = new ArrayList<>();
        List<ValueRow> unmatched = new ArrayList<>();
        for (ValueRow row : rows) {
            if (apply(container, row.entityName(), row) || applyPrefixed(container, row)) {
                applied.add(row);
            } else {
                log.warn("No match for solver value {}{} = {} in '{}'",
                        row.entityName(), row.key().isEmpty() ? "" : row.key(), row.value(), container.getName());
                unmatched.add(row);
            }
        }
        log.info("Ingested {} value(s) into '{}', {} unmatched", applied.size(), container.getName(), unmatched.size());
        return new IngestionReport(applied, unmatched);
    }

    private boolean applyPrefixed(Container container, ValueRow row) {
        if (!(container instanceof Workspace workspace)) {
            return false;
        }
        for (Model model : workspace.getModels()) {
            String prefix = model.getName() + "_";
            if (row.entityName().startsWith(prefix)
                    && apply(model, row.entityName().substring(prefix.length()), row)) {
                return true;
            }
        }
        return false;
    }

    private boolean apply(Container container, String name, ValueRow row) {
        Entity entity = container.getEntity(name);
        if (entity != null) {
            return applyToEntity(entity, row);
        }
        Statement statement = container.getStatement(name);
        if (statement != null) {
            return applyToStatement(statement, row);
        }
        return applyToGroupMember(container, name, row);
    }

    private boolean applyToEntity(Entity entity, ValueRow row) {
        boolean scalar = row.key().isEmpty();
        if (entity instanceof Variable variable && scalar) {
            variable.assignValue(row.value());
            return true;
        }
        if (entity instanceof VariableGroup group && !scalar) {
            VariableMember member = group.find(row.key());
            if (member == null) {
                return false;
            }
            member.assignValue(row.value());
            return true;
        }
        if (entity instanceof Parameter parameter && scalar) {
            parameter.assignValue(row.value());
            return true;
        }
        if (entity instanceof ParameterGroup group && !scalar) {
            return group.assignValue(row.key(), row.value());
        }
        if (entity instanceof ImplicitVariable implicit && row.key().arity() == implicit.getArity()) {
            implicit.assignValue(row.key(), row.value());
            return true;
        }
        return false;
    }

    private boolean applyToStatement(Statement statement, ValueRow row) {
        if (!row.key().isEmpty()) {
            return false;
        }
        if (statement instanceof Constraint constraint) {
            constraint.assignDual(row.value());
            return true;
        }
        if (statement instanceof Objective objective) {
            objective.assignValue(row.value());
            return true;
        }
        return false;
    }

    private boolean applyToGroupMember(Container container, String name, ValueRow row) {
        if (!row.key().isEmpty()) {
            return false;
        }
        for (Statement statement : container.getStatements()) {
            if (statement instanceof ConstraintGroup group && !group.isAbstract()) {
                for (Constraint member : group.getMembers().values()) {
                    if (member.getName().equals(name)) {
                        member.assignDual(row.value());
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
