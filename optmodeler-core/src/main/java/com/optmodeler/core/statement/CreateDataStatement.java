package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Dependencies;
import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.SetIterator;
import com.optmodeler.core.expression.Expression;
import com.optmodeler.core.expression.Operand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Writes solver-side values to a table:
 * {@code create data solution from [i]={i in I} x=x[i];}.
 *
 * @param table target table name
 * @param keys iterators forming the key columns, empty for a single-row table
 * @param columns output columns
 */
public record CreateDataStatement(String table, List<SetIterator> keys, List<Column> columns) implements Statement {

    public CreateDataStatement {
        Objects.requireNonNull(table, "table must not be null");
        keys = keys == null ? List.of() : List.copyOf(keys);
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("create data needs at least one column");
        }
        columns = List.copyOf(columns);
    }

    public static Builder to(String table) {
        return new Builder(table);
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        Dependencies.addIterators(keys, out);
        columns.forEach(c -> Dependencies.addTo(c.expression(), out));
        return out;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCreateData(this);
    }

    /**
     * Output column.
     *
     * @param name column name, null to let the solver derive it
     * @param expression column value
     */
    public record Column(String name, Expression expression) {

        public Column {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    /**
     * Fluent builder for create statements.
     */
    public static final class Builder {

        private final String table;
        private final List<SetIterator> keys = new ArrayList<>();
        private final List<Column> columns = new ArrayList<>();

        private Builder(String table) {
            this.table = table;
        }

        public Builder keys(SetIterator... iterators) {
            keys.addAll(Arrays.asList(iterators));
            return this;
        }

        public Builder column(Operand value) {
            columns.add(new Column(null, value.toExpression()));
            return this;
        }

        public Builder column(String name, Operand value) {
            columns.add(new Column(name, value.toExpression()));
            return this;
        }

        public CreateDataStatement build() {
            return new CreateDataStatement(table, keys, columns);
        }
    }
}
