package com.optmodeler.core.statement;

import com.optmodeler.core.entity.Entity;
import com.optmodeler.core.entity.OptSet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Loads a solver-side table into sets and parameters:
 * {@code read data prices into PRODUCTS=[product] price cost=unit_cost;}.
 *
 * @param table source table name
 * @param keySet set receiving the key columns, null when reading scalars
 * @param keyColumns key column names
 * @param columns value columns
 */
public record ReadDataStatement(String table, OptSet keySet, List<String> keyColumns, List<Column> columns)
        implements Statement {

    public ReadDataStatement {
        Objects.requireNonNull(table, "table must not be null");
        keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (keySet != null && keyColumns.size() != keySet.getArity()) {
            throw new IllegalArgumentException("Set '" + keySet.getName() + "' needs " + keySet.getArity()
                    + " key column(s), got " + keyColumns.size());
        }
    }

    public static Builder from(String table) {
        return new Builder(table);
    }

    @Override
    public String getName() {
        return null;
    }

    @Override
    public Set<Entity> getDependencies() {
        Set<Entity> out = new LinkedHashSet<>();
        if (keySet != null) {
            out.add(keySet);
        }
        columns.forEach(c -> out.add(c.target()));
        return out;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReadData(this);
    }

    /**
     * Value column read into a parameter.
     *
     * @param target parameter or parameter group receiving the values
     * @param column source column, null when it is named after the target
     */
    public record Column(Entity target, String column) {

        public Column {
            Objects.requireNonNull(target, "target must not be null");
        }
    }

    /**
     * Fluent builder for read statements.
     */
    public static final class Builder {

        private final String table;
        private OptSet keySet;
        private final List<String> keyColumns = new ArrayList<>();
        private final List<Column> columns = new ArrayList<>();

        private Builder(String table) {
            this.table = table;
        }

        public Builder into(OptSet keySet, String... keyColumns) {
            this.keySet = keySet;
            this.keyColumns.clear();
            this.keyColumns.addAll(List.of(keyColumns));
            return this;
        }

        public Builder column(Entity target) {
            columns.add(new Column(target, null));
            return this;
        }

        public Builder column(Entity target, String column) {
            columns.add(new Column(target, column));
            return this;
        }

        public ReadDataStatement build() {
            return new ReadDataStatement(table, keySet, keyColumns, columns);
        }
    }
}
