package com.optmodeler.core.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Tabular answer of a solver session.
 *
 * <p>Value rows are read from a name column ({@code name}, {@code var} or {@code _var_})
 * holding qualified names such as {@code x['a',1]}, and a value column ({@code value} or
 * {@code _value_}).
 *
 * @param columns column names
 * @param rows row cells, one list per row
 * @param status solver status such as {@code OPTIMAL}, may be null
 */
public record ResponseTable(List<String> columns, List<List<Object>> rows, String status) {

    private static final List<String> NAME_COLUMNS = List.of("name", "var", "_var_");
    private static final List<String> VALUE_COLUMNS = List.of("value", "_value_");

    public ResponseTable {
        Objects.requireNonNull(columns, "columns must not be null");
        columns = List.copyOf(columns);
        rows = rows == null ? List.of() : rows.stream()
                .map(row -> Collections.unmodifiableList(new ArrayList<>(row)))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Builds a two-column name/value table.
     *
     * @param values values keyed by qualified name, in row order
     * @param status solver status
     * @return table
     */
    public static ResponseTable ofValues(Map<String, ? extends Number> values, String status) {
        List<List<Object>> rows = new ArrayList<>();
        values.forEach((name, value) -> rows.add(List.of(name, value)));
        return new ResponseTable(List.of("name", "value"), rows, status);
    }

    /**
     * Converts the table into value rows.
     *
     * @return parsed rows
     * @throws IllegalStateException if the table has no name or value column
     */
    public List<ValueRow> toValueRows() {
        int nameColumn = find(NAME_COLUMNS);
        int valueColumn = find(VALUE_COLUMNS);
        List<ValueRow> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Object value = row.get(valueColumn);
            double number = value instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(value));
            values.add(ValueRow.parse(String.valueOf(row.get(nameColumn)), number));
        }
        return values;
    }

    private int find(List<String> candidates) {
        for (int i = 0; i < columns.size(); i++) {
            if (candidates.contains(columns.get(i).toLowerCase(Locale.ROOT))) {
                return i;
            }
        }
        throw new IllegalStateException("Response table has none of the columns " + candidates + ": " + columns);
    }
}
