package teranet.mapdev.listings.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory tabular data set: an ordered list of columns and an ordered list of rows.
 *
 * Each row maps column name to a scalar value (null, String, Long, Double, Boolean or
 * LocalDateTime). A Table never changes after construction; every transformation step
 * builds a new instance from copied rows, so a table handed to a stage is never mutated.
 */
public final class Table {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    /**
     * @param columns column names in output order (must be unique)
     * @param rows    rows keyed by column name; keys outside {@code columns} are ignored,
     *                missing keys are stored as null
     */
    public Table(List<String> columns, List<? extends Map<String, Object>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");

        if (new LinkedHashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }

        this.columns = List.copyOf(columns);

        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> ordered = new LinkedHashMap<>();
            for (String column : this.columns) {
                ordered.put(column, row.get(column));
            }
            copied.add(Collections.unmodifiableMap(ordered));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Object value(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    /**
     * Values of one column in row order (nulls included).
     */
    public List<Object> columnValues(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public ColumnType columnType(String column) {
        return ColumnType.infer(columnValues(column));
    }

    /**
     * Inferred type of every column, in column order.
     */
    public Map<String, ColumnType> schema() {
        Map<String, ColumnType> schema = new LinkedHashMap<>();
        for (String column : columns) {
            schema.put(column, columnType(column));
        }
        return schema;
    }

    /**
     * Mutable deep copy of the rows, for building the next table.
     */
    public List<Map<String, Object>> mutableRows() {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return copy;
    }

    public Table withRows(List<? extends Map<String, Object>> newRows) {
        return new Table(columns, newRows);
    }

    public String shape() {
        return "(" + rowCount() + ", " + columnCount() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table" + shape() + columns;
    }
}
