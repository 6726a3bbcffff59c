package io.tupledb.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A compiled read request: a projection over one table filtered by the conjunction
 * of its conditions. Instances are immutable; {@link #where(Condition)} returns a
 * copy with one more condition.
 */
public final class SelectQuery {

    private final List<Column> columns;
    private final String table;
    private final List<Condition> conditions;

    private SelectQuery(List<Column> columns, String table, List<Condition> conditions) {
        this.columns = columns;
        this.table = table;
        this.conditions = conditions;
    }

    public static SelectQuery select(Column... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("at least one column must be selected");
        }
        return new SelectQuery(List.copyOf(Arrays.asList(columns)), null, List.of());
    }

    public SelectQuery from(String table) {
        Objects.requireNonNull(table, "table cannot be null");
        return new SelectQuery(columns, table, conditions);
    }

    public SelectQuery where(Condition condition) {
        Objects.requireNonNull(condition, "condition cannot be null");
        List<Condition> updated = new ArrayList<>(conditions.size() + 1);
        updated.addAll(conditions);
        updated.add(condition);
        return new SelectQuery(columns, table, List.copyOf(updated));
    }

    public List<Column> columns() {
        return columns;
    }

    public String table() {
        return table;
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean matches(Row row) {
        for (Condition condition : conditions) {
            if (!condition.test(row)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders this query as parameterised SQL.
     *
     * @throws StorageException.InvalidQuery if the table is missing or a condition is malformed
     */
    public SqlStatement toSql() {
        if (table == null || table.isEmpty()) {
            throw new StorageException.InvalidQuery("select requires a table");
        }

        StringBuilder sql = new StringBuilder("SELECT ");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(columns.get(i).sqlName());
        }
        sql.append(" FROM ").append(table);

        List<Object> args = new ArrayList<>();
        for (int i = 0; i < conditions.size(); i++) {
            sql.append(i == 0 ? " WHERE " : " AND ");
            conditions.get(i).render(sql, args);
        }
        return new SqlStatement(sql.toString(), args);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof SelectQuery other
            && columns.equals(other.columns)
            && Objects.equals(table, other.table)
            && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, table, conditions);
    }

    @Override
    public String toString() {
        return "SelectQuery[columns=" + columns + ", table=" + table + ", conditions=" + conditions + "]";
    }
}
