package io.tupledb.storage;

import io.tupledb.common.Revision;

import java.util.List;
import java.util.Objects;

/**
 * A filter over {@link Row} columns. Conditions evaluate directly against rows and
 * render as parameterised SQL; rendering is where malformed conditions are rejected.
 */
public sealed interface Condition
    permits Condition.Eq, Condition.LtOrEq, Condition.Gt, Condition.And, Condition.Or {

    boolean test(Row row);

    void render(StringBuilder sql, List<Object> args);

    static Condition eq(Column column, Object value) {
        return new Eq(column, value);
    }

    static Condition ltOrEq(Column column, Revision value) {
        return new LtOrEq(column, value);
    }

    static Condition gt(Column column, Revision value) {
        return new Gt(column, value);
    }

    static Condition and(Condition... conditions) {
        return new And(List.of(conditions));
    }

    static Condition or(Condition... conditions) {
        return new Or(List.of(conditions));
    }

    record Eq(Column column, Object value) implements Condition {

        public Eq {
            Objects.requireNonNull(column, "column cannot be null");
        }

        @Override
        public boolean test(Row row) {
            return value != null && value.equals(column.read(row));
        }

        @Override
        public void render(StringBuilder sql, List<Object> args) {
            checkOperand(column, value);
            sql.append(column.sqlName()).append(" = ?");
            args.add(value);
        }
    }

    record LtOrEq(Column column, Revision value) implements Condition {

        public LtOrEq {
            Objects.requireNonNull(column, "column cannot be null");
        }

        @Override
        public boolean test(Row row) {
            return value != null && ((Revision) column.read(row)).isAtOrBefore(value);
        }

        @Override
        public void render(StringBuilder sql, List<Object> args) {
            checkOperand(column, value);
            sql.append(column.sqlName()).append(" <= ?");
            args.add(value);
        }
    }

    record Gt(Column column, Revision value) implements Condition {

        public Gt {
            Objects.requireNonNull(column, "column cannot be null");
        }

        @Override
        public boolean test(Row row) {
            return value != null && ((Revision) column.read(row)).isAfter(value);
        }

        @Override
        public void render(StringBuilder sql, List<Object> args) {
            checkOperand(column, value);
            sql.append(column.sqlName()).append(" > ?");
            args.add(value);
        }
    }

    record And(List<Condition> conditions) implements Condition {

        public And {
            conditions = List.copyOf(conditions);
        }

        @Override
        public boolean test(Row row) {
            for (Condition condition : conditions) {
                if (!condition.test(row)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public void render(StringBuilder sql, List<Object> args) {
            renderJunction(sql, args, conditions, " AND ");
        }
    }

    record Or(List<Condition> conditions) implements Condition {

        public Or {
            conditions = List.copyOf(conditions);
        }

        @Override
        public boolean test(Row row) {
            for (Condition condition : conditions) {
                if (condition.test(row)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public void render(StringBuilder sql, List<Object> args) {
            renderJunction(sql, args, conditions, " OR ");
        }
    }

    private static void checkOperand(Column column, Object value) {
        if (value == null) {
            throw new StorageException.InvalidQuery("null operand for column " + column.sqlName());
        }
        if (!column.type().isInstance(value)) {
            throw new StorageException.InvalidQuery(
                "operand of type %s cannot be compared with column %s"
                    .formatted(value.getClass().getSimpleName(), column.sqlName())
            );
        }
        if (value instanceof Revision revision && revision.isLive() && column != Column.DELETED_TXN) {
            throw new StorageException.InvalidQuery("live sentinel compared with column " + column.sqlName());
        }
    }

    private static void renderJunction(StringBuilder sql, List<Object> args, List<Condition> parts, String operator) {
        if (parts.isEmpty()) {
            throw new StorageException.InvalidQuery("empty" + operator.stripTrailing() + " condition");
        }
        sql.append('(');
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sql.append(operator);
            }
            parts.get(i).render(sql, args);
        }
        sql.append(')');
    }
}
