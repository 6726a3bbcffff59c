package io.tupledb.storage;

import java.util.List;
import java.util.Objects;

public record SqlStatement(String sql, List<Object> args) {

    public SqlStatement {
        Objects.requireNonNull(sql, "sql cannot be null");
        args = List.copyOf(args);
    }

    @Override
    public String toString() {
        return sql + " " + args;
    }
}
