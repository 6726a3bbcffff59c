package io.tupledb.datastore;

import java.util.Objects;

public record DatastoreConfig(
    ExecutionMode executionMode,
    LeakPolicy leakPolicy
) {

    public DatastoreConfig {
        Objects.requireNonNull(executionMode, "executionMode cannot be null");
        Objects.requireNonNull(leakPolicy, "leakPolicy cannot be null");
    }

    public static DatastoreConfig defaults() {
        return new DatastoreConfig(ExecutionMode.MATERIALIZED, LeakPolicy.FAIL);
    }

    public DatastoreConfig withExecutionMode(ExecutionMode executionMode) {
        return new DatastoreConfig(executionMode, leakPolicy);
    }

    public DatastoreConfig withLeakPolicy(LeakPolicy leakPolicy) {
        return new DatastoreConfig(executionMode, leakPolicy);
    }
}
