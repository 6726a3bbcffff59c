package io.tupledb.datastore;

public enum LeakPolicy {
    LOG,
    FAIL
}
