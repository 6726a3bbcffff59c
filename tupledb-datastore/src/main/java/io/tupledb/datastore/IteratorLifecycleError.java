package io.tupledb.datastore;

/**
 * A broken {@link TupleIterator} contract: a second {@code close()}, or an iterator
 * that became unreachable while still open. Not meant to be caught.
 */
public final class IteratorLifecycleError extends Error {

    public IteratorLifecycleError(String message) {
        super(message);
    }
}
