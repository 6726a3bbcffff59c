package io.tupledb.storage;

/**
 * A read-only view of the tuple table pinned when the transaction began.
 * It performs no writes, so it is only ever rolled back.
 */
public interface ReadTransaction extends AutoCloseable {

    RowCursor run(SelectQuery query);

    /**
     * Releases the transaction. Calling it more than once has no effect.
     */
    void rollback();

    @Override
    default void close() {
        rollback();
    }
}
