package io.tupledb.storage;

import io.tupledb.common.CloseableIterator;

/**
 * Rows produced by one {@link ReadTransaction#run(SelectQuery)} call, in storage order.
 * {@link #next()} may throw {@link StorageException} if the underlying read fails.
 */
public interface RowCursor extends CloseableIterator<Row> {
}
