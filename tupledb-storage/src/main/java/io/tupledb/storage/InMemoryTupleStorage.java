package io.tupledb.storage;

import io.tupledb.common.RelationTuple;
import io.tupledb.common.Revision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.StampedLock;

/**
 * Append-only tuple table held in memory. Rows keep their arrival order and are
 * only ever appended or soft-deleted. Each read transaction works on a copy of the
 * row list taken when it began, so concurrent writes never show through.
 */
public final class InMemoryTupleStorage implements TupleStorage {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTupleStorage.class);

    private final List<Row> rows;
    private final StampedLock rowsLock;
    private final AtomicBoolean closed;
    private final AtomicInteger openTransactions;

    public InMemoryTupleStorage() {
        this.rows = new ArrayList<>();
        this.rowsLock = new StampedLock();
        this.closed = new AtomicBoolean(false);
        this.openTransactions = new AtomicInteger(0);
    }

    /**
     * Appends a live row for {@code tuple}.
     *
     * @return false if a live row for the same tuple already exists
     */
    public boolean insert(RelationTuple tuple, Revision createdAt) {
        Objects.requireNonNull(tuple, "tuple cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        ensureOpen();

        long stamp = rowsLock.writeLock();
        try {
            for (Row row : rows) {
                if (row.isLive() && row.holds(tuple)) {
                    return false;
                }
            }
            rows.add(Row.live(tuple, createdAt));
            return true;
        } finally {
            rowsLock.unlockWrite(stamp);
        }
    }

    /**
     * Appends a row as given, damaged columns included.
     */
    public void insertRow(Row row) {
        Objects.requireNonNull(row, "row cannot be null");
        ensureOpen();

        long stamp = rowsLock.writeLock();
        try {
            rows.add(row);
        } finally {
            rowsLock.unlockWrite(stamp);
        }
    }

    /**
     * Soft-deletes the live row for {@code tuple} by stamping its deletion revision.
     *
     * @return false if no live row for the tuple exists
     */
    public boolean delete(RelationTuple tuple, Revision deletedAt) {
        Objects.requireNonNull(tuple, "tuple cannot be null");
        Objects.requireNonNull(deletedAt, "deletedAt cannot be null");
        if (deletedAt.isLive()) {
            throw new IllegalArgumentException("deletedAt cannot be the live sentinel");
        }
        ensureOpen();

        long stamp = rowsLock.writeLock();
        try {
            for (int i = 0; i < rows.size(); i++) {
                Row row = rows.get(i);
                if (row.isLive() && row.holds(tuple)) {
                    if (!deletedAt.isAfter(row.createdAt())) {
                        throw new IllegalArgumentException(
                            "deletedAt %s must be after createdAt %s".formatted(deletedAt, row.createdAt())
                        );
                    }
                    rows.set(i, row.withDeletedAt(deletedAt));
                    return true;
                }
            }
            return false;
        } finally {
            rowsLock.unlockWrite(stamp);
        }
    }

    public int rowCount() {
        long stamp = rowsLock.tryOptimisticRead();
        int count = rows.size();
        if (!rowsLock.validate(stamp)) {
            stamp = rowsLock.readLock();
            try {
                count = rows.size();
            } finally {
                rowsLock.unlockRead(stamp);
            }
        }
        return count;
    }

    public int openTransactionCount() {
        return openTransactions.get();
    }

    @Override
    public ReadTransaction beginReadTransaction() {
        ensureOpen();

        List<Row> snapshot;
        long stamp = rowsLock.readLock();
        try {
            snapshot = List.copyOf(rows);
        } finally {
            rowsLock.unlockRead(stamp);
        }

        openTransactions.incrementAndGet();
        return new SnapshotTransaction(snapshot);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int open = openTransactions.get();
        if (open > 0) {
            log.warn("Closing tuple storage with {} read transactions still open", open);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new StorageException.Closed("tuple storage is closed");
        }
    }

    private final class SnapshotTransaction implements ReadTransaction {

        private final List<Row> snapshot;
        private final AtomicBoolean rolledBack;

        SnapshotTransaction(List<Row> snapshot) {
            this.snapshot = snapshot;
            this.rolledBack = new AtomicBoolean(false);
        }

        @Override
        public RowCursor run(SelectQuery query) {
            Objects.requireNonNull(query, "query cannot be null");
            if (rolledBack.get()) {
                throw new StorageException.Closed("transaction already rolled back");
            }
            if (!TUPLE_TABLE.equals(query.table())) {
                throw new StorageException.InvalidQuery("unknown table: " + query.table());
            }
            SqlStatement statement = query.toSql();
            log.debug("Running {} over {} rows", statement, snapshot.size());
            return new FilteringCursor(snapshot.iterator(), query, rolledBack);
        }

        @Override
        public void rollback() {
            if (rolledBack.compareAndSet(false, true)) {
                openTransactions.decrementAndGet();
            }
        }
    }

    private static final class FilteringCursor implements RowCursor {

        private final Iterator<Row> source;
        private final SelectQuery query;
        private final AtomicBoolean rolledBack;
        private Row next;
        private boolean closed;

        FilteringCursor(Iterator<Row> source, SelectQuery query, AtomicBoolean rolledBack) {
            this.source = source;
            this.query = query;
            this.rolledBack = rolledBack;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (closed) {
                return false;
            }
            if (rolledBack.get()) {
                throw new StorageException.Closed("transaction rolled back while reading");
            }
            while (source.hasNext()) {
                Row candidate = source.next();
                if (query.matches(candidate)) {
                    next = candidate;
                    return true;
                }
            }
            return false;
        }

        @Override
        public Row next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Row result = next;
            next = null;
            return result;
        }

        @Override
        public void close() {
            closed = true;
            next = null;
        }
    }
}
