package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.storage.ReadTransaction;
import io.tupledb.storage.RowCursor;
import io.tupledb.storage.SelectQuery;
import io.tupledb.storage.SqlStatement;
import io.tupledb.storage.TupleStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs {@link TupleQuery}s against a {@link TupleStorage} inside a read transaction.
 * <p>
 * Any failure to open the transaction, compile the query, run it, or decode a row is
 * thrown as {@link DatastoreException.QueryFailed}. Nothing is retried.
 */
final class TupleQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(TupleQueryExecutor.class);

    private final TupleStorage storage;
    private final ExecutionMode mode;
    private final IteratorLeakDetector leakDetector;

    TupleQueryExecutor(TupleStorage storage, ExecutionMode mode, IteratorLeakDetector leakDetector) {
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        this.leakDetector = Objects.requireNonNull(leakDetector, "leakDetector cannot be null");
    }

    TupleIterator execute(TupleQuery query) {
        Objects.requireNonNull(query, "query cannot be null");
        leakDetector.checkForLeaks();

        ReadTransaction transaction;
        try {
            transaction = storage.beginReadTransaction();
        } catch (RuntimeException e) {
            throw new DatastoreException.QueryFailed(e);
        }

        return switch (mode) {
            case MATERIALIZED -> materialize(query, transaction);
            case STREAMING -> stream(query, transaction);
        };
    }

    private TupleIterator materialize(TupleQuery query, ReadTransaction transaction) {
        DatastoreException failure = null;
        try {
            SelectQuery select = query.compile();
            SqlStatement statement = select.toSql();

            List<RelationTuple> tuples = new ArrayList<>();
            try (RowCursor cursor = transaction.run(select)) {
                while (cursor.hasNext()) {
                    tuples.add(RowDecoder.decode(cursor.next()));
                }
            }

            log.debug("Query {} returned {} tuples", statement, tuples.size());
            return new MaterializedTupleIterator(tuples, leakDetector, statement);
        } catch (RuntimeException e) {
            failure = new DatastoreException.QueryFailed(e);
            throw failure;
        } finally {
            rollback(transaction, failure);
        }
    }

    private TupleIterator stream(TupleQuery query, ReadTransaction transaction) {
        try {
            SelectQuery select = query.compile();
            SqlStatement statement = select.toSql();
            RowCursor cursor = transaction.run(select);

            log.debug("Streaming query {}", statement);
            return StreamingTupleIterator.open(transaction, cursor, leakDetector, statement);
        } catch (RuntimeException e) {
            DatastoreException failure = new DatastoreException.QueryFailed(e);
            rollback(transaction, failure);
            throw failure;
        }
    }

    private static void rollback(ReadTransaction transaction, DatastoreException failure) {
        try {
            transaction.rollback();
        } catch (RuntimeException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                log.warn("Failed to roll back read transaction", e);
            }
        }
    }
}
