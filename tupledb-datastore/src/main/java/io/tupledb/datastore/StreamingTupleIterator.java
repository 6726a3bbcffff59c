package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.storage.ReadTransaction;
import io.tupledb.storage.RowCursor;
import io.tupledb.storage.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decodes rows on demand from a cursor that stays bound to its read transaction.
 * The transaction is released as soon as the cursor is drained, fails, or the
 * iterator is closed. A failure part way through ends iteration and is reported
 * through {@link #lastError()}; tuples already returned stay valid.
 */
final class StreamingTupleIterator extends AbstractTupleIterator {

    private static final Logger log = LoggerFactory.getLogger(StreamingTupleIterator.class);

    private final CursorResources resources;
    private boolean finished;

    private StreamingTupleIterator(CursorResources resources, IteratorLeakDetector leakDetector, SqlStatement statement) {
        super(leakDetector, statement, resources::release);
        this.resources = resources;
    }

    static StreamingTupleIterator open(
        ReadTransaction transaction,
        RowCursor cursor,
        IteratorLeakDetector leakDetector,
        SqlStatement statement
    ) {
        return new StreamingTupleIterator(new CursorResources(transaction, cursor), leakDetector, statement);
    }

    @Override
    protected Optional<RelationTuple> fetchNext() {
        if (finished) {
            return Optional.empty();
        }
        try {
            if (resources.cursor.hasNext()) {
                return Optional.of(RowDecoder.decode(resources.cursor.next()));
            }
        } catch (RuntimeException e) {
            recordError(new DatastoreException.QueryFailed(e));
        }
        finished = true;
        resources.release();
        return Optional.empty();
    }

    @Override
    protected void discardRemaining() {
        finished = true;
    }

    private static final class CursorResources {

        private final ReadTransaction transaction;
        private final RowCursor cursor;
        private final AtomicBoolean released;

        CursorResources(ReadTransaction transaction, RowCursor cursor) {
            this.transaction = transaction;
            this.cursor = cursor;
            this.released = new AtomicBoolean(false);
        }

        void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                cursor.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close row cursor", e);
            } finally {
                try {
                    transaction.rollback();
                } catch (RuntimeException e) {
                    log.warn("Failed to roll back read transaction", e);
                }
            }
        }
    }
}
