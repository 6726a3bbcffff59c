package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.storage.SqlStatement;

import java.lang.ref.Reference;
import java.util.Optional;

abstract class AbstractTupleIterator implements TupleIterator {

    private final SqlStatement statement;
    private final IteratorLeakDetector.Registration registration;
    private boolean closed;
    private DatastoreException lastError;

    AbstractTupleIterator(IteratorLeakDetector leakDetector, SqlStatement statement, Runnable release) {
        this.statement = statement;
        this.registration = leakDetector.register(this, statement, release);
    }

    @Override
    public final Optional<RelationTuple> next() {
        if (closed) {
            lastError = new DatastoreException.IteratorClosed();
            return Optional.empty();
        }
        return fetchNext();
    }

    protected abstract Optional<RelationTuple> fetchNext();

    protected abstract void discardRemaining();

    protected final void recordError(DatastoreException error) {
        lastError = error;
    }

    @Override
    public final Optional<DatastoreException> lastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public final void close() {
        if (closed) {
            throw new IteratorLifecycleError("tuple iterator double closed\n sql: " + statement);
        }
        closed = true;
        discardRemaining();
        registration.close();
        Reference.reachabilityFence(this);
    }

    final boolean isClosed() {
        return closed;
    }

    final IteratorLeakDetector.Registration registration() {
        return registration;
    }
}
