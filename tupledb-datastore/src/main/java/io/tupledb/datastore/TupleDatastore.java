package io.tupledb.datastore;

import io.tupledb.storage.TupleStorage;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Datastore} over a {@link TupleStorage}, which it owns and closes.
 */
public final class TupleDatastore implements Datastore {

    private final TupleStorage storage;
    private final DatastoreConfig config;
    private final IteratorLeakDetector leakDetector;
    private final TupleQueryExecutor executor;
    private final AtomicBoolean closed;

    private TupleDatastore(TupleStorage storage, DatastoreConfig config) {
        this.storage = storage;
        this.config = config;
        this.leakDetector = new IteratorLeakDetector(config.leakPolicy());
        this.executor = new TupleQueryExecutor(storage, config.executionMode(), leakDetector);
        this.closed = new AtomicBoolean(false);
    }

    public static TupleDatastore open(TupleStorage storage, DatastoreConfig config) {
        Objects.requireNonNull(storage, "storage cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        return new TupleDatastore(storage, config);
    }

    public static TupleDatastore open(TupleStorage storage) {
        return open(storage, DatastoreConfig.defaults());
    }

    @Override
    public TupleIterator execute(TupleQuery query) {
        if (closed.get()) {
            throw new IllegalStateException("datastore is closed");
        }
        return executor.execute(query);
    }

    public DatastoreConfig config() {
        return config;
    }

    long leakCount() {
        return leakDetector.leakCount();
    }

    IteratorLeakDetector leakDetector() {
        return leakDetector;
    }

    /**
     * Closes the underlying storage, then raises any iterator leaks not yet reported.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            storage.close();
        } finally {
            leakDetector.checkForLeaks();
        }
    }
}
