package io.tupledb.datastore;

import io.tupledb.storage.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Detects {@link TupleIterator}s that become unreachable without being closed.
 * <p>
 * Each iterator registers on creation. When the collector finds an unclosed one, the
 * registration's resources are released, the leak is logged with the query that produced
 * the iterator. Under {@link LeakPolicy#FAIL} it is also queued, and the queued leaks are
 * raised as an {@link IteratorLifecycleError} by the next {@link #checkForLeaks()}.
 */
final class IteratorLeakDetector {

    private static final Logger log = LoggerFactory.getLogger(IteratorLeakDetector.class);

    private static final Cleaner CLEANER = Cleaner.create();

    private final LeakPolicy policy;
    private final Queue<SqlStatement> pendingLeaks;
    private final AtomicLong leakCount;

    IteratorLeakDetector(LeakPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.pendingLeaks = new ConcurrentLinkedQueue<>();
        this.leakCount = new AtomicLong(0);
    }

    /**
     * @param release frees whatever the iterator holds; runs exactly once, on close or on leak
     */
    Registration register(Object iterator, SqlStatement statement, Runnable release) {
        LeakAction action = new LeakAction(this, statement, release);
        return new Registration(action, CLEANER.register(iterator, action));
    }

    void checkForLeaks() {
        if (policy != LeakPolicy.FAIL || pendingLeaks.isEmpty()) {
            return;
        }
        List<SqlStatement> leaked = new ArrayList<>();
        SqlStatement statement;
        while ((statement = pendingLeaks.poll()) != null) {
            leaked.add(statement);
        }
        if (leaked.isEmpty()) {
            return;
        }
        SqlStatement first = leaked.get(0);
        throw new IteratorLifecycleError(
            "%d tuple iterator(s) garbage collected before close() was called%n sql: %s%n args: %s"
                .formatted(leaked.size(), first.sql(), first.args())
        );
    }

    long leakCount() {
        return leakCount.get();
    }

    int pendingLeakCount() {
        return pendingLeaks.size();
    }

    private void reportLeak(SqlStatement statement) {
        leakCount.incrementAndGet();
        if (policy == LeakPolicy.FAIL) {
            pendingLeaks.add(statement);
        }
        log.atError()
            .addKeyValue("sql", statement.sql())
            .addKeyValue("args", statement.args())
            .log("Tuple iterator garbage collected before close() was called");
    }

    static final class Registration {

        private final LeakAction action;
        private final Cleaner.Cleanable cleanable;

        private Registration(LeakAction action, Cleaner.Cleanable cleanable) {
            this.action = action;
            this.cleanable = cleanable;
        }

        /**
         * Marks the iterator closed and releases its resources.
         */
        void close() {
            action.closed.set(true);
            cleanable.clean();
        }

        /**
         * Runs the cleanup the collector would run, as if the iterator had just become unreachable.
         */
        void clean() {
            cleanable.clean();
        }
    }

    private static final class LeakAction implements Runnable {

        private final IteratorLeakDetector detector;
        private final SqlStatement statement;
        private final Runnable release;
        private final AtomicBoolean closed;

        LeakAction(IteratorLeakDetector detector, SqlStatement statement, Runnable release) {
            this.detector = detector;
            this.statement = statement;
            this.release = release;
            this.closed = new AtomicBoolean(false);
        }

        @Override
        public void run() {
            try {
                release.run();
            } finally {
                if (!closed.get()) {
                    detector.reportLeak(statement);
                }
            }
        }
    }
}
