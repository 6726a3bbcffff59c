package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Sequential, caller-owned view over the result of one query.
 * <p>
 * An iterator is open until {@link #close()} is called and must be closed exactly once,
 * preferably with try-with-resources. Closing twice throws {@link IteratorLifecycleError};
 * an iterator that is dropped while open is reported by the datastore's leak detection.
 * Iterators are not thread-safe.
 */
public interface TupleIterator extends AutoCloseable {

    /**
     * Returns the next tuple in storage order, or empty when the result is exhausted.
     * On a closed iterator this returns empty and records
     * {@link DatastoreException.IteratorClosed} in {@link #lastError()}.
     */
    Optional<RelationTuple> next();

    Optional<DatastoreException> lastError();

    @Override
    void close();

    /**
     * A sequential stream over the remaining tuples. Closing the stream closes this
     * iterator. The stream ends quietly on error; check {@link #lastError()}.
     */
    default Stream<RelationTuple> stream() {
        Iterator<RelationTuple> iterator = new Iterator<>() {
            private boolean fetched;
            private Optional<RelationTuple> pending = Optional.empty();

            @Override
            public boolean hasNext() {
                if (!fetched) {
                    pending = TupleIterator.this.next();
                    fetched = true;
                }
                return pending.isPresent();
            }

            @Override
            public RelationTuple next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                fetched = false;
                return pending.get();
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false)
            .onClose(this::close);
    }
}
