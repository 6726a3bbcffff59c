package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.common.Revision;

import java.util.function.Consumer;

/**
 * Read access to relation tuples as of a revision.
 */
public interface Datastore extends AutoCloseable {

    /**
     * Starts a query over {@code namespace} pinned to {@code revision}.
     */
    default TupleQuery queryTuples(String namespace, Revision revision) {
        return TupleQuery.forNamespace(namespace, revision);
    }

    /**
     * Runs {@code query}. The caller owns the returned iterator and must close it.
     *
     * @throws DatastoreException.QueryFailed if the query cannot be run
     */
    TupleIterator execute(TupleQuery query);

    /**
     * Runs {@code query}, hands every tuple to {@code action}, and closes the iterator.
     *
     * @throws DatastoreException.QueryFailed if the query cannot be run or fails part way
     */
    default void forEachTuple(TupleQuery query, Consumer<? super RelationTuple> action) {
        try (TupleIterator iterator = execute(query)) {
            for (var tuple = iterator.next(); tuple.isPresent(); tuple = iterator.next()) {
                action.accept(tuple.get());
            }
            var error = iterator.lastError();
            if (error.isPresent()) {
                throw error.get();
            }
        }
    }

    @Override
    void close();
}
