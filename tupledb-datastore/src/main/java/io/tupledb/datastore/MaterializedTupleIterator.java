package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.storage.SqlStatement;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

final class MaterializedTupleIterator extends AbstractTupleIterator {

    private final Deque<RelationTuple> remaining;

    MaterializedTupleIterator(List<RelationTuple> tuples, IteratorLeakDetector leakDetector, SqlStatement statement) {
        super(leakDetector, statement, () -> {});
        this.remaining = new ArrayDeque<>(tuples);
    }

    @Override
    protected Optional<RelationTuple> fetchNext() {
        return Optional.ofNullable(remaining.pollFirst());
    }

    @Override
    protected void discardRemaining() {
        remaining.clear();
    }
}
