package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.common.Revision;
import io.tupledb.storage.Column;
import io.tupledb.storage.InMemoryTupleStorage;
import io.tupledb.storage.Row;
import io.tupledb.storage.SelectQuery;
import io.tupledb.storage.SqlStatement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class VisibilityPredicateTest {

    private static final long R = 10;
    private static final RelationTuple TUPLE = RelationTuple.parse("doc:1#viewer@user:alice");

    static Stream<Arguments> createdAndDeletedAroundRevision() {
        List<Arguments> cases = new ArrayList<>();
        for (long created : new long[]{R - 1, R, R + 1}) {
            for (Revision deleted : new Revision[]{Revision.LIVE, Revision.of(R), Revision.of(R + 1)}) {
                boolean visible = created <= R && (deleted.isLive() || deleted.isAfter(Revision.of(R)));
                cases.add(Arguments.of(created, deleted, visible));
            }
        }
        return cases.stream();
    }

    @ParameterizedTest(name = "created={0}, deleted={1} -> visible={2}")
    @MethodSource("createdAndDeletedAroundRevision")
    void conditionMatchesVisibilityRule(long created, Revision deleted, boolean visible) {
        Row row = Row.live(TUPLE, Revision.of(created)).withDeletedAt(deleted);

        assertThat(VisibilityPredicate.asOf(Revision.of(R)).test(row)).isEqualTo(visible);
    }

    @ParameterizedTest(name = "created={0}, deleted={1} -> returned={2}")
    @MethodSource("createdAndDeletedAroundRevision")
    void datastoreReturnsOnlyVisibleRows(long created, Revision deleted, boolean visible) {
        InMemoryTupleStorage storage = new InMemoryTupleStorage();
        storage.insertRow(Row.live(TUPLE, Revision.of(created)).withDeletedAt(deleted));

        try (TupleDatastore datastore = TupleDatastore.open(storage)) {
            List<RelationTuple> found = new ArrayList<>();
            datastore.forEachTuple(datastore.queryTuples("doc", Revision.of(R)), found::add);

            if (visible) {
                assertThat(found).containsExactly(TUPLE);
            } else {
                assertThat(found).isEmpty();
            }
        }
    }

    @Test
    void rowDeletedAtRevisionIsAlreadyGone() {
        Row row = Row.live(TUPLE, Revision.of(R - 1)).withDeletedAt(Revision.of(R));

        assertThat(VisibilityPredicate.asOf(Revision.of(R)).test(row)).isFalse();
        assertThat(VisibilityPredicate.asOf(Revision.of(R - 1)).test(row)).isTrue();
    }

    @Test
    void rendersAsCreatedBoundAndDeletionAlternative() {
        SqlStatement statement = SelectQuery
            .select(Column.NAMESPACE)
            .from("relation_tuple")
            .where(VisibilityPredicate.asOf(Revision.of(R)))
            .toSql();

        assertThat(statement.sql()).endsWith(
            "WHERE (created_transaction <= ? AND (deleted_transaction = ? OR deleted_transaction > ?))"
        );
        assertThat(statement.args()).containsExactly(Revision.of(R), Revision.LIVE, Revision.of(R));
    }
}
