package io.tupledb.storage;

import io.tupledb.common.RelationTuple;
import io.tupledb.common.Revision;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryTupleStorageTest {

    private static final SelectQuery ALL = SelectQuery
        .select(Column.values())
        .from(TupleStorage.TUPLE_TABLE);

    private static RelationTuple tuple(String text) {
        return RelationTuple.parse(text);
    }

    private static List<Row> readAll(ReadTransaction tx, SelectQuery query) {
        List<Row> rows = new ArrayList<>();
        try (RowCursor cursor = tx.run(query)) {
            cursor.forEachRemaining(rows::add);
        }
        return rows;
    }

    @Nested
    class Writes {

        @Test
        void insertAppendsLiveRow() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                assertThat(storage.insert(tuple("doc:1#viewer@user:alice"), Revision.of(3))).isTrue();

                try (ReadTransaction tx = storage.beginReadTransaction()) {
                    List<Row> rows = readAll(tx, ALL);

                    assertThat(rows).hasSize(1);
                    assertThat(rows.get(0).createdAt()).isEqualTo(Revision.of(3));
                    assertThat(rows.get(0).isLive()).isTrue();
                }
            }
        }

        @Test
        void insertRejectsDuplicateLiveTuple() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:1#viewer@user:alice"), Revision.of(3));

                assertThat(storage.insert(tuple("doc:1#viewer@user:alice"), Revision.of(4))).isFalse();
                assertThat(storage.rowCount()).isEqualTo(1);
            }
        }

        @Test
        void deleteStampsRevisionAndKeepsRow() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:1#viewer@user:alice"), Revision.of(3));

                assertThat(storage.delete(tuple("doc:1#viewer@user:alice"), Revision.of(9))).isTrue();

                try (ReadTransaction tx = storage.beginReadTransaction()) {
                    List<Row> rows = readAll(tx, ALL);
                    assertThat(rows).singleElement()
                        .satisfies(row -> assertThat(row.deletedAt()).isEqualTo(Revision.of(9)));
                }
            }
        }

        @Test
        void reinsertAfterDeleteAddsSecondRow() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                RelationTuple t = tuple("doc:1#viewer@user:alice");
                storage.insert(t, Revision.of(3));
                storage.delete(t, Revision.of(5));

                assertThat(storage.insert(t, Revision.of(7))).isTrue();
                assertThat(storage.rowCount()).isEqualTo(2);
            }
        }

        @Test
        void deleteOfMissingTupleReturnsFalse() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                assertThat(storage.delete(tuple("doc:1#viewer@user:alice"), Revision.of(9))).isFalse();
            }
        }

        @Test
        void deleteMustFollowCreation() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:1#viewer@user:alice"), Revision.of(5));

                assertThatThrownBy(() -> storage.delete(tuple("doc:1#viewer@user:alice"), Revision.of(5)))
                    .isInstanceOf(IllegalArgumentException.class);
                assertThatThrownBy(() -> storage.delete(tuple("doc:1#viewer@user:alice"), Revision.LIVE))
                    .isInstanceOf(IllegalArgumentException.class);
            }
        }
    }

    @Nested
    class Reads {

        @Test
        void rowsArriveInInsertionOrder() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:3#viewer@user:c"), Revision.of(1));
                storage.insert(tuple("doc:1#viewer@user:a"), Revision.of(2));
                storage.insert(tuple("doc:2#viewer@user:b"), Revision.of(3));

                try (ReadTransaction tx = storage.beginReadTransaction()) {
                    assertThat(readAll(tx, ALL))
                        .extracting(Row::objectId)
                        .containsExactly("3", "1", "2");
                }
            }
        }

        @Test
        void runFiltersByConditions() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:1#viewer@user:a"), Revision.of(1));
                storage.insert(tuple("doc:1#editor@user:a"), Revision.of(2));
                storage.insert(tuple("folder:1#viewer@user:a"), Revision.of(3));

                SelectQuery query = ALL
                    .where(Condition.eq(Column.NAMESPACE, "doc"))
                    .where(Condition.eq(Column.RELATION, "viewer"));

                try (ReadTransaction tx = storage.beginReadTransaction()) {
                    assertThat(readAll(tx, query)).hasSize(1);
                }
            }
        }

        @Test
        void transactionDoesNotSeeLaterWrites() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:1#viewer@user:a"), Revision.of(1));

                try (ReadTransaction tx = storage.beginReadTransaction()) {
                    storage.insert(tuple("doc:2#viewer@user:b"), Revision.of(2));
                    storage.delete(tuple("doc:1#viewer@user:a"), Revision.of(3));

                    List<Row> rows = readAll(tx, ALL);
                    assertThat(rows).hasSize(1);
                    assertThat(rows.get(0).isLive()).isTrue();
                }
            }
        }

        @Test
        void runRejectsUnknownTable() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage();
                 ReadTransaction tx = storage.beginReadTransaction()) {
                assertThatThrownBy(() -> tx.run(SelectQuery.select(Column.NAMESPACE).from("namespace_config")))
                    .isInstanceOf(StorageException.InvalidQuery.class);
            }
        }

        @Test
        void runPropagatesCompilationFailure() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage();
                 ReadTransaction tx = storage.beginReadTransaction()) {
                assertThatThrownBy(() -> tx.run(ALL.where(Condition.eq(Column.NAMESPACE, null))))
                    .isInstanceOf(StorageException.InvalidQuery.class);
            }
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void rollbackIsIdempotentAndTracked() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                ReadTransaction tx = storage.beginReadTransaction();
                assertThat(storage.openTransactionCount()).isEqualTo(1);

                tx.rollback();
                tx.rollback();

                assertThat(storage.openTransactionCount()).isZero();
            }
        }

        @Test
        void runAfterRollbackFails() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                ReadTransaction tx = storage.beginReadTransaction();
                tx.rollback();

                assertThatThrownBy(() -> tx.run(ALL))
                    .isInstanceOf(StorageException.Closed.class);
            }
        }

        @Test
        void cursorFailsOnceTransactionIsRolledBack() {
            try (InMemoryTupleStorage storage = new InMemoryTupleStorage()) {
                storage.insert(tuple("doc:1#viewer@user:a"), Revision.of(1));
                ReadTransaction tx = storage.beginReadTransaction();
                RowCursor cursor = tx.run(ALL);

                tx.rollback();

                assertThatThrownBy(cursor::hasNext)
                    .isInstanceOf(StorageException.Closed.class);
            }
        }

        @Test
        void closedStorageRejectsTransactions() {
            InMemoryTupleStorage storage = new InMemoryTupleStorage();
            storage.close();

            assertThatThrownBy(storage::beginReadTransaction)
                .isInstanceOf(StorageException.Closed.class)
                .hasMessageContaining("closed");
        }
    }
}
