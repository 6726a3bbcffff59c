package io.tupledb.datastore;

import io.tupledb.common.Revision;
import io.tupledb.storage.Column;
import io.tupledb.storage.Condition;

import java.util.Objects;

/**
 * Point-in-time visibility over the soft-deleted tuple table: a row is visible at
 * revision {@code R} when it was created at or before {@code R} and was either never
 * deleted or deleted after {@code R}.
 */
public final class VisibilityPredicate {

    private VisibilityPredicate() {}

    public static Condition asOf(Revision revision) {
        Objects.requireNonNull(revision, "revision cannot be null");
        return Condition.and(
            Condition.ltOrEq(Column.CREATED_TXN, revision),
            Condition.or(
                Condition.eq(Column.DELETED_TXN, Revision.LIVE),
                Condition.gt(Column.DELETED_TXN, revision)
            )
        );
    }
}
