package io.tupledb.storage;

import io.tupledb.common.RelationTuple;
import io.tupledb.common.Revision;

import java.util.Objects;

/**
 * A stored tuple row. The six tuple columns may be null when the row is damaged;
 * the revision columns are always present, with {@link Revision#LIVE} marking a
 * row that has not been deleted.
 */
public record Row(
    String namespace,
    String objectId,
    String relation,
    String usersetNamespace,
    String usersetObjectId,
    String usersetRelation,
    Revision createdAt,
    Revision deletedAt
) {

    public Row {
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(deletedAt, "deletedAt cannot be null");
        if (createdAt.isLive()) {
            throw new IllegalArgumentException("createdAt cannot be the live sentinel");
        }
    }

    public static Row live(RelationTuple tuple, Revision createdAt) {
        return new Row(
            tuple.resourceNamespace(),
            tuple.resourceObjectId(),
            tuple.resourceRelation(),
            tuple.subjectNamespace(),
            tuple.subjectObjectId(),
            tuple.subjectRelation(),
            createdAt,
            Revision.LIVE
        );
    }

    public boolean isLive() {
        return deletedAt.isLive();
    }

    public Row withDeletedAt(Revision revision) {
        return new Row(
            namespace, objectId, relation,
            usersetNamespace, usersetObjectId, usersetRelation,
            createdAt, revision
        );
    }

    boolean holds(RelationTuple tuple) {
        return tuple.resourceNamespace().equals(namespace)
            && tuple.resourceObjectId().equals(objectId)
            && tuple.resourceRelation().equals(relation)
            && tuple.subjectNamespace().equals(usersetNamespace)
            && tuple.subjectObjectId().equals(usersetObjectId)
            && tuple.subjectRelation().equals(usersetRelation);
    }
}
