package io.tupledb.datastore;

import io.tupledb.common.ObjectAndRelation;
import io.tupledb.storage.Column;
import io.tupledb.storage.Condition;

import java.util.Objects;

/**
 * One optional constraint of a {@link TupleQuery}.
 */
public sealed interface TupleFilter permits TupleFilter.ObjectId, TupleFilter.Relation, TupleFilter.Subject {

    Condition toCondition();

    record ObjectId(String objectId) implements TupleFilter {

        public ObjectId {
            Objects.requireNonNull(objectId, "objectId cannot be null");
        }

        @Override
        public Condition toCondition() {
            return Condition.eq(Column.OBJECT_ID, objectId);
        }
    }

    record Relation(String relation) implements TupleFilter {

        public Relation {
            Objects.requireNonNull(relation, "relation cannot be null");
        }

        @Override
        public Condition toCondition() {
            return Condition.eq(Column.RELATION, relation);
        }
    }

    /**
     * Matches on all three subject fields at once.
     */
    record Subject(ObjectAndRelation subject) implements TupleFilter {

        public Subject {
            Objects.requireNonNull(subject, "subject cannot be null");
        }

        @Override
        public Condition toCondition() {
            return Condition.and(
                Condition.eq(Column.USERSET_NAMESPACE, subject.namespace()),
                Condition.eq(Column.USERSET_OBJECT_ID, subject.objectId()),
                Condition.eq(Column.USERSET_RELATION, subject.relation())
            );
        }
    }
}
