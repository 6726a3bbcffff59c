package io.tupledb.datastore;

import io.tupledb.common.ObjectAndRelation;
import io.tupledb.common.Revision;
import io.tupledb.storage.Column;
import io.tupledb.storage.Condition;
import io.tupledb.storage.SelectQuery;
import io.tupledb.storage.TupleStorage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable description of a tuple read: one resource namespace as of one
 * revision, narrowed by any number of {@link TupleFilter}s combined with AND.
 * <p>
 * Every {@code with*} method returns a new query and leaves the receiver untouched,
 * so a base query can be shared and refined in several directions. Adding a filter
 * that is already present returns an equal query.
 */
public final class TupleQuery {

    private static final Column[] TUPLE_COLUMNS = {
        Column.NAMESPACE,
        Column.OBJECT_ID,
        Column.RELATION,
        Column.USERSET_NAMESPACE,
        Column.USERSET_OBJECT_ID,
        Column.USERSET_RELATION
    };

    private final String namespace;
    private final Revision revision;
    private final List<TupleFilter> filters;

    private TupleQuery(String namespace, Revision revision, List<TupleFilter> filters) {
        this.namespace = namespace;
        this.revision = revision;
        this.filters = filters;
    }

    public static TupleQuery forNamespace(String namespace, Revision asOfRevision) {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(asOfRevision, "asOfRevision cannot be null");
        if (asOfRevision.isLive()) {
            throw new IllegalArgumentException("asOfRevision cannot be the live sentinel");
        }
        return new TupleQuery(namespace, asOfRevision, List.of());
    }

    public TupleQuery withObjectId(String objectId) {
        return with(new TupleFilter.ObjectId(objectId));
    }

    public TupleQuery withRelation(String relation) {
        return with(new TupleFilter.Relation(relation));
    }

    public TupleQuery withSubject(String subjectNamespace, String subjectObjectId, String subjectRelation) {
        return withSubject(ObjectAndRelation.of(subjectNamespace, subjectObjectId, subjectRelation));
    }

    public TupleQuery withSubject(ObjectAndRelation subject) {
        return with(new TupleFilter.Subject(subject));
    }

    private TupleQuery with(TupleFilter filter) {
        if (filters.contains(filter)) {
            return this;
        }
        List<TupleFilter> updated = new ArrayList<>(filters.size() + 1);
        updated.addAll(filters);
        updated.add(filter);
        return new TupleQuery(namespace, revision, List.copyOf(updated));
    }

    public String namespace() {
        return namespace;
    }

    public Revision revision() {
        return revision;
    }

    public List<TupleFilter> filters() {
        return filters;
    }

    /**
     * Translates this query into a storage request over the tuple table, with the
     * visibility predicate for {@link #revision()} always applied.
     */
    public SelectQuery compile() {
        SelectQuery select = SelectQuery.select(TUPLE_COLUMNS)
            .from(TupleStorage.TUPLE_TABLE)
            .where(Condition.eq(Column.NAMESPACE, namespace));
        for (TupleFilter filter : filters) {
            select = select.where(filter.toCondition());
        }
        return select.where(VisibilityPredicate.asOf(revision));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TupleQuery other
            && namespace.equals(other.namespace)
            && revision.equals(other.revision)
            && filters.equals(other.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, revision, filters);
    }

    @Override
    public String toString() {
        return "TupleQuery[namespace=" + namespace + ", revision=" + revision + ", filters=" + filters + "]";
    }
}
