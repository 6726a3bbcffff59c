package io.tupledb.common;

import java.util.Objects;

/**
 * One fact: the relation {@code resourceRelation} of resource
 * {@code resourceNamespace:resourceObjectId} includes the given subject.
 * An empty {@code subjectRelation} denotes the subject object itself.
 */
public record RelationTuple(
    String resourceNamespace,
    String resourceObjectId,
    String resourceRelation,
    String subjectNamespace,
    String subjectObjectId,
    String subjectRelation
) {

    public RelationTuple {
        Objects.requireNonNull(resourceNamespace, "resourceNamespace cannot be null");
        Objects.requireNonNull(resourceObjectId, "resourceObjectId cannot be null");
        Objects.requireNonNull(resourceRelation, "resourceRelation cannot be null");
        Objects.requireNonNull(subjectNamespace, "subjectNamespace cannot be null");
        Objects.requireNonNull(subjectObjectId, "subjectObjectId cannot be null");
        Objects.requireNonNull(subjectRelation, "subjectRelation cannot be null");
    }

    public static RelationTuple of(ObjectAndRelation resource, ObjectAndRelation subject) {
        return new RelationTuple(
            resource.namespace(),
            resource.objectId(),
            resource.relation(),
            subject.namespace(),
            subject.objectId(),
            subject.relation()
        );
    }

    /**
     * Parses the {@code ns:id#rel@ns:id[#rel]} form produced by {@link #toString()}.
     */
    public static RelationTuple parse(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        int at = text.indexOf('@');
        if (at < 0) {
            throw new IllegalArgumentException("Missing '@' in tuple '" + text + "'");
        }
        ObjectAndRelation resource = ObjectAndRelation.parse(text.substring(0, at));
        if (resource.relation().isEmpty()) {
            throw new IllegalArgumentException("Missing resource relation in tuple '" + text + "'");
        }
        return of(resource, ObjectAndRelation.parse(text.substring(at + 1)));
    }

    public ObjectAndRelation resource() {
        return new ObjectAndRelation(resourceNamespace, resourceObjectId, resourceRelation);
    }

    public ObjectAndRelation subject() {
        return new ObjectAndRelation(subjectNamespace, subjectObjectId, subjectRelation);
    }

    @Override
    public String toString() {
        return resource() + "@" + subject();
    }
}
