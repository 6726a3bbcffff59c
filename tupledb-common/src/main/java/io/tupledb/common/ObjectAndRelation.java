package io.tupledb.common;

import java.util.Objects;

public record ObjectAndRelation(String namespace, String objectId, String relation) {

    public ObjectAndRelation {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(objectId, "objectId cannot be null");
        Objects.requireNonNull(relation, "relation cannot be null");
    }

    public static ObjectAndRelation of(String namespace, String objectId, String relation) {
        return new ObjectAndRelation(namespace, objectId, relation);
    }

    /**
     * A bare object reference with no sub-relation.
     */
    public static ObjectAndRelation object(String namespace, String objectId) {
        return new ObjectAndRelation(namespace, objectId, "");
    }

    static ObjectAndRelation parse(String text) {
        int colon = text.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Missing namespace in '" + text + "'");
        }
        int hash = text.indexOf('#', colon);
        String namespace = text.substring(0, colon);
        if (hash < 0) {
            return object(namespace, text.substring(colon + 1));
        }
        return new ObjectAndRelation(namespace, text.substring(colon + 1, hash), text.substring(hash + 1));
    }

    @Override
    public String toString() {
        String ref = namespace + ":" + objectId;
        return relation.isEmpty() ? ref : ref + "#" + relation;
    }
}
