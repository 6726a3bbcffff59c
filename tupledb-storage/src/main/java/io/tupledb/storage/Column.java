package io.tupledb.storage;

import io.tupledb.common.Revision;

import java.util.function.Function;

public enum Column {
    NAMESPACE("namespace", String.class, Row::namespace),
    OBJECT_ID("object_id", String.class, Row::objectId),
    RELATION("relation", String.class, Row::relation),
    USERSET_NAMESPACE("userset_namespace", String.class, Row::usersetNamespace),
    USERSET_OBJECT_ID("userset_object_id", String.class, Row::usersetObjectId),
    USERSET_RELATION("userset_relation", String.class, Row::usersetRelation),
    CREATED_TXN("created_transaction", Revision.class, Row::createdAt),
    DELETED_TXN("deleted_transaction", Revision.class, Row::deletedAt);

    private final String sqlName;
    private final Class<?> type;
    private final Function<Row, Object> reader;

    Column(String sqlName, Class<?> type, Function<Row, Object> reader) {
        this.sqlName = sqlName;
        this.type = type;
        this.reader = reader;
    }

    public String sqlName() {
        return sqlName;
    }

    public Class<?> type() {
        return type;
    }

    public Object read(Row row) {
        return reader.apply(row);
    }
}
