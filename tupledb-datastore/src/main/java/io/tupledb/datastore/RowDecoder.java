package io.tupledb.datastore;

import io.tupledb.common.RelationTuple;
import io.tupledb.storage.Column;
import io.tupledb.storage.Row;

final class RowDecoder {

    private RowDecoder() {}

    static RelationTuple decode(Row row) {
        return new RelationTuple(
            required(row, Column.NAMESPACE),
            required(row, Column.OBJECT_ID),
            required(row, Column.RELATION),
            required(row, Column.USERSET_NAMESPACE),
            required(row, Column.USERSET_OBJECT_ID),
            required(row, Column.USERSET_RELATION)
        );
    }

    private static String required(Row row, Column column) {
        Object value = column.read(row);
        if (value == null) {
            throw new DatastoreException.MalformedRow("missing value for column " + column.sqlName());
        }
        return (String) value;
    }
}
