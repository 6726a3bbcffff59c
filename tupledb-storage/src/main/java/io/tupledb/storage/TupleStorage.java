package io.tupledb.storage;

public interface TupleStorage extends AutoCloseable {

    String TUPLE_TABLE = "relation_tuple";

    ReadTransaction beginReadTransaction();

    @Override
    void close();
}
