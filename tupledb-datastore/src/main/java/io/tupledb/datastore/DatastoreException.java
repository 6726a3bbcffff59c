package io.tupledb.datastore;

public sealed class DatastoreException extends RuntimeException
    permits DatastoreException.QueryFailed,
            DatastoreException.MalformedRow,
            DatastoreException.IteratorClosed {

    public DatastoreException(String message) {
        super(message);
    }

    public DatastoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class QueryFailed extends DatastoreException {
        public QueryFailed(Throwable cause) {
            super("unable to query tuples: " + cause.getMessage(), cause);
        }
    }

    public static final class MalformedRow extends DatastoreException {
        public MalformedRow(String message) {
            super(message);
        }
    }

    public static final class IteratorClosed extends DatastoreException {
        public IteratorClosed() {
            super("unable to iterate: iterator closed");
        }
    }
}
