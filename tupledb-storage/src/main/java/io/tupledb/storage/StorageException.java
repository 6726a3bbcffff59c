package io.tupledb.storage;

public sealed class StorageException extends RuntimeException
    permits StorageException.Closed,
            StorageException.InvalidQuery {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class Closed extends StorageException {
        public Closed(String message) {
            super(message);
        }
    }

    public static final class InvalidQuery extends StorageException {
        public InvalidQuery(String message) {
            super(message);
        }
    }
}
