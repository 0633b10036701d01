package io.github.flameyossnowy.naturaldb.api.exceptions;

public class StorageException extends NaturalDbException {
    public StorageException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public StorageException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
