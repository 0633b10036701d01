package io.github.flameyossnowy.naturaldb.api.exceptions;

public class ValidationException extends NaturalDbException {
    public ValidationException(String message) {
        super(ErrorCode.INVALID_IDENTIFIER, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
