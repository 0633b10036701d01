package io.github.flameyossnowy.naturaldb.api.exceptions;

/**
 * Numeric error codes grouped in families: general 1000, storage 1100, table 1200,
 * record 1300, lock 1400, io 1500, data 1700.
 */
public enum ErrorCode {
    INVALID_IDENTIFIER(1001),
    OPERATION_REJECTED(1002),

    MISSING_PARENT_DIRECTORY(1101),

    TABLE_NOT_FOUND(1200),

    RECORD_NOT_FOUND(1300),
    RECORD_CORRUPTED(1301),

    LOCK_TIMEOUT(1400),

    IO_FAILURE(1500),

    INVALID_DATA(1700);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
