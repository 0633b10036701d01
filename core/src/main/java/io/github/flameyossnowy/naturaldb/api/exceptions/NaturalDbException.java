package io.github.flameyossnowy.naturaldb.api.exceptions;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Root of every error raised by the storage layers.
 */
public class NaturalDbException extends RuntimeException {
    private final ErrorCode errorCode;

    private @Nullable String table;
    private @Nullable String recordId;
    private @Nullable String path;

    public NaturalDbException(@NotNull ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public NaturalDbException(@NotNull ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public @NotNull ErrorCode getErrorCode() {
        return errorCode;
    }

    public @Nullable String getTable() {
        return table;
    }

    public @Nullable String getRecordId() {
        return recordId;
    }

    public @Nullable String getPath() {
        return path;
    }

    public NaturalDbException withTable(@Nullable String table) {
        this.table = table;
        return this;
    }

    public NaturalDbException withRecordId(@Nullable String recordId) {
        this.recordId = recordId;
        return this;
    }

    public NaturalDbException withPath(@Nullable String path) {
        this.path = path;
        return this;
    }

    @Override
    public String getMessage() {
        StringBuilder builder = new StringBuilder()
            .append('[').append(errorCode.code()).append(' ').append(errorCode.name()).append("] ")
            .append(super.getMessage());
        if (table != null) builder.append(" (table=").append(table).append(')');
        if (recordId != null) builder.append(" (record=").append(recordId).append(')');
        if (path != null) builder.append(" (path=").append(path).append(')');
        return builder.toString();
    }
}
