package io.github.flameyossnowy.naturaldb.api.exceptions;

import java.time.Duration;

public class LockTimeoutException extends NaturalDbException {
    public LockTimeoutException(String path, Duration timeout) {
        super(ErrorCode.LOCK_TIMEOUT, "Timed out after " + timeout.toMillis() + "ms waiting for lock");
        withPath(path);
    }
}
