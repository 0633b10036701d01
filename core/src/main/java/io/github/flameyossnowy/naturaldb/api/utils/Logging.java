package io.github.flameyossnowy.naturaldb.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Static logging switchboard used across NaturalDB.
 *
 * <p>{@link #ENABLED} gates informational output and the per-operation trace messages of
 * {@link #deepInfo(Supplier)}. Warnings are always forwarded to SLF4J.</p>
 */
public final class Logging {
    public static volatile boolean ENABLED = false;

    private static final Logger LOGGER = LoggerFactory.getLogger("NaturalDB");

    private Logging() {}

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) {
            LOGGER.info(message);
        }
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }
}
