package io.github.flameyossnowy.naturaldb.file;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings of one {@link NaturalDB} instance.
 *
 * @param baseDirectory root under which every user directory lives
 * @param prettyPrint whether record files are written indented
 * @param indent spaces per nesting level when pretty printing
 * @param maxNameLength identifiers are truncated to this many characters
 * @param lockTimeout how long to wait for a path lock, or {@code null} to wait indefinitely
 */
public record StoreConfig(@NotNull Path baseDirectory, boolean prettyPrint, int indent, int maxNameLength,
                          @Nullable Duration lockTimeout) {
    public static final String DATA_PATH_PROPERTY = "naturaldb.data.path";
    public static final String DATA_PATH_ENV = "NATURALDB_DATA_PATH";
    public static final String DEFAULT_DATA_PATH = "./data";

    public StoreConfig {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        if (maxNameLength <= 0) {
            throw new IllegalArgumentException("maxNameLength must be positive: " + maxNameLength);
        }
        if (lockTimeout != null && lockTimeout.isNegative()) {
            throw new IllegalArgumentException("lockTimeout must not be negative: " + lockTimeout);
        }
    }

    /** Indent used for record files: {@link #indent()} when pretty printing, else compact. */
    public int recordIndent() {
        return prettyPrint ? indent : 0;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    /**
     * Defaults with the base directory taken from the {@value #DATA_PATH_PROPERTY} system
     * property, then the {@value #DATA_PATH_ENV} environment variable, then
     * {@value #DEFAULT_DATA_PATH}.
     */
    public static @NotNull StoreConfig fromEnvironment() {
        return builder().baseDirectory(resolveDataPath()).build();
    }

    static @NotNull Path resolveDataPath() {
        String property = System.getProperty(DATA_PATH_PROPERTY);
        if (property != null && !property.isBlank()) {
            return Path.of(property);
        }
        String env = System.getenv(DATA_PATH_ENV);
        if (env != null && !env.isBlank()) {
            return Path.of(env);
        }
        return Path.of(DEFAULT_DATA_PATH);
    }

    public static class Builder {
        private Path baseDirectory = Path.of(DEFAULT_DATA_PATH);
        private boolean prettyPrint = true;
        private int indent = 2;
        private int maxNameLength = 80;
        private Duration lockTimeout;

        Builder() {}

        /**
         * Sets the root directory of the store.
         *
         * @param baseDirectory the directory, created on first use
         * @return this builder
         */
        public Builder baseDirectory(@NotNull Path baseDirectory) {
            this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory cannot be null");
            return this;
        }

        /**
         * Whether record files are indented. The default is {@code true}.
         *
         * @param prettyPrint true to indent
         * @return this builder
         */
        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public Builder indent(int indent) {
            this.indent = indent;
            return this;
        }

        /**
         * Maximum length of a sanitized identifier. The default is 80.
         *
         * @param maxNameLength the limit, must be positive
         * @return this builder
         */
        public Builder maxNameLength(int maxNameLength) {
            this.maxNameLength = maxNameLength;
            return this;
        }

        /**
         * Bounds the wait for a path lock. Without a timeout threads wait indefinitely.
         *
         * @param lockTimeout the bound, or null for none
         * @return this builder
         */
        public Builder lockTimeout(@Nullable Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public StoreConfig build() {
            return new StoreConfig(baseDirectory, prettyPrint, indent, maxNameLength, lockTimeout);
        }
    }
}
