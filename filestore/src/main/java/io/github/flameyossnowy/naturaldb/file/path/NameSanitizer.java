package io.github.flameyossnowy.naturaldb.file.path;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns user supplied identifiers into safe path segments.
 *
 * <p>Only ASCII letters, digits, space, underscore and hyphen survive; everything else,
 * including path separators and dots, is stripped. The result is then cut to the maximum
 * length. Both changes are logged but never fail. The transform is pure, so sanitizing an
 * already sanitized name returns it unchanged.</p>
 */
public final class NameSanitizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(NameSanitizer.class);

    public static final int DEFAULT_MAX_LENGTH = 80;

    private final int maxLength;

    public NameSanitizer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public NameSanitizer(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int maxLength() {
        return maxLength;
    }

    public @NotNull String sanitize(@NotNull String name) {
        StringBuilder builder = new StringBuilder(Math.min(name.length(), maxLength));
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (isAllowed(c)) {
                builder.append(c);
            }
        }
        String sanitized = builder.toString();
        if (!sanitized.equals(name)) {
            LOGGER.warn("Identifier '{}' contained invalid characters and was sanitized to '{}'", name, sanitized);
        }
        if (sanitized.length() > maxLength) {
            String truncated = sanitized.substring(0, maxLength);
            LOGGER.warn("Identifier '{}' exceeded {} characters and was truncated to '{}'", sanitized, maxLength, truncated);
            return truncated;
        }
        return sanitized;
    }

    public static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || c == ' ' || c == '_' || c == '-';
    }
}
