package io.github.flameyossnowy.naturaldb.file.path;

import io.github.flameyossnowy.naturaldb.api.exceptions.ValidationException;
import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.User;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;

/**
 * Maps the user / database / table / record hierarchy onto paths below the base directory.
 * Every segment passes through the {@link NameSanitizer}.
 *
 * <pre>
 * base/user/db/metadata.json
 * base/user/db/table/metadata.json
 * base/user/db/table/id.json
 * </pre>
 */
public final class StoragePaths {
    public static final String METADATA_NAME = "metadata";
    public static final String METADATA_FILE = METADATA_NAME + ".json";
    public static final String RECORD_EXTENSION = ".json";

    private final Path baseDirectory;
    private final NameSanitizer sanitizer;

    public StoragePaths(@NotNull Path baseDirectory, @NotNull NameSanitizer sanitizer) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
        this.sanitizer = sanitizer;
    }

    public @NotNull Path baseDirectory() {
        return baseDirectory;
    }

    /**
     * Sanitizes one identifier.
     *
     * @throws ValidationException if nothing is left after sanitizing
     */
    public @NotNull String segment(@NotNull String name) {
        String sanitized = sanitizer.sanitize(name);
        if (sanitized.isEmpty()) {
            throw new ValidationException("Identifier '" + name + "' is empty after sanitization");
        }
        return sanitized;
    }

    public @NotNull Path userDirectory(@NotNull User user) {
        return baseDirectory.resolve(segment(user.id()));
    }

    public @NotNull Path databaseDirectory(@NotNull User user, @NotNull Database database) {
        return userDirectory(user).resolve(segment(database.name()));
    }

    public @NotNull Path tableDirectory(@NotNull Path databaseDirectory, @NotNull String table) {
        return databaseDirectory.resolve(segment(table));
    }

    /**
     * @throws ValidationException if the id would collide with the table's metadata file
     */
    public @NotNull Path recordFile(@NotNull Path tableDirectory, @NotNull String id) {
        String segment = segment(id);
        if (segment.equals(METADATA_NAME)) {
            throw new ValidationException("Record id '" + id + "' is reserved");
        }
        return tableDirectory.resolve(segment + RECORD_EXTENSION);
    }

    public static @NotNull Path metadataFile(@NotNull Path directory) {
        return directory.resolve(METADATA_FILE);
    }
}
