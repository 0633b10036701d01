package io.github.flameyossnowy.naturaldb.file.storage;

import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.User;
import io.github.flameyossnowy.naturaldb.file.StoreConfig;
import io.github.flameyossnowy.naturaldb.file.io.FileSystem;
import io.github.flameyossnowy.naturaldb.file.path.StoragePaths;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Files;
import java.util.List;

/**
 * Top of the storage hierarchy: users and their databases.
 */
public class Storage {
    private final FileSystem fileSystem;
    private final StoragePaths paths;
    private final StoreConfig config;

    public Storage(@NotNull FileSystem fileSystem, @NotNull StoragePaths paths, @NotNull StoreConfig config) {
        this.fileSystem = fileSystem;
        this.paths = paths;
        this.config = config;
    }

    public @NotNull StoragePaths paths() {
        return paths;
    }

    public void createUser(@NotNull User user) {
        fileSystem.createFolder(paths.userDirectory(user));
    }

    public boolean deleteUser(@NotNull User user) {
        return fileSystem.deleteFolder(paths.userDirectory(user));
    }

    public boolean userExists(@NotNull User user) {
        return Files.isDirectory(paths.userDirectory(user));
    }

    /** User directory names, sorted. */
    public @NotNull List<String> listUsers() {
        return fileSystem.listFolders(paths.baseDirectory());
    }

    /**
     * Creates the database directory and, unless one exists, its metadata file
     * {@code {"name": ..., "tables": []}}.
     */
    public @NotNull DatabaseStorage createDatabase(@NotNull User user, @NotNull Database database) {
        DatabaseStorage storage = database(user, database);
        storage.writeMetadataIfAbsent();
        return storage;
    }

    public boolean deleteDatabase(@NotNull User user, @NotNull Database database) {
        return fileSystem.deleteFolder(paths.databaseDirectory(user, database));
    }

    public boolean databaseExists(@NotNull User user, @NotNull Database database) {
        return Files.isDirectory(paths.databaseDirectory(user, database));
    }

    /** Database directory names of the user, sorted. */
    public @NotNull List<String> listDatabases(@NotNull User user) {
        return fileSystem.listFolders(paths.userDirectory(user));
    }

    /**
     * Opens a database handle, creating its directory if needed.
     */
    public @NotNull DatabaseStorage database(@NotNull User user, @NotNull Database database) {
        return new DatabaseStorage(fileSystem, paths, config, paths.databaseDirectory(user, database));
    }
}
