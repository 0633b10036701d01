package io.github.flameyossnowy.naturaldb.file;

import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.User;
import io.github.flameyossnowy.naturaldb.api.utils.Logging;
import io.github.flameyossnowy.naturaldb.file.engine.OperationRegistry;
import io.github.flameyossnowy.naturaldb.file.engine.QueryEngine;
import io.github.flameyossnowy.naturaldb.file.io.FileSystem;
import io.github.flameyossnowy.naturaldb.file.lock.LockManager;
import io.github.flameyossnowy.naturaldb.file.path.NameSanitizer;
import io.github.flameyossnowy.naturaldb.file.path.StoragePaths;
import io.github.flameyossnowy.naturaldb.file.storage.Storage;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;

/**
 * Entry point of a file backed store. One instance owns the lock manager for its base
 * directory; engines opened from the same instance share it.
 *
 * <pre>{@code
 * NaturalDB db = NaturalDB.open(Path.of("./data"));
 * QueryEngine engine = db.openDatabase(User.of("alice"), new Database("shop"));
 * engine.createTable("products");
 * }</pre>
 */
public final class NaturalDB {
    private final StoreConfig config;
    private final LockManager lockManager;
    private final FileSystem fileSystem;
    private final Storage storage;

    public NaturalDB(@NotNull StoreConfig config) {
        this.config = config;
        this.lockManager = new LockManager(config.lockTimeout());
        this.fileSystem = new FileSystem(lockManager);
        StoragePaths paths = new StoragePaths(config.baseDirectory(), new NameSanitizer(config.maxNameLength()));
        this.storage = new Storage(fileSystem, paths, config);
        Logging.info(() -> "Opened store at " + paths.baseDirectory());
    }

    @Contract("_ -> new")
    public static @NotNull NaturalDB open(@NotNull Path baseDirectory) {
        return new NaturalDB(StoreConfig.builder().baseDirectory(baseDirectory).build());
    }

    /**
     * Opens a store rooted at the configured data path, see {@link StoreConfig#fromEnvironment()}.
     */
    @Contract(" -> new")
    public static @NotNull NaturalDB fromEnvironment() {
        return new NaturalDB(StoreConfig.fromEnvironment());
    }

    /**
     * Creates the user and database directories when missing and returns an engine over them.
     */
    public @NotNull QueryEngine openDatabase(@NotNull User user, @NotNull Database database) {
        storage.createUser(user);
        return new QueryEngine(storage, fileSystem, user, database);
    }

    public @NotNull OperationRegistry operations(@NotNull User user, @NotNull Database database) {
        return new OperationRegistry(openDatabase(user, database));
    }

    public @NotNull StoreConfig config() {
        return config;
    }

    public @NotNull Storage storage() {
        return storage;
    }

    public @NotNull FileSystem fileSystem() {
        return fileSystem;
    }

    public @NotNull LockManager lockManager() {
        return lockManager;
    }
}
