package io.github.flameyossnowy.naturaldb.file.storage;

import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.StorageException;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.naturaldb.api.json.JsonArray;
import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.json.JsonString;
import io.github.flameyossnowy.naturaldb.api.json.JsonValue;
import io.github.flameyossnowy.naturaldb.api.model.Table;
import io.github.flameyossnowy.naturaldb.file.StoreConfig;
import io.github.flameyossnowy.naturaldb.file.io.FileSystem;
import io.github.flameyossnowy.naturaldb.file.path.StoragePaths;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handle on one database directory: a {@code metadata.json} listing its tables plus one
 * subdirectory per table. The directory is created when the handle is.
 */
public class DatabaseStorage {
    private final FileSystem fileSystem;
    private final StoragePaths paths;
    private final StoreConfig config;
    private final Path directory;
    private final String name;

    DatabaseStorage(@NotNull FileSystem fileSystem, @NotNull StoragePaths paths, @NotNull StoreConfig config,
                    @NotNull Path directory) {
        this.fileSystem = fileSystem;
        this.paths = paths;
        this.config = config;
        this.directory = directory;
        this.name = directory.getFileName().toString();
        fileSystem.createFolder(directory);
    }

    public @NotNull String name() {
        return name;
    }

    public @NotNull Path directory() {
        return directory;
    }

    /**
     * The database metadata, or {@code {"name": ..., "tables": []}} when none was written.
     */
    public @NotNull JsonObject metadata() {
        return fileSystem.readFile(StoragePaths.metadataFile(directory))
            .map(this::parseMetadata)
            .orElseGet(this::defaultMetadata);
    }

    void writeMetadataIfAbsent() {
        fileSystem.modifyFile(StoragePaths.metadataFile(directory),
            current -> current.orElseGet(() -> JsonCodec.serialize(defaultMetadata(), config.recordIndent())), true);
    }

    /**
     * Creates the table directory, writes its metadata and registers it in the database
     * metadata.
     */
    public @NotNull TableStorage createTable(@NotNull Table table) {
        Path tableDirectory = paths.tableDirectory(directory, table.name());
        TableStorage storage = new TableStorage(fileSystem, paths, config, tableDirectory);
        Table stored = new Table(storage.name(), table.indexes(), table.keys());
        storage.writeMetadata(stored.toMetadata());
        updateTables(storage.name(), true);
        return storage;
    }

    /**
     * Recursively removes the table and unregisters it.
     *
     * @return whether the table directory existed
     */
    public boolean deleteTable(@NotNull String table) {
        Path tableDirectory = paths.tableDirectory(directory, table);
        boolean deleted = fileSystem.deleteFolder(tableDirectory);
        updateTables(tableDirectory.getFileName().toString(), false);
        return deleted;
    }

    public boolean tableExists(@NotNull String table) {
        return Files.isDirectory(paths.tableDirectory(directory, table));
    }

    /**
     * Opens the table, creating its directory if needed but writing no metadata.
     */
    public @NotNull TableStorage table(@NotNull String table) {
        return new TableStorage(fileSystem, paths, config, paths.tableDirectory(directory, table));
    }

    /** Table directory names in lexicographic order. */
    public @NotNull List<String> listTables() {
        return fileSystem.listFolders(directory);
    }

    /** Number of tables registered in the metadata. */
    public int size() {
        JsonArray tables = metadata().getArray("tables");
        return tables == null ? 0 : tables.size();
    }

    private void updateTables(String table, boolean add) {
        fileSystem.modifyFile(StoragePaths.metadataFile(directory), current -> {
            JsonObject metadata = current.map(this::parseMetadata).orElseGet(this::defaultMetadata);
            JsonArray existing = Optional.ofNullable(metadata.getArray("tables")).orElse(JsonArray.EMPTY);
            List<JsonValue> tables = new ArrayList<>(existing.elements());
            JsonString entry = new JsonString(table);
            tables.remove(entry);
            if (add) {
                tables.add(entry);
            }
            return JsonCodec.serialize(metadata.with("tables", new JsonArray(tables)), config.recordIndent());
        }, true);
    }

    private JsonObject defaultMetadata() {
        return JsonObject.builder().put("name", name).put("tables", JsonArray.EMPTY).build();
    }

    private JsonObject parseMetadata(String text) {
        try {
            return JsonCodec.parseObject(text);
        } catch (JsonProcessException e) {
            throw new StorageException(ErrorCode.RECORD_CORRUPTED, "Database metadata is not valid JSON", e)
                .withPath(StoragePaths.metadataFile(directory).toString());
        }
    }
}
