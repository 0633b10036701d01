package io.github.flameyossnowy.naturaldb.file.storage;

import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.naturaldb.api.exceptions.StorageException;
import io.github.flameyossnowy.naturaldb.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.naturaldb.api.json.JsonCodec;
import io.github.flameyossnowy.naturaldb.api.json.JsonObject;
import io.github.flameyossnowy.naturaldb.api.model.Document;
import io.github.flameyossnowy.naturaldb.file.StoreConfig;
import io.github.flameyossnowy.naturaldb.file.io.FileSystem;
import io.github.flameyossnowy.naturaldb.file.path.StoragePaths;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handle on one table directory: a {@code metadata.json} plus one {@code <id>.json} file per
 * record. The directory is created when the handle is.
 */
public class TableStorage {
    private final FileSystem fileSystem;
    private final StoragePaths paths;
    private final StoreConfig config;
    private final Path directory;
    private final String name;

    TableStorage(@NotNull FileSystem fileSystem, @NotNull StoragePaths paths, @NotNull StoreConfig config,
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
     * The table metadata, or {@code {"name": ..., "indexes": {}}} when none was written.
     */
    public @NotNull JsonObject metadata() {
        Path file = StoragePaths.metadataFile(directory);
        return fileSystem.readFile(file)
            .map(text -> parseStored(text, file, null))
            .orElseGet(() -> JsonObject.builder().put("name", name).put("indexes", JsonObject.EMPTY).build());
    }

    public void writeMetadata(@NotNull JsonObject metadata) {
        fileSystem.createFile(StoragePaths.metadataFile(directory), JsonCodec.serialize(metadata, config.recordIndent()), true);
    }

    /** Creates or replaces the record's file. */
    public void saveRecord(@NotNull Document record) {
        Path file = paths.recordFile(directory, record.id());
        fileSystem.createFile(file, JsonCodec.serialize(record.data(), config.recordIndent()), true);
    }

    /**
     * @throws RecordNotFoundException if the record has no file
     * @throws StorageException with {@link ErrorCode#RECORD_CORRUPTED} if the file does not parse
     */
    public @NotNull Document loadRecord(@NotNull String id) {
        return findRecord(id).orElseThrow(() -> new RecordNotFoundException(name, id));
    }

    public @NotNull Optional<Document> findRecord(@NotNull String id) {
        Path file = paths.recordFile(directory, id);
        String recordId = recordId(file);
        return fileSystem.readFile(file).map(text -> new Document(recordId, parseStored(text, file, recordId)));
    }

    public boolean recordExists(@NotNull String id) {
        return fileSystem.exists(paths.recordFile(directory, id));
    }

    /**
     * Removes the record's file. Missing records are ignored.
     *
     * @return whether a file was removed
     */
    public boolean deleteRecord(@NotNull String id) {
        return fileSystem.deleteFile(paths.recordFile(directory, id));
    }

    /** Record ids in lexicographic order, {@code metadata.json} excluded. */
    public @NotNull List<String> listRecords() {
        List<String> ids = new ArrayList<>();
        for (Path file : fileSystem.listFiles(directory, false)) {
            String fileName = file.getFileName().toString();
            if (fileName.endsWith(StoragePaths.RECORD_EXTENSION) && !fileName.equals(StoragePaths.METADATA_FILE)) {
                ids.add(recordId(file));
            }
        }
        return ids;
    }

    /**
     * Reads every record. Records deleted between listing and reading are skipped.
     */
    public @NotNull Map<String, Document> loadAllRecords() {
        Map<String, Document> records = new LinkedHashMap<>();
        for (String id : listRecords()) {
            findRecord(id).ifPresent(record -> records.put(id, record));
        }
        return records;
    }

    public int size() {
        return listRecords().size();
    }

    private static String recordId(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - StoragePaths.RECORD_EXTENSION.length());
    }

    private JsonObject parseStored(String text, Path file, String recordId) {
        try {
            return JsonCodec.parseObject(text);
        } catch (JsonProcessException e) {
            throw new StorageException(ErrorCode.RECORD_CORRUPTED, "Stored document is not valid JSON", e)
                .withTable(name)
                .withRecordId(recordId)
                .withPath(file.toString());
        }
    }
}
