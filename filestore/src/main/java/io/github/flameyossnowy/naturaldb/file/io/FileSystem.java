package io.github.flameyossnowy.naturaldb.file.io;

import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.StorageException;
import io.github.flameyossnowy.naturaldb.api.utils.Logging;
import io.github.flameyossnowy.naturaldb.file.lock.LockManager;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * File and directory primitives. Each call holds the read or write lock of its target path
 * for its whole duration and releases it on every exit path.
 *
 * <p>I/O failures surface as {@link StorageException}.</p>
 */
public class FileSystem {
    private static final String TEMP_SUFFIX = ".tmp";

    private final LockManager lockManager;

    public FileSystem(@NotNull LockManager lockManager) {
        this.lockManager = lockManager;
    }

    /**
     * Writes {@code content} to {@code path}, replacing any previous content. The bytes go to
     * a temporary sibling first which is then moved over the target.
     *
     * @param createParents whether missing parent directories are created; when false a
     *                      missing parent fails with {@link ErrorCode#MISSING_PARENT_DIRECTORY}
     */
    public void createFile(@NotNull Path path, @NotNull String content, boolean createParents) {
        String key = key(path);
        lockManager.acquireWrite(key);
        try {
            writeAtomically(path, content, createParents);
            Logging.deepInfo(() -> "Wrote " + path);
        } finally {
            lockManager.releaseWrite(key);
        }
    }

    /**
     * Reads the whole file, or returns empty when it does not exist.
     */
    public @NotNull Optional<String> readFile(@NotNull Path path) {
        String key = key(path);
        lockManager.acquireRead(key);
        try {
            return read(path);
        } finally {
            lockManager.releaseRead(key);
        }
    }

    /**
     * Deletes the file. Deleting a missing file is a no-op.
     *
     * @return whether a file was removed
     */
    public boolean deleteFile(@NotNull Path path) {
        String key = key(path);
        lockManager.acquireWrite(key);
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                Logging.deepInfo(() -> "Deleted " + path);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageException(ErrorCode.IO_FAILURE, "Failed to delete file", e).withPath(path.toString());
        } finally {
            lockManager.releaseWrite(key);
        }
    }

    /**
     * Reads, transforms and writes back one file while holding its write lock, so concurrent
     * modifications of the same file are serialized.
     *
     * @param update receives the current content (empty if the file is missing) and returns
     *               the new content
     * @return the content that was written
     */
    public @NotNull String modifyFile(@NotNull Path path, @NotNull Function<Optional<String>, String> update,
                                      boolean createParents) {
        String key = key(path);
        lockManager.acquireWrite(key);
        try {
            String updated = update.apply(read(path));
            writeAtomically(path, updated, createParents);
            return updated;
        } finally {
            lockManager.releaseWrite(key);
        }
    }

    public void createFolder(@NotNull Path path) {
        String key = key(path);
        lockManager.acquireWrite(key);
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new StorageException(ErrorCode.IO_FAILURE, "Failed to create directory", e).withPath(path.toString());
        } finally {
            lockManager.releaseWrite(key);
        }
    }

    /**
     * Recursively deletes the directory. A missing directory is a no-op.
     *
     * @return whether anything was removed
     */
    public boolean deleteFolder(@NotNull Path path) {
        String key = key(path);
        lockManager.acquireWrite(key);
        try {
            if (!Files.exists(path)) {
                return false;
            }
            deleteDirectory(path);
            Logging.deepInfo(() -> "Deleted directory " + path);
            return true;
        } catch (IOException | UncheckedIOException e) {
            throw new StorageException(ErrorCode.IO_FAILURE, "Failed to delete directory", e).withPath(path.toString());
        } finally {
            lockManager.releaseWrite(key);
        }
    }

    /**
     * Lists the entries of a directory sorted by name. Missing directories list as empty.
     *
     * @param includeFolders whether subdirectories are listed next to regular files
     */
    public @NotNull List<Path> listFiles(@NotNull Path directory, boolean includeFolders) {
        String key = key(directory);
        lockManager.acquireRead(key);
        try {
            if (!Files.isDirectory(directory)) {
                return List.of();
            }
            List<Path> entries = new ArrayList<>();
            try (Stream<Path> files = Files.list(directory)) {
                files.filter(path -> Files.isRegularFile(path) || (includeFolders && Files.isDirectory(path)))
                    .filter(path -> !path.getFileName().toString().endsWith(TEMP_SUFFIX))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .forEach(entries::add);
            }
            return entries;
        } catch (IOException e) {
            throw new StorageException(ErrorCode.IO_FAILURE, "Failed to list directory", e).withPath(directory.toString());
        } finally {
            lockManager.releaseRead(key);
        }
    }

    /** Names of the subdirectories of {@code directory}, sorted. */
    public @NotNull List<String> listFolders(@NotNull Path directory) {
        List<String> names = new ArrayList<>();
        for (Path entry : listFiles(directory, true)) {
            if (Files.isDirectory(entry)) {
                names.add(entry.getFileName().toString());
            }
        }
        return names;
    }

    public boolean exists(@NotNull Path path) {
        return Files.exists(path);
    }

    private Optional<String> read(Path path) {
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException(ErrorCode.IO_FAILURE, "Failed to read file", e).withPath(path.toString());
        }
    }

    private void writeAtomically(Path path, String content, boolean createParents) {
        Path parent = path.toAbsolutePath().getParent();
        if (!Files.isDirectory(parent)) {
            if (!createParents) {
                throw new StorageException(ErrorCode.MISSING_PARENT_DIRECTORY, "Parent directory does not exist")
                    .withPath(path.toString());
            }
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StorageException(ErrorCode.IO_FAILURE, "Failed to create parent directory", e)
                    .withPath(parent.toString());
            }
        }

        Path temp = parent.resolve(path.getFileName().toString() + TEMP_SUFFIX);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            StorageException failure = new StorageException(ErrorCode.IO_FAILURE, "Failed to write file", e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure.withPath(path.toString());
        }
    }

    private static void deleteDirectory(Path directory) throws IOException {
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.sorted(Comparator.reverseOrder())
                .forEach(path -> {
                    try {
                        Files.delete(path);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
        }
    }

    private static String key(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
