import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.ValidationException;
import io.github.flameyossnowy.naturaldb.api.model.Database;
import io.github.flameyossnowy.naturaldb.api.model.User;
import io.github.flameyossnowy.naturaldb.file.path.NameSanitizer;
import io.github.flameyossnowy.naturaldb.file.path.StoragePaths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class NameSanitizerTest {
    private final NameSanitizer sanitizer = new NameSanitizer();

    @Test
    void keepsAllowedCharacters() {
        assertEquals("My Table_1-b", sanitizer.sanitize("My Table_1-b"));
    }

    @Test
    void stripsSeparatorsAndDots() {
        assertEquals("etcpasswd", sanitizer.sanitize("../etc/passwd"));
        assertEquals("ab", sanitizer.sanitize("a\\b"));
        assertEquals("users", sanitizer.sanitize("users.json"));
    }

    @Test
    void truncatesToMaxLength() {
        NameSanitizer shortNames = new NameSanitizer(5);
        assertEquals("abcde", shortNames.sanitize("abcdefgh"));
        assertEquals(80, sanitizer.sanitize("x".repeat(200)).length());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "plain", "../../x", "a/b/c", "dots...and spaces", "ünïcødé", "tab\there", "x"})
    void isIdempotent(String input) {
        String once = sanitizer.sanitize(input);
        assertEquals(once, sanitizer.sanitize(once));
        for (char c : once.toCharArray()) {
            assertTrue(NameSanitizer.isAllowed(c), "unexpected '" + c + "'");
        }
        assertFalse(once.contains("/"));
        assertFalse(once.contains(".."));
    }

    @Test
    void rejectsNonPositiveMaxLength() {
        assertThrows(IllegalArgumentException.class, () -> new NameSanitizer(0));
    }

    @Test
    void pathsAreBuiltFromSanitizedSegments() {
        StoragePaths paths = new StoragePaths(Path.of("/base"), sanitizer);
        Path database = paths.databaseDirectory(User.of("../alice"), new Database("shop.db"));
        assertEquals(Path.of("/base", "alice", "shopdb").toAbsolutePath().normalize(), database);
        assertEquals(database.resolve("orders").resolve("7.json"),
            paths.recordFile(paths.tableDirectory(database, "orders"), "7"));
    }

    @Test
    void emptySegmentIsRejected() {
        StoragePaths paths = new StoragePaths(Path.of("/base"), sanitizer);
        ValidationException e = assertThrows(ValidationException.class, () -> paths.userDirectory(User.of("///")));
        assertEquals(ErrorCode.INVALID_IDENTIFIER, e.getErrorCode());
    }

    @Test
    void metadataRecordIdIsReserved() {
        StoragePaths paths = new StoragePaths(Path.of("/base"), sanitizer);
        assertThrows(ValidationException.class, () -> paths.recordFile(Path.of("/base/t"), "metadata"));
        assertThrows(ValidationException.class, () -> paths.recordFile(Path.of("/base/t"), "meta.data"));
    }
}
