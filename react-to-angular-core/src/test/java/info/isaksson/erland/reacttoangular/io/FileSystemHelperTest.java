package info.isaksson.erland.reacttoangular.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileSystemHelperTest {

    private final FileSystemHelper files = new FileSystemHelper();

    @Test
    void writeCreatesParentsAndReadsBack() throws Exception {
        Path target = Files.createTempDirectory("r2a-fs-").resolve("a").resolve("b").resolve("x.txt");
        files.write(target, "héllo\n");
        assertTrue(files.exists(target));
        assertEquals("héllo\n", files.read(target));
    }

    @Test
    void ensureDirectoryFailsOnRegularFile() throws Exception {
        Path file = Files.createTempFile("r2a-fs-", ".txt");
        WriteError e = assertThrows(WriteError.class, () -> files.ensureDirectory(file));
        assertEquals(file, e.getPath());
        assertTrue(e.getMessage().startsWith("Cannot write "), e.getMessage());
    }
}
