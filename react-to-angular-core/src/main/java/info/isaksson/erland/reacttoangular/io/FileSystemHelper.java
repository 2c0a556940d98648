package info.isaksson.erland.reacttoangular.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * File access used by the pipeline: UTF-8 text in, UTF-8 text out.
 *
 * <p>Writes are not atomic. A failure surfaces as {@link WriteError}; nothing already written is
 * rolled back.</p>
 */
public class FileSystemHelper {

    public String read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    public boolean exists(Path file) {
        return file != null && Files.isRegularFile(file);
    }

    /** Creates {@code dir} and missing parents. */
    public void ensureDirectory(Path dir) throws WriteError {
        Objects.requireNonNull(dir, "dir");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new WriteError(dir, e);
        }
    }

    public void write(Path file, String content) throws WriteError {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WriteError(file, e);
        }
    }
}
