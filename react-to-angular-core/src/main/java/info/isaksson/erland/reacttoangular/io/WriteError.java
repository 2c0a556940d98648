package info.isaksson.erland.reacttoangular.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An output directory could not be created or an artifact could not be written. Files written
 * earlier in the same run stay on disk.
 */
public class WriteError extends IOException {

    private final Path path;

    public WriteError(Path path, IOException cause) {
        super("Cannot write " + path + ": " + describe(cause), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }
}
