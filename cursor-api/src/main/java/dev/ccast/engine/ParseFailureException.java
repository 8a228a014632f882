package dev.ccast.engine;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** The engine could not construct a translation unit for a file. */
public class ParseFailureException extends Exception {
    private final Path path;

    public ParseFailureException(Path path, String reason) {
        this(path, reason, null);
    }

    public ParseFailureException(Path path, String reason, @Nullable Throwable cause) {
        super("Unable to parse " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
