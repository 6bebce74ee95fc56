package com.modeldoc.table;

import com.modeldoc.loader.LoaderException;
import java.nio.file.Path;

/** A parameter or legend table was configured but could not be read. */
public final class MissingTableFileException extends LoaderException {
    private final Path path;

    public MissingTableFileException(String description, Path path, Throwable cause) {
        super("Cannot read " + description + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
