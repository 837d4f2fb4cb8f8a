package org.healthcare.loader.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The CSV source could not be opened or read.
 */
@Getter
public class SourceReadException extends LoaderException {
    private final Path source;

    public SourceReadException(Path source, Throwable cause) {
        super("Failed to read " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    @Override
    public int getExitCode() {
        return 5;
    }
}
