package org.healthcare.loader.exception;

import lombok.Getter;

import java.util.List;

/**
 * The CSV header lacks one or more expected columns.
 */
@Getter
public class SchemaValidationException extends LoaderException {
    private final List<String> missingColumns;

    public SchemaValidationException(List<String> missingColumns) {
        super("Missing expected columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    @Override
    public int getExitCode() {
        return 3;
    }
}
