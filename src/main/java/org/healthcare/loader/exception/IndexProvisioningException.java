package org.healthcare.loader.exception;

import lombok.Getter;

/**
 * The unique natural-key index could not be created, e.g. because the collection already holds duplicate keys.
 */
@Getter
public class IndexProvisioningException extends LoaderException {
    private final String collection;

    public IndexProvisioningException(String collection, Throwable cause) {
        super("Failed to create unique natural-key index on " + collection + ": " + cause.getMessage(), cause);
        this.collection = collection;
    }

    @Override
    public int getExitCode() {
        return 4;
    }
}
