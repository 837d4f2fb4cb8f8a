package org.healthcare.loader.exception;

/**
 * No CSV path is configured, or the configured file does not exist.
 */
public class MissingInputException extends LoaderException {

    public MissingInputException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 2;
    }
}
