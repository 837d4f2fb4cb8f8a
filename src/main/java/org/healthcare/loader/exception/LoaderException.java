package org.healthcare.loader.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Fatal loader failure. Aborts the run; Spring Boot turns {@link #getExitCode()} into the process exit status.
 */
public abstract class LoaderException extends RuntimeException implements ExitCodeGenerator {

    protected LoaderException(String message) {
        super(message);
    }

    protected LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
