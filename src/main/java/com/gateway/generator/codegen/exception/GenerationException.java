package com.gateway.generator.codegen.exception;

import java.util.Optional;

/**
 * Fatal generation failure. Any instance aborts the whole batch.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        UNKNOWN_ADDRESSING_MODE,
        CONFIGURATION_CONFLICT,
        PREFIX_MISMATCH,
        RENDERING_FAILED,
        INVALID_SYNTAX,
        INVALID_DESCRIPTOR
    }

    private final Reason reason;
    private final String fileName;

    public GenerationException(Reason reason, String message) {
        this(reason, null, message, null);
    }

    public GenerationException(Reason reason, String fileName, String message) {
        this(reason, fileName, message, null);
    }

    public GenerationException(Reason reason, String fileName, String message, Throwable cause) {
        super(fileName == null ? message : fileName + ": " + message, cause);
        this.reason = reason;
        this.fileName = fileName;
    }

    public Reason getReason() {
        return reason;
    }

    public Optional<String> getFileName() {
        return Optional.ofNullable(fileName);
    }
}
