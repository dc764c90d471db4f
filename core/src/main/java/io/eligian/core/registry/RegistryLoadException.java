package io.eligian.core.registry;

/** Thrown when an operation registry file cannot be read or does not match the registry schema. */
public final class RegistryLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public RegistryLoadException(String message, String source) {
        super(message);
        this.source = source;
    }

    public RegistryLoadException(String message, Throwable cause, String source) {
        super(message, cause);
        this.source = source;
    }

    /** The file path or classpath resource that caused the error. */
    public String source() {
        return source;
    }
}
