package io.requestgate.core.error;

/**
 * Abstract parent for startup configuration errors: route tables and shape definitions that
 * cannot be built. Carries a {@code source} field identifying the file or resource that caused
 * the error.
 */
public abstract class GateLoadException extends GateException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected GateLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected GateLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if built in code. */
    public String source() {
        return source;
    }
}
