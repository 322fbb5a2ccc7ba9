package io.requestgate.core.error;

/**
 * Abstract base for all request-gate exceptions. Never thrown directly: use the concrete
 * subclasses under {@link GateLoadException} or {@link RequestRejectedException}.
 */
public abstract class GateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        REQUEST
    }

    private final Phase phase;

    protected GateException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected GateException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
