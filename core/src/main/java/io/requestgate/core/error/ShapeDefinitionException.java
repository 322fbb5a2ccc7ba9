package io.requestgate.core.error;

/** Thrown when a YAML shape definition cannot be turned into a filter tree. */
public final class ShapeDefinitionException extends GateLoadException {

    private static final long serialVersionUID = 1L;

    public ShapeDefinitionException(String message, String source) {
        super(message, source);
    }

    public ShapeDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
