package io.requestgate.core.error;

/**
 * Thrown when a route table cannot be built: wrong arity, wrong expectation type, duplicate
 * routes, unknown handler references or malformed path templates.
 */
public final class RouteDefinitionException extends GateLoadException {

    private static final long serialVersionUID = 1L;

    public RouteDefinitionException(String message, String source) {
        super(message, source);
    }

    public RouteDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
