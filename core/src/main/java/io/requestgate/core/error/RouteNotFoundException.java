package io.requestgate.core.error;

/**
 * Thrown when no route's path pattern matches the request path (404). URN:
 * {@code urn:request-gate:error:route-not-found}
 */
public final class RouteNotFoundException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:route-not-found";

    public RouteNotFoundException(String message) {
        super(404, message);
    }

    @Override
    public String type() {
        return URN;
    }
}
