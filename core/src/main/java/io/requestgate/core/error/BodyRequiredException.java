package io.requestgate.core.error;

/**
 * Thrown when a body handler receives a request that declares no content (400). URN:
 * {@code urn:request-gate:error:body-required}
 */
public final class BodyRequiredException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:body-required";

    public BodyRequiredException(String message) {
        super(400, message);
    }

    @Override
    public String type() {
        return URN;
    }
}
