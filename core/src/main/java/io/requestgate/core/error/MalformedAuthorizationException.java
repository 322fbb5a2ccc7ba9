package io.requestgate.core.error;

/**
 * Thrown when an HTTP Basic {@code Authorization} header cannot be decoded (400). URN:
 * {@code urn:request-gate:error:malformed-authorization}
 */
public final class MalformedAuthorizationException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:malformed-authorization";

    public MalformedAuthorizationException(String message) {
        super(400, message);
    }

    @Override
    public String type() {
        return URN;
    }
}
