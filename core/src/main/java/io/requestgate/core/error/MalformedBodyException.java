package io.requestgate.core.error;

/**
 * Thrown when a request body is not parseable as the declared format (422). URN:
 * {@code urn:request-gate:error:malformed-body}
 */
public final class MalformedBodyException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:malformed-body";

    public MalformedBodyException(String message) {
        super(422, message);
    }

    public MalformedBodyException(String message, Throwable cause) {
        super(422, message, cause);
    }

    @Override
    public String type() {
        return URN;
    }
}
