package io.requestgate.core.error;

/**
 * Thrown when a request declares more body bytes than the configured maximum (413). URN:
 * {@code urn:request-gate:error:payload-too-large}
 */
public final class PayloadTooLargeException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:payload-too-large";

    public PayloadTooLargeException(String message) {
        super(413, message);
    }

    @Override
    public String type() {
        return URN;
    }
}
