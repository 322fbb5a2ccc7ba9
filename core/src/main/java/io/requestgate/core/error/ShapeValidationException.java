package io.requestgate.core.error;

/**
 * Thrown when a parsed JSON body is rejected by its shape filter (400). The message is the
 * location-qualified reason, e.g. {@code "items: 2: expected int, found 'x' of type string"}.
 * URN: {@code urn:request-gate:error:shape-validation-failed}
 */
public final class ShapeValidationException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:shape-validation-failed";

    public ShapeValidationException(String reason) {
        super(400, reason);
    }

    /** The filter's rejection reason (alias for {@link #getMessage()}). */
    public String reason() {
        return getMessage();
    }

    @Override
    public String type() {
        return URN;
    }
}
