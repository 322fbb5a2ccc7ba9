package io.requestgate.core.error;

/**
 * Thrown when HTTP Basic credentials are well-formed but rejected (401). URN:
 * {@code urn:request-gate:error:invalid-credentials}
 */
public final class InvalidCredentialsException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:invalid-credentials";

    public InvalidCredentialsException(String message) {
        super(401, message);
    }

    @Override
    public String type() {
        return URN;
    }
}
