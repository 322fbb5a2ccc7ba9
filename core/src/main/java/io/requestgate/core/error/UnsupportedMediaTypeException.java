package io.requestgate.core.error;

/**
 * Thrown when no surviving route accepts the request content-type, or a body handler receives a body it cannot parse by type (415). URN:
 * {@code urn:request-gate:error:unsupported-media-type}
 */
public final class UnsupportedMediaTypeException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:unsupported-media-type";

    public UnsupportedMediaTypeException(String message) {
        super(415, message);
    }

    @Override
    public String type() {
        return URN;
    }
}
