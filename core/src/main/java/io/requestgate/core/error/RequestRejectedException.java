package io.requestgate.core.error;

import io.requestgate.core.model.HttpHeaders;
import java.util.Objects;

/**
 * Abstract parent for per-request rejections. Each subclass maps to one HTTP status code and a
 * problem type URN; rendering it into a wire response is the job of an
 * {@link io.requestgate.core.spi.ErrorRenderer}.
 *
 * <p>
 * Optional extra response headers (e.g. {@code Allow}, {@code WWW-Authenticate}) travel with
 * the exception.
 */
public abstract class RequestRejectedException extends GateException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final transient HttpHeaders headers;

    protected RequestRejectedException(int status, String message) {
        this(status, message, HttpHeaders.empty());
    }

    protected RequestRejectedException(int status, String message, HttpHeaders headers) {
        super(message, Phase.REQUEST);
        this.status = status;
        this.headers = Objects.requireNonNull(headers, "headers must not be null");
    }

    protected RequestRejectedException(int status, String message, Throwable cause) {
        super(message, cause, Phase.REQUEST);
        this.status = status;
        this.headers = HttpHeaders.empty();
    }

    /** The HTTP status code of the response this rejection turns into. */
    public int status() {
        return status;
    }

    /** Extra response headers, empty if none. */
    public HttpHeaders headers() {
        return headers;
    }

    /** Problem type URN used by RFC 9457 rendering. */
    public abstract String type();
}
