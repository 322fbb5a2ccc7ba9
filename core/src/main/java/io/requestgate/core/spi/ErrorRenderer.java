package io.requestgate.core.spi;

import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.model.GateResponse;

/**
 * Turns an error into a wire response. The router and body handlers only throw; rendering is
 * chosen by whoever installs the {@link io.requestgate.core.render.ErrorHandlingHandler}.
 *
 * <p>
 * Implementations MUST be thread-safe and stateless.
 */
public interface ErrorRenderer {

    /**
     * Renders an error.
     *
     * @param status   HTTP status code
     * @param type     problem type URN
     * @param detail   human-readable message, may be null
     * @param instance the request path, may be null
     * @return the response, without the rejection's extra headers
     */
    GateResponse render(int status, String type, String detail, String instance);

    /** Renders a rejection, adding the headers it carries (e.g. {@code Allow}). */
    default GateResponse render(RequestRejectedException rejection, String instance) {
        return render(rejection.status(), rejection.type(), rejection.detail(), instance)
                .withHeaders(rejection.headers());
    }
}
