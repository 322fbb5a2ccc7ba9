package io.requestgate.core.spi;

import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.RequestContext;

/**
 * Handles one request. Route targets and every middleware (router, JSON body handler, basic
 * authentication, error handling) implement this interface and compose by wrapping each other.
 *
 * <p>
 * Implementations are shared across concurrent requests and MUST keep per-request data in the
 * {@link RequestContext}, never in their own fields.
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * Handles the request.
     *
     * @param ctx the per-request context
     * @return the response to send
     * @throws io.requestgate.core.error.RequestRejectedException to reject the request with a
     *         specific status
     * @throws Exception on any other failure; rendered as 500 by
     *         {@link io.requestgate.core.render.ErrorHandlingHandler}
     */
    GateResponse handle(RequestContext ctx) throws Exception;
}
