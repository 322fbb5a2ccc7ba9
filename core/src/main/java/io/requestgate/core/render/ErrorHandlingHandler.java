package io.requestgate.core.render;

import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.spi.ErrorRenderer;
import io.requestgate.core.spi.RequestHandler;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outermost handler of a chain: turns every exception thrown downstream into a response.
 *
 * <p>
 * A {@link RequestRejectedException} is rendered with its status, message and extra headers.
 * Anything else is logged at ERROR with its stack trace and rendered as 500 with a generic
 * message; internal details never reach the client.
 */
public final class ErrorHandlingHandler implements RequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorHandlingHandler.class);

    /** Message of the 500 response. */
    public static final String INTERNAL_ERROR_MESSAGE = "A server error occurred. Please contact an administrator.";

    /** Problem type of the 500 response. */
    public static final String INTERNAL_ERROR_URN = "urn:request-gate:error:internal";

    private final RequestHandler next;
    private final ErrorRenderer renderer;

    public ErrorHandlingHandler(RequestHandler next, ErrorRenderer renderer) {
        this.next = Objects.requireNonNull(next, "next must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    @Override
    public GateResponse handle(RequestContext ctx) {
        String path = ctx.request().path();
        try {
            return next.handle(ctx);
        } catch (RequestRejectedException e) {
            LOG.debug("{} {} rejected with {}: {}", ctx.request().method(), path, e.status(), e.detail());
            return renderer.render(e, path);
        } catch (Exception e) {
            LOG.error("Unhandled error for {} {}", ctx.request().method(), path, e);
            return renderer.render(500, INTERNAL_ERROR_URN, INTERNAL_ERROR_MESSAGE, path);
        }
    }
}
