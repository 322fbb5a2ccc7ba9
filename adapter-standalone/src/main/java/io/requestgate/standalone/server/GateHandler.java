package io.requestgate.standalone.server;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.requestgate.core.model.BoundedBodySource;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.HttpHeaders;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.model.RequestDescriptor;
import io.requestgate.core.spi.RequestHandler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges Javalin to a {@link RequestHandler} chain: builds a {@link RequestDescriptor} from the
 * Javalin {@link Context}, runs the chain with a fresh {@link RequestContext}, and writes the
 * {@link GateResponse} back.
 *
 * <p>
 * Thread-safe: all state is local to each {@link #handle(Context)} call.
 */
public final class GateHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(GateHandler.class);

    private final RequestHandler chain;
    private final long maxBodyBytes;

    /**
     * @param chain        the handler chain, normally an error handler around a router
     * @param maxBodyBytes largest request body read, {@code <= 0} for no limit
     */
    public GateHandler(RequestHandler chain, long maxBodyBytes) {
        this.chain = Objects.requireNonNull(chain, "chain must not be null");
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        RequestDescriptor request = new RequestDescriptor(
                ctx.method().name(),
                decodedPath(ctx),
                ctx.header("Content-Type"),
                buildHeaders(ctx),
                new BoundedBodySource(ctx.bodyInputStream(), ctx.contentLength(), maxBodyBytes));

        GateResponse response = chain.handle(new RequestContext(request));
        write(ctx, response);

        LOG.debug("{} {} -> {} ({} bytes)", request.method(), request.path(), response.status(), response.body().size());
    }

    private static void write(Context ctx, GateResponse response) {
        ctx.status(response.status());
        response.headers().toMultiValueMap().forEach((name, values) -> {
            if ("content-type".equals(name)) {
                return;
            }
            for (String value : values) {
                ctx.res().addHeader(name, value);
            }
        });
        String contentType = response.contentType();
        if (contentType != null) {
            ctx.contentType(contentType);
        }
        if (!response.body().isEmpty()) {
            ctx.result(response.body().content());
        }
    }

    /** The percent-decoded request path; {@link Context#path()} is the raw request URI. */
    private static String decodedPath(Context ctx) {
        String pathInfo = ctx.req().getPathInfo();
        return pathInfo != null ? pathInfo : ctx.path();
    }

    /** All request header values, names lowercased. */
    private static HttpHeaders buildHeaders(Context ctx) {
        Map<String, List<String>> headersAll = new LinkedHashMap<>();
        Enumeration<String> headerNames = ctx.req().getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                List<String> valueList = new ArrayList<>(Collections.list(ctx.req().getHeaders(name)));
                headersAll.put(name.toLowerCase(), Collections.unmodifiableList(valueList));
            }
        }
        return HttpHeaders.ofMulti(headersAll);
    }
}
