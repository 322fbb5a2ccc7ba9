package io.requestgate.core.shape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.requestgate.core.error.BodyRequiredException;
import io.requestgate.core.error.MalformedBodyException;
import io.requestgate.core.error.ShapeValidationException;
import io.requestgate.core.error.UnsupportedMediaTypeException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.MediaType;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.model.RequestDescriptor;
import io.requestgate.core.spi.RequestHandler;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the request body as JSON, optionally validates it against a {@link Filter}, and
 * forwards to the wrapped handler with the result in the context.
 *
 * <p>
 * Rejections, in evaluation order:
 * <ol>
 * <li>no Content-Type: {@link BodyRequiredException} (400);</li>
 * <li>a Content-Type whose subtype has no {@code json} token: {@link UnsupportedMediaTypeException}
 * (415);</li>
 * <li>empty or unparseable body, or trailing content after the value:
 * {@link MalformedBodyException} (422);</li>
 * <li>the filter rejects: {@link ShapeValidationException} (400) carrying the filter's
 * reason.</li>
 * </ol>
 *
 * <p>
 * Thread-safe: the parsed body lives in the {@link RequestContext} under {@link #JSON_BODY},
 * the raw bytes under {@link #RAW_BODY}.
 */
public final class JsonBodyHandler implements RequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(JsonBodyHandler.class);

    /** Context attribute holding the raw body bytes ({@code byte[]}). */
    public static final String RAW_BODY = "request-gate.raw-body";

    /** Context attribute holding the parsed body ({@link JsonNode}). */
    public static final String JSON_BODY = "request-gate.json-body";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final RequestHandler next;
    private final Filter filter;

    /** Parses without shape validation. */
    public JsonBodyHandler(RequestHandler next) {
        this(next, null);
    }

    /**
     * @param next   handler to forward accepted requests to
     * @param filter shape the body must satisfy, or {@code null} to accept any JSON value
     */
    public JsonBodyHandler(RequestHandler next, Filter filter) {
        this.next = Objects.requireNonNull(next, "next must not be null");
        this.filter = filter;
    }

    /** The shape the body is validated against, empty if none. */
    public Optional<Filter> filter() {
        return Optional.ofNullable(filter);
    }

    /** The wrapped handler. */
    public RequestHandler next() {
        return next;
    }

    @Override
    public GateResponse handle(RequestContext ctx) throws Exception {
        RequestDescriptor request = ctx.request();
        String contentType = request.contentType();
        if (contentType == null) {
            throw new BodyRequiredException("Body required");
        }
        if (!MediaType.hasSubtypeToken(contentType, "json")) {
            throw new UnsupportedMediaTypeException("Only json content is allowed.");
        }

        byte[] raw = request.body().read();
        JsonNode json = parse(raw);

        if (filter != null) {
            Verdict verdict = filter.evaluate(json);
            if (verdict.rejected()) {
                LOG.debug("Body of {} {} rejected: {}", request.method(), request.path(), verdict.reason());
                throw new ShapeValidationException(verdict.reason());
            }
        }

        ctx.setAttribute(RAW_BODY, raw);
        ctx.setAttribute(JSON_BODY, json);
        return next.handle(ctx);
    }

    /**
     * The parsed body set by a {@code JsonBodyHandler} earlier in the chain.
     *
     * @throws IllegalStateException if no JSON body handler ran for this request
     */
    public static JsonNode body(RequestContext ctx) {
        return ctx.requireAttribute(JSON_BODY, JsonNode.class);
    }

    private static JsonNode parse(byte[] raw) {
        if (raw.length == 0) {
            throw new MalformedBodyException("Invalid JSON");
        }
        JsonNode json;
        try {
            json = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            LOG.debug("Invalid JSON body: {}", e.getOriginalMessage());
            throw new MalformedBodyException("Invalid JSON", e);
        } catch (IOException e) {
            throw new MalformedBodyException("Invalid JSON", e);
        }
        if (json == null || json.isMissingNode()) {
            throw new MalformedBodyException("Invalid JSON");
        }
        return json;
    }
}
