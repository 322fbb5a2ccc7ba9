package io.requestgate.core.shape;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.requestgate.core.error.BodyRequiredException;
import io.requestgate.core.error.MalformedBodyException;
import io.requestgate.core.error.UnsupportedMediaTypeException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.MediaType;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.model.RequestDescriptor;
import io.requestgate.core.spi.RequestHandler;
import java.io.IOException;
import java.util.Objects;
import javax.xml.stream.XMLInputFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the request body as XML and forwards to the wrapped handler with the element tree in
 * the context.
 *
 * <p>
 * Rejections follow {@link JsonBodyHandler}: no Content-Type is 400 "Body required", a subtype
 * without an {@code xml} token is 415, and an empty or malformed document is 422 "Invalid XML".
 *
 * <p>
 * The document is read through {@link XmlMapper}, so the root element's children become the
 * fields of an object node ({@code <item><id>5</id></item>} reads as {@code {"id":"5"}}) and
 * the root element's own name is not kept. DTDs and external entities are not processed.
 */
public final class XmlBodyHandler implements RequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(XmlBodyHandler.class);

    /** Context attribute holding the parsed document ({@link JsonNode}). */
    public static final String XML_BODY = "request-gate.xml-body";

    private static final XmlMapper MAPPER = createMapper();

    private final RequestHandler next;

    public XmlBodyHandler(RequestHandler next) {
        this.next = Objects.requireNonNull(next, "next must not be null");
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
        if (!MediaType.hasSubtypeToken(contentType, "xml")) {
            throw new UnsupportedMediaTypeException("Only xml content is allowed.");
        }

        byte[] raw = request.body().read();
        JsonNode document = parse(raw);

        ctx.setAttribute(JsonBodyHandler.RAW_BODY, raw);
        ctx.setAttribute(XML_BODY, document);
        return next.handle(ctx);
    }

    /**
     * The parsed document set by an {@code XmlBodyHandler} earlier in the chain.
     *
     * @throws IllegalStateException if no XML body handler ran for this request
     */
    public static JsonNode body(RequestContext ctx) {
        return ctx.requireAttribute(XML_BODY, JsonNode.class);
    }

    private static JsonNode parse(byte[] raw) {
        if (raw.length == 0) {
            throw new MalformedBodyException("Invalid XML");
        }
        JsonNode document;
        try {
            document = MAPPER.readTree(raw);
        } catch (IOException e) {
            LOG.debug("Invalid XML body: {}", e.getMessage());
            throw new MalformedBodyException("Invalid XML", e);
        }
        if (document == null || document.isMissingNode()) {
            throw new MalformedBodyException("Invalid XML");
        }
        return document;
    }

    private static XmlMapper createMapper() {
        XMLInputFactory input = XMLInputFactory.newFactory();
        input.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        input.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        XmlMapper mapper = new XmlMapper(XmlFactory.builder().xmlInputFactory(input).build());
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        return mapper;
    }
}
