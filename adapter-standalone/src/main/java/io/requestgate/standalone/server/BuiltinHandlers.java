package io.requestgate.standalone.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.requestgate.core.auth.BasicAuthHandler;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.shape.JsonBodyHandler;
import io.requestgate.core.shape.XmlBodyHandler;
import io.requestgate.core.spi.RequestHandler;
import java.util.Map;

/**
 * Route targets available to route files without writing code:
 * <ul>
 * <li>{@code echo}: returns method, path, captured path values, the authenticated user and the
 * parsed body as JSON;</li>
 * <li>{@code status}: returns {@code {"status":"UP"}}.</li>
 * </ul>
 */
public final class BuiltinHandlers {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BuiltinHandlers() {
        // utility class
    }

    /** The built-in handlers by name. */
    public static Map<String, RequestHandler> all() {
        return Map.of("echo", BuiltinHandlers::echo, "status", BuiltinHandlers::status);
    }

    static GateResponse echo(RequestContext ctx) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("method", ctx.request().method());
        node.put("path", ctx.request().path());
        node.set("pathValues", MAPPER.valueToTree(ctx.pathValues()));
        ctx.attribute(BasicAuthHandler.USER, String.class).ifPresent(user -> node.put("user", user));
        ctx.attribute(JsonBodyHandler.JSON_BODY, JsonNode.class).ifPresent(body -> node.set("body", body));
        ctx.attribute(XmlBodyHandler.XML_BODY, JsonNode.class).ifPresent(body -> node.set("body", body));
        return GateResponse.json(200, node);
    }

    static GateResponse status(RequestContext ctx) {
        return GateResponse.json(200, MAPPER.createObjectNode().put("status", "UP"));
    }
}
