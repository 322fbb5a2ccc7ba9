package io.requestgate.core.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.HttpHeaders;
import io.requestgate.core.model.MediaType;
import io.requestgate.core.model.MessageBody;
import io.requestgate.core.spi.ErrorRenderer;

/**
 * Renders errors as RFC 9457 Problem Details ({@code application/problem+json}):
 *
 * <pre>{@code
 * {
 * "type": "urn:request-gate:error:method-not-allowed",
 * "title": "Method Not Allowed",
 * "status": 405,
 * "detail": "Method not allowed",
 * "instance": "/create"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ProblemDetailRenderer implements ErrorRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean pretty;

    /** Compact output. */
    public ProblemDetailRenderer() {
        this(false);
    }

    /** @param pretty whether to indent the JSON for human readers */
    public ProblemDetailRenderer(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    public GateResponse render(int status, String type, String detail, String instance) {
        JsonNode problem = build(status, type, detail, instance);
        String text;
        try {
            text = pretty ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(problem) : problem.toString();
        } catch (JsonProcessingException e) {
            // an ObjectNode of strings and ints always serializes
            throw new IllegalStateException("Failed to serialize problem detail", e);
        }
        return new GateResponse(status, HttpHeaders.empty(), MessageBody.of(text, MediaType.PROBLEM_JSON));
    }

    /** Builds the Problem Details object. {@code instance} is JSON null when unknown. */
    public static JsonNode build(int status, String type, String detail, String instance) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type != null ? type : "about:blank");
        node.put("title", HttpStatus.reasonPhrase(status));
        node.put("status", status);
        if (detail != null) {
            node.put("detail", detail);
        }
        if (instance != null) {
            node.put("instance", instance);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}
