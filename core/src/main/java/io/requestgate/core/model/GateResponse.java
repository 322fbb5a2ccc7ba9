package io.requestgate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A response produced by a {@link io.requestgate.core.spi.RequestHandler}. The hosting adapter
 * writes it to the wire; the body's media type becomes the Content-Type unless the headers
 * already carry one.
 *
 * @param status  the HTTP status code
 * @param headers response headers
 * @param body    response body
 */
public record GateResponse(int status, HttpHeaders headers, MessageBody body) {

    /** Validates the status and defaults headers and body. */
    public GateResponse {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("Status code must be between 100 and 599, got: " + status);
        }
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        if (body == null) {
            body = MessageBody.empty();
        }
    }

    /** An empty response with the given status. */
    public static GateResponse of(int status) {
        return new GateResponse(status, HttpHeaders.empty(), MessageBody.empty());
    }

    /** A {@code text/plain} response. */
    public static GateResponse text(int status, String text) {
        return new GateResponse(status, HttpHeaders.empty(), MessageBody.of(text, MediaType.TEXT));
    }

    /** An {@code application/json} response. */
    public static GateResponse json(int status, JsonNode json) {
        Objects.requireNonNull(json, "json must not be null");
        return new GateResponse(status, HttpHeaders.empty(), MessageBody.of(json.toString(), MediaType.JSON));
    }

    /** A {@code text/html} response. */
    public static GateResponse html(int status, String html) {
        return new GateResponse(status, HttpHeaders.empty(), MessageBody.of(html, MediaType.HTML));
    }

    /** Returns a copy with the header value appended. */
    public GateResponse withHeader(String name, String value) {
        return new GateResponse(status, headers.with(name, value), body);
    }

    /** Returns a copy in which {@code extra} replaces headers of the same name. */
    public GateResponse withHeaders(HttpHeaders extra) {
        return new GateResponse(status, headers.merge(extra), body);
    }

    /** The Content-Type to send: an explicit header wins over the body's media type. */
    public String contentType() {
        String explicit = headers.first("Content-Type");
        return explicit != null ? explicit : body.mediaType().value();
    }
}
