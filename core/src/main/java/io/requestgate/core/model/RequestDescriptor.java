package io.requestgate.core.model;

import io.requestgate.core.spi.BodySource;
import java.util.Objects;

/**
 * What the router and the body handlers see of an inbound request. Built by the hosting adapter
 * once per request.
 *
 * @param method      the HTTP method, as sent (matching is case-sensitive)
 * @param path        the request path without query string
 * @param contentType the raw Content-Type header value, or {@code null} if the request declares
 *                    none
 * @param headers     all request headers
 * @param body        the body source, read at most once
 */
public record RequestDescriptor(String method, String path, String contentType, HttpHeaders headers, BodySource body) {

    /** Validates required fields, defaults headers and body. */
    public RequestDescriptor {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (headers == null) {
            headers = HttpHeaders.empty();
        }
        if (body == null) {
            body = BodySource.empty();
        }
    }

    /** A body-less request with no headers. */
    public static RequestDescriptor of(String method, String path) {
        return new RequestDescriptor(method, path, null, HttpHeaders.empty(), BodySource.empty());
    }

    /** A request with an in-memory body and the given content-type. */
    public static RequestDescriptor of(String method, String path, String contentType, byte[] body) {
        return new RequestDescriptor(method, path, contentType, HttpHeaders.empty(), BodySource.of(body));
    }

    /** Returns a copy with the given headers. */
    public RequestDescriptor withHeaders(HttpHeaders newHeaders) {
        return new RequestDescriptor(method, path, contentType, newHeaders, body);
    }
}
