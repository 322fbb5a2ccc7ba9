package io.requestgate.core.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request state shared by the handler chain: the request itself, the path values captured by
 * the router, and attributes set by middleware (parsed body, authenticated user).
 *
 * <p>
 * One instance per request, created by the hosting adapter and discarded when the response has
 * been written. Not thread-safe; a request is handled on one thread at a time.
 */
public final class RequestContext {

    private final RequestDescriptor request;
    private final Map<String, Object> attributes = new HashMap<>();
    private List<Object> pathValues = List.of();

    public RequestContext(RequestDescriptor request) {
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    /** The inbound request. */
    public RequestDescriptor request() {
        return request;
    }

    /** Values captured from the generic path segments of the matched route, in pattern order. */
    public List<Object> pathValues() {
        return pathValues;
    }

    /**
     * A captured path value by position.
     *
     * @throws IndexOutOfBoundsException if the route captured fewer values
     * @throws ClassCastException        if the value has another type
     */
    public <T> T pathValue(int index, Class<T> type) {
        return type.cast(pathValues.get(index));
    }

    /** Publishes the path values of the matched route. Called by the router. */
    public void bindPathValues(List<Object> values) {
        this.pathValues = List.copyOf(values);
    }

    /** Sets an attribute, replacing any previous value. */
    public void setAttribute(String name, Object value) {
        attributes.put(Objects.requireNonNull(name, "name must not be null"), value);
    }

    /** Reads an attribute, empty if absent. */
    public <T> Optional<T> attribute(String name, Class<T> type) {
        return Optional.ofNullable(attributes.get(name)).map(type::cast);
    }

    /**
     * Reads an attribute that an earlier handler in the chain must have set.
     *
     * @throws IllegalStateException if the attribute is absent
     */
    public <T> T requireAttribute(String name, Class<T> type) {
        return attribute(name, type)
                .orElseThrow(() -> new IllegalStateException("Request attribute '" + name + "' is not set"));
    }
}
