package io.requestgate.core.routing;

import io.requestgate.core.spi.RequestHandler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@link RouteTable}: an expected value per dimension and the handler to dispatch
 * to. Expected values may be {@code null} where the dimension allows it (no content-type).
 *
 * <p>
 * Immutable, thread-safe: created when the route table is built.
 *
 * @param name         a label for logs (handler name from configuration, or {@code route[i]})
 * @param expectations expected values in dimension order
 * @param handler      the handler to dispatch to
 */
public record Route(String name, List<Object> expectations, RequestHandler handler) {

    /** Validates required fields and freezes the expectations. */
    public Route {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expectations, "expectations must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        expectations = Collections.unmodifiableList(new ArrayList<>(expectations));
    }

    /** Expected value for the dimension at {@code index}; may be {@code null}. */
    public Object expectation(int index) {
        return expectations.get(index);
    }
}
