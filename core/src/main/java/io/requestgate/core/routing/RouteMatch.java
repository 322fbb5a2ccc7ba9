package io.requestgate.core.routing;

import java.util.List;
import java.util.Objects;

/**
 * Result of routing one request: the selected route and the values its path pattern captured.
 * Created per request and never shared.
 *
 * @param route      the selected route
 * @param pathValues converted generic path segments, in pattern order
 */
public record RouteMatch(Route route, List<Object> pathValues) {

    /** Validates required fields. */
    public RouteMatch {
        Objects.requireNonNull(route, "route must not be null");
        pathValues = List.copyOf(pathValues);
    }
}
