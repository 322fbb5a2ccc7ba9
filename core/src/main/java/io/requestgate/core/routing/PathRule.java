package io.requestgate.core.routing;

import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.error.RouteNotFoundException;
import io.requestgate.core.model.PathPattern;
import io.requestgate.core.model.RequestDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * Matches the request path against each route's {@link PathPattern} and captures the converted
 * generic segments. Rejects with 404.
 */
public final class PathRule implements CapturingRule<PathPattern> {

    /** Shared instance; the rule holds no state. */
    public static final PathRule INSTANCE = new PathRule();

    private PathRule() {}

    @Override
    public String dimension() {
        return "path";
    }

    @Override
    public Class<PathPattern> expectationType() {
        return PathPattern.class;
    }

    @Override
    public Optional<List<Object>> capture(RequestDescriptor request, PathPattern expected) {
        return PathMatcher.match(expected, request.path());
    }

    @Override
    public RequestRejectedException errorFor(RequestDescriptor request, List<PathPattern> candidates) {
        return new RouteNotFoundException("Path not found");
    }
}
