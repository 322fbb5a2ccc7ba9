package io.requestgate.core.routing;

import io.requestgate.core.error.MethodNotAllowedException;
import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.model.RequestDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Matches the request method by exact, case-sensitive equality: {@code "GET"} does not match
 * {@code "get"}. Rejects with 405 and an {@code Allow} header naming the methods of the routes
 * that reached this dimension.
 */
public final class MethodRule implements Rule<String> {

    /** Shared instance; the rule holds no state. */
    public static final MethodRule INSTANCE = new MethodRule();

    private MethodRule() {}

    @Override
    public String dimension() {
        return "method";
    }

    @Override
    public Class<String> expectationType() {
        return String.class;
    }

    @Override
    public boolean check(RequestDescriptor request, String expected) {
        return expected.equals(request.method());
    }

    @Override
    public RequestRejectedException errorFor(RequestDescriptor request, List<String> candidates) {
        return new MethodNotAllowedException("Method not allowed", new ArrayList<>(new LinkedHashSet<>(candidates)));
    }
}
