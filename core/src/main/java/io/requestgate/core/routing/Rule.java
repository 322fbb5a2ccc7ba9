package io.requestgate.core.routing;

import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.model.RequestDescriptor;
import java.util.List;

/**
 * One matching dimension of the {@link Router}: decides whether a request satisfies the value a
 * route expects for this dimension.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe. A single rule instance is shared by every
 * route table it appears in and by all concurrently handled requests; anything produced per
 * request is returned, never stored (see {@link CapturingRule}).
 *
 * @param <E> the type of the per-route expected value
 */
public interface Rule<E> {

    /** Dimension name used in logs and route configuration, e.g. {@code method}. */
    String dimension();

    /** Type every expected value of this dimension must have. */
    Class<E> expectationType();

    /** Whether {@code null} is a meaningful expected value. */
    default boolean acceptsNullExpectation() {
        return false;
    }

    /**
     * Checks the request against one route's expected value.
     *
     * @param request  the inbound request
     * @param expected the route's expected value for this dimension
     * @return {@code true} if the route may serve the request as far as this dimension is
     *         concerned
     */
    boolean check(RequestDescriptor request, E expected);

    /**
     * The rejection raised when this dimension eliminates every remaining route.
     *
     * @param request    the inbound request
     * @param candidates expected values of the routes that reached this dimension, in
     *                   registration order
     * @return the exception to throw; never {@code null}
     */
    RequestRejectedException errorFor(RequestDescriptor request, List<E> candidates);
}
