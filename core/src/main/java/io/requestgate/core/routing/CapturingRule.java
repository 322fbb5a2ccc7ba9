package io.requestgate.core.routing;

import io.requestgate.core.model.RequestDescriptor;
import java.util.List;
import java.util.Optional;

/**
 * A {@link Rule} whose successful match produces values, such as the typed segments of a path.
 * The values are returned to the caller for the request at hand and never kept on the rule.
 *
 * @param <E> the type of the per-route expected value
 */
public interface CapturingRule<E> extends Rule<E> {

    /**
     * Matches the request and returns the captured values.
     *
     * @return captured values in order (possibly empty), or empty if the request does not match
     */
    Optional<List<Object>> capture(RequestDescriptor request, E expected);

    @Override
    default boolean check(RequestDescriptor request, E expected) {
        return capture(request, expected).isPresent();
    }
}
