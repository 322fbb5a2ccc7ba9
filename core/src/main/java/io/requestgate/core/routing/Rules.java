package io.requestgate.core.routing;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The built-in rules, addressable by dimension name. */
public final class Rules {

    private static final Map<String, Rule<?>> BY_DIMENSION = Map.of(
            PathRule.INSTANCE.dimension(), PathRule.INSTANCE,
            MethodRule.INSTANCE.dimension(), MethodRule.INSTANCE,
            ContentTypeRule.INSTANCE.dimension(), ContentTypeRule.INSTANCE);

    private Rules() {}

    /** The usual dimension order: path, then method, then content-type. */
    public static List<Rule<?>> defaults() {
        return List.of(PathRule.INSTANCE, MethodRule.INSTANCE, ContentTypeRule.INSTANCE);
    }

    /** Looks up a built-in rule by its dimension name. */
    public static Optional<Rule<?>> byDimension(String dimension) {
        return Optional.ofNullable(BY_DIMENSION.get(dimension));
    }
}
