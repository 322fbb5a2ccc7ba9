package io.requestgate.core.routing;

import io.requestgate.core.error.RouteDefinitionException;
import io.requestgate.core.spi.RequestHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The ordered dimensions of a router and its routes, in registration order.
 *
 * <p>
 * Built once at startup through {@link #builder(List)}, which validates every route against the
 * dimensions: one expected value per dimension, of the dimension's expectation type, and no two
 * routes with equal expected values. Immutable and thread-safe after {@link Builder#build()}.
 */
public final class RouteTable {

    private final List<Rule<?>> rules;
    private final List<Route> routes;

    private RouteTable(List<Rule<?>> rules, List<Route> routes) {
        this.rules = List.copyOf(rules);
        this.routes = List.copyOf(routes);
    }

    /** The dimensions, in evaluation order. */
    public List<Rule<?>> rules() {
        return rules;
    }

    /** The routes, in registration order. */
    public List<Route> routes() {
        return routes;
    }

    /** Number of routes. */
    public int size() {
        return routes.size();
    }

    /**
     * Starts a route table over the given dimensions. Their order is the order in which the
     * router evaluates them, and therefore decides which rejection a request gets when it fails
     * several dimensions.
     *
     * @throws RouteDefinitionException if {@code rules} is empty or names a dimension twice
     */
    public static Builder builder(List<? extends Rule<?>> rules) {
        return new Builder(rules);
    }

    /** Shorthand for {@code builder(List.of(rules))}. */
    public static Builder builder(Rule<?>... rules) {
        return new Builder(Arrays.asList(rules));
    }

    /** Collects routes and validates them against the dimensions. Not thread-safe. */
    public static final class Builder {

        private final List<Rule<?>> rules;
        private final List<Route> routes = new ArrayList<>();
        private String source;

        private Builder(List<? extends Rule<?>> rules) {
            Objects.requireNonNull(rules, "rules must not be null");
            if (rules.isEmpty()) {
                throw new RouteDefinitionException("A route table needs at least one dimension", null);
            }
            List<String> seen = new ArrayList<>();
            for (Rule<?> rule : rules) {
                Objects.requireNonNull(rule, "rule must not be null");
                if (seen.contains(rule.dimension())) {
                    throw new RouteDefinitionException("Dimension '" + rule.dimension() + "' listed twice", null);
                }
                seen.add(rule.dimension());
            }
            this.rules = List.copyOf(rules);
        }

        /** Names the file the routes come from, reported in {@link RouteDefinitionException}s. */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * Adds a route named after its position.
         *
         * @param handler  the handler to dispatch to
         * @param expected one expected value per dimension, in dimension order
         */
        public Builder route(RequestHandler handler, Object... expected) {
            return route("route[" + routes.size() + "]", handler, expected);
        }

        /**
         * Adds a named route.
         *
         * @throws RouteDefinitionException if the arity or a value type is wrong, or an equal
         *                                  route was already added
         */
        public Builder route(String name, RequestHandler handler, Object... expected) {
            Objects.requireNonNull(handler, "handler must not be null");
            List<Object> values = Arrays.asList(expected != null ? expected : new Object[] {null});
            if (values.size() != rules.size()) {
                throw new RouteDefinitionException(
                        String.format(
                                "Route '%s' has %d expected values but the table has %d dimensions %s",
                                name, values.size(), rules.size(), dimensionNames()),
                        source);
            }
            for (int i = 0; i < rules.size(); i++) {
                Rule<?> rule = rules.get(i);
                Object value = values.get(i);
                if (value == null && !rule.acceptsNullExpectation()) {
                    throw new RouteDefinitionException(
                            String.format("Route '%s': dimension '%s' requires a value", name, rule.dimension()),
                            source);
                }
                if (value != null && !rule.expectationType().isInstance(value)) {
                    throw new RouteDefinitionException(
                            String.format(
                                    "Route '%s': dimension '%s' expects %s, got %s",
                                    name,
                                    rule.dimension(),
                                    rule.expectationType().getSimpleName(),
                                    value.getClass().getSimpleName()),
                            source);
                }
            }
            for (Route existing : routes) {
                if (existing.expectations().equals(values)) {
                    throw new RouteDefinitionException(
                            String.format("Route '%s' duplicates route '%s'", name, existing.name()), source);
                }
            }
            routes.add(new Route(name, values, handler));
            return this;
        }

        public RouteTable build() {
            return new RouteTable(rules, routes);
        }

        private List<String> dimensionNames() {
            List<String> names = new ArrayList<>();
            for (Rule<?> rule : rules) {
                names.add(rule.dimension());
            }
            return names;
        }
    }
}
