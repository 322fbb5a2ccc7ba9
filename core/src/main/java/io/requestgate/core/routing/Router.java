package io.requestgate.core.routing;

import io.requestgate.core.error.RequestRejectedException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.model.RequestDescriptor;
import io.requestgate.core.spi.RequestHandler;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Narrows the routes of a {@link RouteTable} one dimension at a time and dispatches to the
 * survivor.
 *
 * <p>
 * Evaluation (short-circuit): the candidate set starts with every route; each dimension, in
 * table order, keeps only the routes whose expected value passes that dimension's rule. The
 * first dimension that leaves no candidate raises its own rejection and later dimensions are not
 * evaluated, so a request that fails both method and content-type gets the rejection of
 * whichever dimension comes first.
 *
 * <p>
 * If several routes survive every dimension, the first registered one is selected.
 *
 * <p>
 * Thread-safe and stateless: values captured by path patterns are returned in the
 * {@link RouteMatch} or bound to the request's {@link RequestContext}, never stored on the
 * router or its rules.
 */
public final class Router implements RequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(Router.class);

    private final RouteTable table;

    public Router(RouteTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /** The route table this router dispatches over. */
    public RouteTable table() {
        return table;
    }

    /**
     * Selects the route for a request.
     *
     * @param request the inbound request
     * @return the selected route and its captured path values
     * @throws RequestRejectedException the rejection of the first dimension that eliminated
     *                                  every candidate
     */
    public RouteMatch route(RequestDescriptor request) {
        List<Route> candidates = table.routes();
        Map<Route, List<Object>> captured = new IdentityHashMap<>();
        List<Rule<?>> rules = table.rules();

        for (int i = 0; i < rules.size(); i++) {
            List<Route> survivors = narrow(rules.get(i), i, request, candidates, captured);
            if (survivors.isEmpty()) {
                RequestRejectedException rejection = reject(rules.get(i), i, request, candidates);
                LOG.debug(
                        "Request {} {} rejected on dimension '{}' ({} candidates): {} {}",
                        request.method(),
                        request.path(),
                        rules.get(i).dimension(),
                        candidates.size(),
                        rejection.status(),
                        rejection.getMessage());
                throw rejection;
            }
            candidates = survivors;
        }

        Route selected = candidates.get(0);
        if (candidates.size() > 1 && LOG.isDebugEnabled()) {
            List<String> names = new ArrayList<>();
            for (Route candidate : candidates) {
                names.add(candidate.name());
            }
            LOG.debug(
                    "Ambiguous routes for {} {}: {}; selecting first registered '{}'",
                    request.method(),
                    request.path(),
                    names,
                    selected.name());
        }
        List<Object> pathValues = captured.getOrDefault(selected, List.of());
        LOG.debug("Request {} {} matched route '{}'", request.method(), request.path(), selected.name());
        return new RouteMatch(selected, pathValues);
    }

    /**
     * Routes the request, binds the captured path values to {@code ctx} and calls the selected
     * route's handler.
     */
    @Override
    public GateResponse handle(RequestContext ctx) throws Exception {
        RouteMatch match = route(ctx.request());
        ctx.bindPathValues(match.pathValues());
        return match.route().handler().handle(ctx);
    }

    private static <E> List<Route> narrow(
            Rule<E> rule,
            int index,
            RequestDescriptor request,
            List<Route> candidates,
            Map<Route, List<Object>> captured) {
        List<Route> survivors = new ArrayList<>(candidates.size());
        for (Route route : candidates) {
            E expected = rule.expectationType().cast(route.expectation(index));
            if (rule instanceof CapturingRule<E> capturing) {
                var values = capturing.capture(request, expected);
                if (values.isPresent()) {
                    captured.merge(route, values.get(), Router::concat);
                    survivors.add(route);
                }
            } else if (rule.check(request, expected)) {
                survivors.add(route);
            }
        }
        return survivors;
    }

    private static <E> RequestRejectedException reject(
            Rule<E> rule, int index, RequestDescriptor request, List<Route> candidates) {
        List<E> expectations = new ArrayList<>(candidates.size());
        for (Route route : candidates) {
            expectations.add(rule.expectationType().cast(route.expectation(index)));
        }
        return rule.errorFor(request, expectations);
    }

    private static List<Object> concat(List<Object> first, List<Object> second) {
        List<Object> joined = new ArrayList<>(first);
        joined.addAll(second);
        return joined;
    }
}
