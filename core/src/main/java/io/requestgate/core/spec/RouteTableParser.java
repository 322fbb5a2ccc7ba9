package io.requestgate.core.spec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.requestgate.core.auth.BasicAuthHandler;
import io.requestgate.core.error.RouteDefinitionException;
import io.requestgate.core.routing.ContentTypeRule;
import io.requestgate.core.routing.ConverterRegistry;
import io.requestgate.core.routing.MethodRule;
import io.requestgate.core.routing.PathRule;
import io.requestgate.core.routing.RouteTable;
import io.requestgate.core.routing.Rule;
import io.requestgate.core.routing.Rules;
import io.requestgate.core.shape.Filter;
import io.requestgate.core.shape.JsonBodyHandler;
import io.requestgate.core.shape.XmlBodyHandler;
import io.requestgate.core.spi.CredentialChecker;
import io.requestgate.core.spi.RequestHandler;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML route files into a {@link RouteTable}.
 *
 * <pre>{@code
 * dimensions: [path, method, content-type]
 * routes:
 *   - path: "/items/{int}"
 *     method: GET
 *     handler: show-item
 *   - path: "/items"
 *     method: POST
 *     content-type: json
 *     handler: create-item
 *     body-shape: create-item
 *     basic-auth: true
 * }</pre>
 *
 * <p>
 * {@code dimensions} defaults to {@code [path, method, content-type]}; its order is the order in
 * which the router narrows, and so decides which rejection wins. Handlers and shapes are
 * resolved by name against the maps given at construction. A route with {@code body-shape} (or
 * {@code json-body: true}) is wrapped in a {@link JsonBodyHandler}, one with
 * {@code xml-body: true} in an {@link XmlBodyHandler}. A route with {@code basic-auth: true} is
 * then wrapped in a {@link BasicAuthHandler}, so credentials are checked before the body is
 * read.
 *
 * <p>
 * Thread-safe if the given maps are not modified.
 */
public final class RouteTableParser {

    private static final Logger LOG = LoggerFactory.getLogger(RouteTableParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> ROUTE_KEYS = Set.of(
            "name", "path", "method", "content-type", "handler", "body-shape", "json-body", "xml-body", "basic-auth");

    private final Map<String, RequestHandler> handlers;
    private final Map<String, Filter> shapes;
    private final ConverterRegistry converters;
    private final CredentialChecker credentials;
    private final String realm;

    /** A parser without authentication support and with the default converters. */
    public RouteTableParser(Map<String, RequestHandler> handlers, Map<String, Filter> shapes) {
        this(handlers, shapes, ConverterRegistry.withDefaults(), null, BasicAuthHandler.DEFAULT_REALM);
    }

    /**
     * @param handlers    route targets by name
     * @param shapes      body shapes by name
     * @param converters  converters available to path templates
     * @param credentials checker for {@code basic-auth} routes, or {@code null} to reject such
     *                    routes
     * @param realm       realm announced in authentication challenges
     */
    public RouteTableParser(
            Map<String, RequestHandler> handlers,
            Map<String, Filter> shapes,
            ConverterRegistry converters,
            CredentialChecker credentials,
            String realm) {
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.shapes = Objects.requireNonNull(shapes, "shapes must not be null");
        this.converters = Objects.requireNonNull(converters, "converters must not be null");
        this.credentials = credentials;
        this.realm = Objects.requireNonNull(realm, "realm must not be null");
    }

    /**
     * Parses the route file at the given path.
     *
     * @throws RouteDefinitionException if the file cannot be read or an entry is malformed
     */
    public RouteTable parse(Path path) {
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new RouteDefinitionException("Failed to read route YAML: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Parses routes from YAML text.
     *
     * @param yaml   the document
     * @param source name reported in errors
     */
    public RouteTable parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new RouteDefinitionException("Failed to parse route YAML: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    private RouteTable parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new RouteDefinitionException("Route file must be a mapping with a 'routes' key", source);
        }
        List<Rule<?>> rules = parseDimensions(root.get("dimensions"), source);

        JsonNode routesNode = root.get("routes");
        if (routesNode == null || !routesNode.isArray() || routesNode.isEmpty()) {
            throw new RouteDefinitionException("Route file must contain a non-empty 'routes' list", source);
        }

        RouteTable.Builder builder = RouteTable.builder(rules).source(source);
        for (int i = 0; i < routesNode.size(); i++) {
            parseEntry(routesNode.get(i), rules, builder, source, i);
        }
        RouteTable table = builder.build();
        LOG.info("Loaded {} route(s) from {} with dimensions {}", table.size(), source, dimensionNames(rules));
        return table;
    }

    // --- Private helpers ---

    private List<Rule<?>> parseDimensions(JsonNode node, String source) {
        if (node == null || node.isNull()) {
            return Rules.defaults();
        }
        if (!node.isArray() || node.isEmpty()) {
            throw new RouteDefinitionException("'dimensions' must be a non-empty list", source);
        }
        List<Rule<?>> rules = new ArrayList<>();
        for (JsonNode dimension : node) {
            String name = dimension.asText();
            Rule<?> rule = Rules.byDimension(name)
                    .orElseThrow(() -> new RouteDefinitionException(
                            "Unknown dimension '" + name + "', expected path, method or content-type", source));
            rules.add(rule);
        }
        return rules;
    }

    private void parseEntry(JsonNode entry, List<Rule<?>> rules, RouteTable.Builder builder, String source, int index) {
        if (entry == null || !entry.isObject()) {
            throw entryError(index, "must be a mapping", source);
        }
        Iterator<String> keys = entry.fieldNames();
        while (keys.hasNext()) {
            String key = keys.next();
            if (!ROUTE_KEYS.contains(key)) {
                throw entryError(index, "unknown key '" + key + "'", source);
            }
        }

        String name = optionalString(entry, "name");
        if (name == null) {
            name = "route[" + index + "]";
        }

        Object[] expected = new Object[rules.size()];
        for (int d = 0; d < rules.size(); d++) {
            expected[d] = expectation(entry, rules.get(d), source, index);
        }
        for (String dimension : List.of(
                PathRule.INSTANCE.dimension(), MethodRule.INSTANCE.dimension(), ContentTypeRule.INSTANCE.dimension())) {
            if (entry.has(dimension) && rules.stream().noneMatch(r -> r.dimension().equals(dimension))) {
                throw entryError(index, "'" + dimension + "' is not a configured dimension", source);
            }
        }

        builder.route(name, handlerFor(entry, source, index), expected);
    }

    private Object expectation(JsonNode entry, Rule<?> rule, String source, int index) {
        String dimension = rule.dimension();
        if (rule == PathRule.INSTANCE) {
            String template = requireString(entry, dimension, source, index);
            try {
                return converters.parse(template);
            } catch (IllegalArgumentException e) {
                throw entryError(index, "invalid path template '" + template + "': " + e.getMessage(), source);
            }
        }
        if (rule == MethodRule.INSTANCE) {
            return requireString(entry, dimension, source, index);
        }
        // content-type: absent or null means the request must carry none
        JsonNode node = entry.get(dimension);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw entryError(index, "'" + dimension + "' must be a string or null", source);
        }
        return node.asText();
    }

    private RequestHandler handlerFor(JsonNode entry, String source, int index) {
        String handlerName = requireString(entry, "handler", source, index);
        RequestHandler handler = handlers.get(handlerName);
        if (handler == null) {
            throw entryError(index, "unknown handler '" + handlerName + "'", source);
        }

        String shapeName = optionalString(entry, "body-shape");
        boolean xmlBody = optionalBoolean(entry, "xml-body", source, index);
        if (xmlBody && (shapeName != null || optionalBoolean(entry, "json-body", source, index))) {
            throw entryError(index, "'xml-body' cannot be combined with 'body-shape' or 'json-body'", source);
        }
        if (xmlBody) {
            handler = new XmlBodyHandler(handler);
        } else if (shapeName != null) {
            Filter shape = shapes.get(shapeName);
            if (shape == null) {
                throw entryError(index, "unknown shape '" + shapeName + "'", source);
            }
            handler = new JsonBodyHandler(handler, shape);
        } else if (optionalBoolean(entry, "json-body", source, index)) {
            handler = new JsonBodyHandler(handler);
        }

        if (optionalBoolean(entry, "basic-auth", source, index)) {
            if (credentials == null) {
                throw entryError(index, "'basic-auth' requires configured users", source);
            }
            handler = new BasicAuthHandler(handler, credentials, realm);
        }
        return handler;
    }

    private String requireString(JsonNode entry, String field, String source, int index) {
        JsonNode node = entry.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw entryError(index, "missing required field '" + field + "'", source);
        }
        return node.asText();
    }

    private String optionalString(JsonNode node, String field) {
        JsonNode child = node.get(field);
        return (child != null && child.isTextual()) ? child.asText() : null;
    }

    private boolean optionalBoolean(JsonNode entry, String field, String source, int index) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            return false;
        }
        if (!node.isBoolean()) {
            throw entryError(index, "'" + field + "' must be true or false", source);
        }
        return node.booleanValue();
    }

    private static RouteDefinitionException entryError(int index, String message, String source) {
        return new RouteDefinitionException(String.format("routes[%d]: %s", index, message), source);
    }

    private static List<String> dimensionNames(List<Rule<?>> rules) {
        List<String> names = new ArrayList<>();
        for (Rule<?> rule : rules) {
            names.add(rule.dimension());
        }
        return names;
    }
}
