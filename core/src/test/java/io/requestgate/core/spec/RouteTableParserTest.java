package io.requestgate.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.requestgate.core.auth.BasicAuthHandler;
import io.requestgate.core.auth.StaticCredentialChecker;
import io.requestgate.core.error.AuthenticationRequiredException;
import io.requestgate.core.error.RouteDefinitionException;
import io.requestgate.core.error.ShapeValidationException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.HttpHeaders;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.model.RequestDescriptor;
import io.requestgate.core.routing.ConverterRegistry;
import io.requestgate.core.routing.Router;
import io.requestgate.core.routing.RouteMatch;
import io.requestgate.core.routing.RouteTable;
import io.requestgate.core.shape.Filter;
import io.requestgate.core.shape.JsonBodyHandler;
import io.requestgate.core.shape.XmlBodyHandler;
import io.requestgate.core.spi.RequestHandler;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Tests for {@link RouteTableParser}. */
@DisplayName("RouteTableParser")
class RouteTableParserTest {

    private static final RequestHandler SHOW = ctx -> GateResponse.text(200, "item " + ctx.pathValues());
    private static final RequestHandler CREATE = ctx -> GateResponse.json(201, JsonBodyHandler.body(ctx));

    private static final Map<String, RequestHandler> HANDLERS = Map.of("show", SHOW, "create", CREATE);

    private final Map<String, Filter> shapes = loadShapes();

    private final RouteTableParser parser = new RouteTableParser(
            HANDLERS,
            shapes,
            ConverterRegistry.withDefaults(),
            new StaticCredentialChecker(Map.of("admin", "pw")),
            "gate");

    private static Map<String, Filter> loadShapes() {
        return new ShapeParser().parse("shapes:\n  create-item:\n    type: object\n    properties:\n"
                + "      id: { type: int, min: 0 }\n", "shapes.yaml");
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(RouteTableParserTest.class.getResource("/fixtures/" + name).toURI());
    }

    private static GateResponse call(Router router, RequestDescriptor request) throws Exception {
        return router.handle(new RequestContext(request));
    }

    @Nested
    @DisplayName("Fixture file")
    class Fixture {

        @Test
        @DisplayName("routes are built in file order with their names")
        void routes() throws Exception {
            RouteTable table = parser.parse(fixture("routes.yaml"));

            assertThat(table.size()).isEqualTo(3);
            assertThat(table.routes()).extracting(r -> r.name()).containsExactly("show-item", "create-item", "admin");
            assertThat(table.rules()).extracting(r -> r.dimension()).containsExactly("path", "method", "content-type");
        }

        @Test
        @DisplayName("path template captures are converted")
        void pathCaptures() throws Exception {
            Router router = new Router(parser.parse(fixture("routes.yaml")));

            RouteMatch match = router.route(RequestDescriptor.of("GET", "/items/42"));

            assertThat(match.route().name()).isEqualTo("show-item");
            assertThat(match.pathValues()).containsExactly(42);
            assertThat(call(router, RequestDescriptor.of("GET", "/items/42")).body().asString())
                    .isEqualTo("item [42]");
        }

        @Test
        @DisplayName("body-shape routes validate the body")
        void bodyShape() throws Exception {
            Router router = new Router(parser.parse(fixture("routes.yaml")));

            GateResponse created = call(router, RequestDescriptor.of(
                    "POST", "/items", "application/json", "{\"id\": 7}".getBytes(StandardCharsets.UTF_8)));
            assertThat(created.status()).isEqualTo(201);

            assertThatThrownBy(() -> call(router, RequestDescriptor.of(
                            "POST", "/items", "application/json", "{\"id\": -7}".getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(ShapeValidationException.class)
                    .hasMessage("id: expected number not less than 0, found -7");
        }

        @Test
        @DisplayName("basic-auth routes challenge before anything else")
        void basicAuth() throws Exception {
            Router router = new Router(parser.parse(fixture("routes.yaml")));

            assertThatThrownBy(() -> call(router, RequestDescriptor.of("GET", "/admin")))
                    .isInstanceOfSatisfying(AuthenticationRequiredException.class, e -> assertThat(
                                    e.headers().first("WWW-Authenticate"))
                            .isEqualTo("Basic realm=\"gate\""));

            String credentials = Base64.getEncoder().encodeToString("admin:pw".getBytes(StandardCharsets.UTF_8));
            RequestDescriptor authorized = RequestDescriptor.of("GET", "/admin")
                    .withHeaders(HttpHeaders.of(Map.of("Authorization", "Basic " + credentials)));
            assertThat(call(router, authorized).status()).isEqualTo(200);
        }

        @Test
        @DisplayName("basic-auth wraps the body handler")
        void authOutsideBody(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("routes.yaml"), String.join("\n",
                    "routes:",
                    "  - { path: /x, method: POST, content-type: json, handler: create,"
                            + " body-shape: create-item, basic-auth: true }"));

            RouteTable table = parser.parse(file);

            RequestHandler handler = table.routes().get(0).handler();
            assertThat(handler).isInstanceOf(BasicAuthHandler.class);
        }
    }

    @Test
    @DisplayName("xml-body routes parse the body as XML")
    void xmlBody() throws Exception {
        RequestHandler echo = ctx -> GateResponse.json(200, XmlBodyHandler.body(ctx));
        RouteTableParser xmlParser = new RouteTableParser(Map.of("echo", echo), shapes);
        RouteTable table = xmlParser.parse(
                "routes:\n  - { path: /import, method: POST, content-type: xml, handler: echo, xml-body: true }\n",
                "inline");
        Router router = new Router(table);

        assertThat(table.routes().get(0).handler()).isInstanceOf(XmlBodyHandler.class);
        GateResponse response = call(router, RequestDescriptor.of(
                "POST", "/import", "application/xml", "<item><id>5</id></item>".getBytes(StandardCharsets.UTF_8)));
        assertThat(response.body().asString()).isEqualTo("{\"id\":\"5\"}");
    }

    @Test
    @DisplayName("dimensions default to path, method, content-type")
    void defaultDimensions() {
        RouteTable table = parser.parse("routes:\n  - { path: /, method: GET, handler: show }\n", "inline");

        assertThat(table.rules()).extracting(r -> r.dimension()).containsExactly("path", "method", "content-type");
        assertThat(table.routes().get(0).name()).isEqualTo("route[0]");
        assertThat(table.routes().get(0).expectation(2)).isNull();
    }

    @Test
    @DisplayName("custom dimension order is kept")
    void customDimensions() {
        RouteTable table = parser.parse(
                "dimensions: [method, path]\nroutes:\n  - { path: /, method: GET, handler: show }\n", "inline");

        assertThat(table.rules()).extracting(r -> r.dimension()).containsExactly("method", "path");
        assertThat(table.routes().get(0).expectations()).hasSize(2);
    }

    @Test
    @DisplayName("methods are kept as written")
    void methodCase() {
        RouteTable table = parser.parse("routes:\n  - { path: /, method: get, handler: show }\n", "inline");

        assertThat(table.routes().get(0).expectation(1)).isEqualTo("get");
    }

    static Stream<Arguments> invalidRouteFiles() {
        return Stream.of(
                Arguments.of("routes: []", "Route file must contain a non-empty 'routes' list"),
                Arguments.of("dimensions: [host]\nroutes:\n  - { path: /, method: GET, handler: show }",
                        "Unknown dimension 'host', expected path, method or content-type"),
                Arguments.of("dimensions: []\nroutes:\n  - { path: /, method: GET, handler: show }",
                        "'dimensions' must be a non-empty list"),
                Arguments.of("routes:\n  - { path: /, method: GET, handler: nope }",
                        "routes[0]: unknown handler 'nope'"),
                Arguments.of("routes:\n  - { path: /, handler: show }",
                        "routes[0]: missing required field 'method'"),
                Arguments.of("routes:\n  - { method: GET, handler: show }",
                        "routes[0]: missing required field 'path'"),
                Arguments.of("routes:\n  - { path: /, method: GET, handler: show, verb: x }",
                        "routes[0]: unknown key 'verb'"),
                Arguments.of("routes:\n  - { path: /, method: POST, handler: create, body-shape: missing }",
                        "routes[0]: unknown shape 'missing'"),
                Arguments.of("routes:\n  - { path: /, method: POST, handler: create, json-body: true, xml-body: true }",
                        "routes[0]: 'xml-body' cannot be combined with 'body-shape' or 'json-body'"),
                Arguments.of("routes:\n  - { path: /, method: GET, handler: show, basic-auth: yes-please }",
                        "routes[0]: 'basic-auth' must be true or false"),
                Arguments.of("routes:\n  - { path: \"/{date}\", method: GET, handler: show }",
                        "routes[0]: invalid path template '/{date}': No converter registered for name: 'date'"),
                Arguments.of("dimensions: [path, method]\nroutes:\n"
                                + "  - { path: /, method: GET, content-type: json, handler: show }",
                        "routes[0]: 'content-type' is not a configured dimension"),
                Arguments.of("routes:\n  - { path: /, method: GET, handler: show }\n  - \"just text\"",
                        "routes[1]: must be a mapping"));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("invalidRouteFiles")
    void rejected(String yaml, String message) {
        assertThatThrownBy(() -> parser.parse(yaml, "routes.yaml"))
                .isInstanceOfSatisfying(RouteDefinitionException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo(message);
                    assertThat(e.source()).isEqualTo("routes.yaml");
                });
    }

    @Test
    @DisplayName("basic-auth without configured users is rejected")
    void basicAuthWithoutUsers() {
        RouteTableParser anonymous = new RouteTableParser(HANDLERS, shapes);

        assertThatThrownBy(() -> anonymous.parse(
                        "routes:\n  - { path: /, method: GET, handler: show, basic-auth: true }", "routes.yaml"))
                .isInstanceOf(RouteDefinitionException.class)
                .hasMessage("routes[0]: 'basic-auth' requires configured users");
    }

    @Test
    @DisplayName("exact duplicate routes are rejected")
    void duplicates() {
        assertThatThrownBy(() -> parser.parse(String.join("\n",
                        "routes:",
                        "  - { name: a, path: /, method: GET, handler: show }",
                        "  - { name: b, path: /, method: GET, handler: show }"), "routes.yaml"))
                .isInstanceOf(RouteDefinitionException.class)
                .hasMessageContaining("Route 'b' duplicates route 'a'");
    }

    @Test
    @DisplayName("ambiguous but distinct routes are accepted")
    void overlapping() {
        RouteTable table = parser.parse(String.join("\n",
                "routes:",
                "  - { name: any, path: \"/{string}\", method: GET, handler: show }",
                "  - { name: index, path: /index, method: GET, handler: show }"), "routes.yaml");

        assertThat(table.routes()).extracting(r -> r.name()).isEqualTo(List.of("any", "index"));
    }
}
