package io.requestgate.standalone.server;

import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.requestgate.core.auth.StaticCredentialChecker;
import io.requestgate.core.render.ErrorHandlingHandler;
import io.requestgate.core.render.HtmlErrorRenderer;
import io.requestgate.core.render.ProblemDetailRenderer;
import io.requestgate.core.routing.ConverterRegistry;
import io.requestgate.core.routing.RouteTable;
import io.requestgate.core.routing.Router;
import io.requestgate.core.shape.Filter;
import io.requestgate.core.spec.RouteTableParser;
import io.requestgate.core.spec.ShapeParser;
import io.requestgate.core.spi.CredentialChecker;
import io.requestgate.core.spi.ErrorRenderer;
import io.requestgate.core.spi.RequestHandler;
import io.requestgate.standalone.config.ConfigLoader;
import io.requestgate.standalone.config.GateConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone gate server.
 *
 * <ol>
 * <li>Load shapes (if configured) and the route table</li>
 * <li>Wrap the router in an error handler with the configured renderer</li>
 * <li>Start Javalin and send every path and method to the chain</li>
 * </ol>
 *
 * <p>
 * Kept apart from {@link io.requestgate.standalone.StandaloneMain} so tests can start and stop
 * instances without going through {@code main()}.
 */
public final class GateApp {

    private static final Logger LOG = LoggerFactory.getLogger(GateApp.class);

    private static final List<HandlerType> METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private final Javalin app;
    private final Router router;
    private final GateConfig config;

    private GateApp(Javalin app, Router router, GateConfig config) {
        this.app = app;
        this.router = router;
        this.config = config;
    }

    /**
     * Loads configuration from {@code --config}, configures logging and starts with the
     * built-in handlers.
     */
    public static GateApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        GateConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return start(config, BuiltinHandlers.all());
    }

    /**
     * Starts a server for the given configuration.
     *
     * @param config   the configuration
     * @param handlers route targets by name, referenced from the route file
     * @return the running application
     * @throws io.requestgate.core.error.GateLoadException if the shape or route file is invalid
     */
    public static GateApp start(GateConfig config, Map<String, RequestHandler> handlers) {
        long startTime = System.nanoTime();

        Map<String, Filter> shapes = Map.of();
        if (config.shapesFile() != null && !config.shapesFile().isBlank()) {
            shapes = new ShapeParser().parse(Path.of(config.shapesFile()));
        }

        CredentialChecker credentials =
                config.authUsers().isEmpty() ? null : new StaticCredentialChecker(config.authUsers());
        RouteTableParser parser = new RouteTableParser(
                handlers, shapes, ConverterRegistry.withDefaults(), credentials, config.authRealm());
        RouteTable table = parser.parse(Path.of(config.routesFile()));
        Router router = new Router(table);

        ErrorRenderer renderer =
                config.htmlErrors() ? new HtmlErrorRenderer() : new ProblemDetailRenderer(config.errorsPretty());
        GateHandler gateHandler = new GateHandler(new ErrorHandlingHandler(router, renderer), config.maxBodyBytes());

        Javalin app = Javalin.create(javalinConfig -> javalinConfig.showJavalinBanner = false);
        for (HandlerType method : METHODS) {
            app.addHttpHandler(method, "/", gateHandler);
            app.addHttpHandler(method, "/<path>", gateHandler);
        }
        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "request-gate started: port={}, routes={}, shapes={}, errors={}, auth-users={}, startupMs={}",
                app.port(),
                table.size(),
                shapes.size(),
                config.htmlErrors() ? "html" : "json",
                config.authUsers().size(),
                elapsedMs);

        return new GateApp(app, router, config);
    }

    /** The port the server listens on. */
    public int port() {
        return app.port();
    }

    public Router router() {
        return router;
    }

    public GateConfig config() {
        return config;
    }

    public void stop() {
        app.stop();
        LOG.info("request-gate stopped");
    }
}
