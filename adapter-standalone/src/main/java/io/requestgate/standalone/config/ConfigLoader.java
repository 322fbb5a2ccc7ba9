package io.requestgate.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link GateConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>{@code
 * server:
 *   host: 0.0.0.0
 *   port: 9090
 *   max-body-bytes: 1048576
 * routes:
 *   file: routes.yaml
 * shapes:
 *   file: shapes.yaml
 * errors:
 *   format: json        # json | html
 *   pretty: false
 * auth:
 *   realm: Access to content
 *   users:
 *     alice: secret
 * logging:
 *   format: text        # text | json
 *   level: INFO
 * }</pre>
 *
 * <p>
 * Relative {@code routes.file} and {@code shapes.file} paths are resolved against the directory
 * of the configuration file.
 *
 * <p>
 * Every key can be overridden by {@code REQUEST_GATE_<SECTION>_<KEY>} (upper case, dashes as
 * underscores, e.g. {@code REQUEST_GATE_SERVER_MAX_BODY_BYTES}). Users are overridden as a whole
 * by {@code REQUEST_GATE_AUTH_USERS=alice:secret,bob:pw}. An env var counts as set only if its
 * trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "request-gate.yaml";
    static final String ENV_PREFIX = "REQUEST_GATE_";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, invalid, or lacks required keys
     */
    public static GateConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given file, applying overrides from {@code envLookup}
     * ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing, invalid, or lacks required keys
     */
    public static GateConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            Path baseDir = configPath.toAbsolutePath().getParent();
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup, baseDir);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Resolves the config file from {@code --config <path>}, defaulting to {@value #DEFAULT_CONFIG_FILE}. */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static GateConfig mapToConfig(JsonNode root, Function<String, String> envLookup, Path baseDir) {
        GateConfig.Builder builder = GateConfig.builder();

        JsonNode server = root.path("server");
        if (server.has("host")) builder.host(server.get("host").asText());
        if (server.has("port")) builder.port(server.get("port").asInt());
        if (server.has("max-body-bytes")) builder.maxBodyBytes(server.get("max-body-bytes").asLong());

        JsonNode routes = root.path("routes");
        if (routes.has("file")) builder.routesFile(resolve(baseDir, routes.get("file").asText()));

        JsonNode shapes = root.path("shapes");
        if (shapes.has("file")) builder.shapesFile(resolve(baseDir, shapes.get("file").asText()));

        JsonNode errors = root.path("errors");
        if (errors.has("format")) builder.errorsFormat(errors.get("format").asText());
        if (errors.has("pretty")) builder.errorsPretty(errors.get("pretty").asBoolean());

        JsonNode auth = root.path("auth");
        if (auth.has("realm")) builder.authRealm(auth.get("realm").asText());
        JsonNode users = auth.path("users");
        if (users.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = users.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> user = fields.next();
                builder.authUser(user.getKey(), user.getValue().asText());
            }
        } else if (!users.isMissingNode() && !users.isNull()) {
            throw new ConfigLoadException("'auth.users' must be a mapping of user name to password");
        }

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        applyEnvOverrides(builder, envLookup, baseDir);
        return builder.build();
    }

    private static void applyEnvOverrides(GateConfig.Builder builder, Function<String, String> envLookup, Path baseDir) {
        envString(envLookup, "SERVER_HOST", builder::host);
        envString(envLookup, "ROUTES_FILE", value -> builder.routesFile(resolve(baseDir, value)));
        envString(envLookup, "SHAPES_FILE", value -> builder.shapesFile(resolve(baseDir, value)));
        envString(envLookup, "ERRORS_FORMAT", builder::errorsFormat);
        envString(envLookup, "AUTH_REALM", builder::authRealm);
        envString(envLookup, "LOGGING_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOGGING_LEVEL", builder::loggingLevel);

        envString(envLookup, "SERVER_PORT", value -> builder.port(Integer.parseInt(value)));
        envString(envLookup, "SERVER_MAX_BODY_BYTES", value -> builder.maxBodyBytes(Long.parseLong(value)));
        envString(envLookup, "ERRORS_PRETTY", value -> builder.errorsPretty(Boolean.parseBoolean(value)));
        envString(envLookup, "AUTH_USERS", value -> builder.authUsers(parseUsers(value)));
    }

    /** Parses {@code user:password[,user:password...]}. */
    static Map<String, String> parseUsers(String value) {
        Map<String, String> users = new LinkedHashMap<>();
        for (String pair : value.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.indexOf(':');
            if (colon <= 0) {
                throw new ConfigLoadException(
                        "Invalid " + ENV_PREFIX + "AUTH_USERS entry '" + trimmed + "', expected user:password");
            }
            users.put(trimmed.substring(0, colon), trimmed.substring(colon + 1));
        }
        return users;
    }

    // --- Env var helpers ---

    /** Applies an override if {@code REQUEST_GATE_<name>} is defined and non-blank. */
    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        String value = envLookup.apply(ENV_PREFIX + name);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }

    private static String resolve(Path baseDir, String file) {
        Path path = Path.of(file);
        if (path.isAbsolute() || baseDir == null) {
            return path.toString();
        }
        return baseDir.resolve(path).normalize().toString();
    }
}
