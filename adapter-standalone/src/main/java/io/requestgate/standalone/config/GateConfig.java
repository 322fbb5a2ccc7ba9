package io.requestgate.standalone.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root configuration of the standalone gate server.
 *
 * <p>
 * All fields have defaults except {@code routesFile}. Use {@link #builder()}.
 *
 * @param host          bind address
 * @param port          listen port, {@code 0} for an ephemeral port
 * @param maxBodyBytes  largest request body read, {@code <= 0} for no limit
 * @param routesFile    route table YAML, required
 * @param shapesFile    shape YAML, may be null
 * @param errorsFormat  {@code json} (RFC 9457) or {@code html}
 * @param errorsPretty  indent JSON error bodies
 * @param authRealm     realm of Basic authentication challenges
 * @param authUsers     user to password map for {@code basic-auth} routes
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record GateConfig(
        String host,
        int port,
        long maxBodyBytes,
        String routesFile,
        String shapesFile,
        String errorsFormat,
        boolean errorsPretty,
        String authRealm,
        Map<String, String> authUsers,
        String loggingFormat,
        String loggingLevel) {

    /** Copies the user map. */
    public GateConfig {
        Objects.requireNonNull(routesFile, "routesFile must not be null");
        authUsers = Map.copyOf(authUsers != null ? authUsers : Map.of());
    }

    /** Whether errors are rendered as HTML instead of Problem Details. */
    public boolean htmlErrors() {
        return "html".equalsIgnoreCase(errorsFormat);
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GateConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 9090;
        private long maxBodyBytes = 1_048_576; // 1 MiB
        private String routesFile;
        private String shapesFile;
        private String errorsFormat = "json";
        private boolean errorsPretty;
        private String authRealm = "Access to content";
        private final Map<String, String> authUsers = new LinkedHashMap<>();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxBodyBytes(long maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder routesFile(String routesFile) {
            this.routesFile = routesFile;
            return this;
        }

        public Builder shapesFile(String shapesFile) {
            this.shapesFile = shapesFile;
            return this;
        }

        public Builder errorsFormat(String errorsFormat) {
            this.errorsFormat = errorsFormat;
            return this;
        }

        public Builder errorsPretty(boolean errorsPretty) {
            this.errorsPretty = errorsPretty;
            return this;
        }

        public Builder authRealm(String authRealm) {
            this.authRealm = authRealm;
            return this;
        }

        /** Adds or replaces a user. */
        public Builder authUser(String user, String password) {
            this.authUsers.put(user, password);
            return this;
        }

        /** Replaces all users. */
        public Builder authUsers(Map<String, String> users) {
            this.authUsers.clear();
            this.authUsers.putAll(users);
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * @throws ConfigLoadException if {@code routesFile} is missing or an enumerated value is
         *                             not recognised
         */
        public GateConfig build() {
            if (routesFile == null || routesFile.isBlank()) {
                throw new ConfigLoadException("Missing required configuration 'routes.file'");
            }
            if (!"json".equalsIgnoreCase(errorsFormat) && !"html".equalsIgnoreCase(errorsFormat)) {
                throw new ConfigLoadException("Invalid 'errors.format' value '" + errorsFormat + "', expected json or html");
            }
            if (!"json".equalsIgnoreCase(loggingFormat) && !"text".equalsIgnoreCase(loggingFormat)) {
                throw new ConfigLoadException(
                        "Invalid 'logging.format' value '" + loggingFormat + "', expected text or json");
            }
            if (port < 0 || port > 65535) {
                throw new ConfigLoadException("Invalid 'server.port' value " + port);
            }
            return new GateConfig(
                    host,
                    port,
                    maxBodyBytes,
                    routesFile,
                    shapesFile,
                    errorsFormat,
                    errorsPretty,
                    authRealm,
                    authUsers,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
