package io.requestgate.core.error;

import io.requestgate.core.model.HttpHeaders;
import java.util.Map;

/**
 * Thrown when a protected route is called without HTTP Basic credentials (401). Carries the
 * {@code WWW-Authenticate} challenge for the configured realm. URN:
 * {@code urn:request-gate:error:authentication-required}
 */
public final class AuthenticationRequiredException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:request-gate:error:authentication-required";

    public AuthenticationRequiredException(String message, String realm) {
        super(401, message, HttpHeaders.of(Map.of("WWW-Authenticate", "Basic realm=\"" + realm + "\"")));
    }

    @Override
    public String type() {
        return URN;
    }
}
