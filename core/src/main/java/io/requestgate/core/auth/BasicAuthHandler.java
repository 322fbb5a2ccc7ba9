package io.requestgate.core.auth;

import io.requestgate.core.error.AuthenticationRequiredException;
import io.requestgate.core.error.InvalidCredentialsException;
import io.requestgate.core.error.MalformedAuthorizationException;
import io.requestgate.core.model.GateResponse;
import io.requestgate.core.model.RequestContext;
import io.requestgate.core.spi.CredentialChecker;
import io.requestgate.core.spi.RequestHandler;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP Basic authentication (RFC 7617) in front of another handler.
 *
 * <ul>
 * <li>no {@code Authorization} header, or another scheme: 401 with a
 * {@code WWW-Authenticate: Basic realm="..."} challenge;</li>
 * <li>credentials that are not base64 of UTF-8 {@code user:password}: 400;</li>
 * <li>credentials the checker rejects: 401 without a challenge.</li>
 * </ul>
 * On success the user name is stored under {@link #USER} and the request is forwarded.
 */
public final class BasicAuthHandler implements RequestHandler {

    private static final Logger LOG = LoggerFactory.getLogger(BasicAuthHandler.class);

    /** Context attribute holding the authenticated user name ({@code String}). */
    public static final String USER = "request-gate.user";

    /** Realm used when none is configured. */
    public static final String DEFAULT_REALM = "Access to content";

    private static final String SCHEME = "Basic ";

    private final RequestHandler next;
    private final CredentialChecker checker;
    private final String realm;

    public BasicAuthHandler(RequestHandler next, CredentialChecker checker) {
        this(next, checker, DEFAULT_REALM);
    }

    public BasicAuthHandler(RequestHandler next, CredentialChecker checker, String realm) {
        this.next = Objects.requireNonNull(next, "next must not be null");
        this.checker = Objects.requireNonNull(checker, "checker must not be null");
        this.realm = Objects.requireNonNull(realm, "realm must not be null");
    }

    public String realm() {
        return realm;
    }

    @Override
    public GateResponse handle(RequestContext ctx) throws Exception {
        String authorization = ctx.request().headers().first("Authorization");
        if (authorization == null || !authorization.startsWith(SCHEME)) {
            throw new AuthenticationRequiredException("Authentication required", realm);
        }

        String decoded = decode(authorization.substring(SCHEME.length()).strip());
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            throw new MalformedAuthorizationException("Authentication not processable");
        }
        String user = decoded.substring(0, colon);
        String password = decoded.substring(colon + 1);

        if (!checker.check(user, password)) {
            LOG.debug("Rejected credentials for user '{}' on {}", user, ctx.request().path());
            throw new InvalidCredentialsException("Wrong user or password");
        }
        ctx.setAttribute(USER, user);
        return next.handle(ctx);
    }

    /** The authenticated user set by a {@code BasicAuthHandler} earlier in the chain. */
    public static String user(RequestContext ctx) {
        return ctx.requireAttribute(USER, String.class);
    }

    private static String decode(String credentials) {
        try {
            byte[] bytes = Base64.getDecoder().decode(credentials);
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (IllegalArgumentException | CharacterCodingException e) {
            throw new MalformedAuthorizationException("Authentication not processable");
        }
    }
}
