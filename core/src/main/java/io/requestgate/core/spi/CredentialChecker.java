package io.requestgate.core.spi;

/**
 * Decides whether a user name and password pair is valid. Used by
 * {@link io.requestgate.core.auth.BasicAuthHandler}.
 *
 * <p>
 * Implementations are shared across concurrent requests and MUST be thread-safe.
 */
@FunctionalInterface
public interface CredentialChecker {

    /**
     * @param user     the decoded user name, possibly empty
     * @param password the decoded password, possibly empty
     * @return {@code true} if the credentials are valid
     */
    boolean check(String user, String password);
}
