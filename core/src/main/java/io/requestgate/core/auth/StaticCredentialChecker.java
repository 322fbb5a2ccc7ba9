package io.requestgate.core.auth;

import io.requestgate.core.spi.CredentialChecker;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Checks credentials against a fixed user-to-password map. Passwords are compared in constant
 * time.
 */
public final class StaticCredentialChecker implements CredentialChecker {

    private final Map<String, String> users;

    public StaticCredentialChecker(Map<String, String> users) {
        this.users = Map.copyOf(users);
    }

    @Override
    public boolean check(String user, String password) {
        String expected = users.get(user);
        if (expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), password.getBytes(StandardCharsets.UTF_8));
    }

    /** Number of known users. */
    public int size() {
        return users.size();
    }
}
