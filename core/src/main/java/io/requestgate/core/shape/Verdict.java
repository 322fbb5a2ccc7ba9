package io.requestgate.core.shape;

import java.util.Objects;

/**
 * Outcome of evaluating a {@link Filter}: accepted, or rejected with a reason. The reason is
 * empty if and only if the value was accepted.
 *
 * @param accepted whether the value passed
 * @param reason   location-qualified rejection reason, empty when accepted
 */
public record Verdict(boolean accepted, String reason) {

    private static final Verdict ACCEPTED = new Verdict(true, "");

    /** Enforces the reason/acceptance pairing. */
    public Verdict {
        Objects.requireNonNull(reason, "reason must not be null");
        if (accepted != reason.isEmpty()) {
            throw new IllegalArgumentException(
                    accepted ? "an accepted verdict has no reason" : "a rejected verdict needs a reason");
        }
    }

    /** The shared accepting verdict. */
    public static Verdict accept() {
        return ACCEPTED;
    }

    /** A rejection with the given reason. */
    public static Verdict reject(String reason) {
        return new Verdict(false, reason);
    }

    /** True if the value was rejected. */
    public boolean rejected() {
        return !accepted;
    }

    /** Returns this rejection with {@code location + ": "} in front of the reason. */
    Verdict at(Object location) {
        return accepted ? this : reject(location + ": " + reason);
    }
}
