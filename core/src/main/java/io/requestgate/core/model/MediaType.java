package io.requestgate.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Media types the gate produces in responses, plus the content-type helpers the routing rules
 * and body handlers share.
 */
public enum MediaType {
    /** {@code application/json}. */
    JSON("application/json"),

    /** {@code application/problem+json} (RFC 9457 error bodies). */
    PROBLEM_JSON("application/problem+json"),

    /** {@code text/html}. */
    HTML("text/html; charset=utf-8"),

    /** {@code text/plain}. */
    TEXT("text/plain; charset=utf-8"),

    /** No content type (body absent). */
    NONE(null);

    private final String value;

    MediaType(String value) {
        this.value = value;
    }

    /** Returns the Content-Type header value, or {@code null} for {@link #NONE}. */
    public String value() {
        return value;
    }

    /**
     * Splits the subtype of a Content-Type value into its {@code +}-separated tokens, ignoring
     * media-type parameters.
     *
     * <ul>
     * <li>{@code "application/json"} → {@code [json]}
     * <li>{@code "application/vnd.api+json; charset=utf-8"} → {@code [vnd.api, json]}
     * <li>{@code null}, blank or a value without {@code /} → {@code []}
     * </ul>
     *
     * @param contentType the raw Content-Type value, may be null
     * @return the subtype tokens, in order
     */
    public static List<String> subtypeTokens(String contentType) {
        if (contentType == null) {
            return List.of();
        }
        String mime = contentType;
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon);
        }
        int slash = mime.indexOf('/');
        if (slash < 0) {
            return List.of();
        }
        String subtype = mime.substring(slash + 1).strip();
        if (subtype.isEmpty()) {
            return List.of();
        }
        return List.of(subtype.split("\\+", -1));
    }

    /**
     * True if the Content-Type value carries {@code token} among its subtype tokens
     * (case-sensitive, as declared in route tables).
     */
    public static boolean hasSubtypeToken(String contentType, String token) {
        return subtypeTokens(contentType).contains(token);
    }

    /** Lowercased essence ({@code type/subtype}) of a Content-Type value, or {@code null}. */
    public static String essence(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return null;
        }
        String mime = contentType;
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon);
        }
        return mime.strip().toLowerCase(Locale.ROOT);
    }
}
