package io.requestgate.core.routing;

import io.requestgate.core.model.PathPattern;
import io.requestgate.core.model.PathPattern.Capture;
import io.requestgate.core.model.PathPattern.Literal;
import io.requestgate.core.model.PathPattern.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Matches request paths against {@link PathPattern}s and extracts the converted capture values.
 *
 * <p>
 * The pattern is walked left to right:
 * <ul>
 * <li>a literal must be an exact prefix of the remaining path and is consumed;</li>
 * <li>a capture takes the rest of the path if it is the last segment, otherwise the text up to
 * the <em>first</em> occurrence of the next literal. Its converter must accept that text.</li>
 * </ul>
 * After the last segment nothing may be left of the path.
 *
 * <p>
 * Because the boundary is the first occurrence of the next literal, a captured value that itself
 * contains that literal's text is split there: {@code /files/{string}/raw} does not match
 * {@code /files/a/raw/b/raw}.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PathMatcher {

    private PathMatcher() {}

    /**
     * Matches {@code path} against {@code pattern}.
     *
     * @return the converted capture values in pattern order, or empty if the path does not match
     */
    public static Optional<List<Object>> match(PathPattern pattern, String path) {
        List<Segment> segments = pattern.segments();
        List<Object> captures = new ArrayList<>(pattern.captureCount());
        String remaining = path;

        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);
            if (segment instanceof Literal literal) {
                if (!remaining.startsWith(literal.text())) {
                    return Optional.empty();
                }
                remaining = remaining.substring(literal.text().length());
            } else if (segment instanceof Capture capture) {
                String content;
                if (i + 1 == segments.size()) {
                    content = remaining;
                    remaining = "";
                } else {
                    // Alternation guarantees the next segment is a non-empty literal
                    String next = ((Literal) segments.get(i + 1)).text();
                    int end = remaining.indexOf(next);
                    if (end < 0) {
                        return Optional.empty();
                    }
                    content = remaining.substring(0, end);
                    remaining = remaining.substring(end);
                }
                Object value;
                try {
                    value = capture.converter().convert(content);
                } catch (IllegalArgumentException e) {
                    return Optional.empty();
                }
                if (value == null) {
                    throw new IllegalStateException(
                            "Converter '" + capture.converter().name() + "' returned null for '" + content + "'");
                }
                captures.add(value);
            }
        }

        if (!remaining.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(captures));
    }

    /** True if {@code path} matches {@code pattern}. */
    public static boolean matches(PathPattern pattern, String path) {
        return match(pattern, path).isPresent();
    }
}
