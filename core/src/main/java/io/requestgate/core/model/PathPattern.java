package io.requestgate.core.model;

import io.requestgate.core.spi.Converter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of literal segments and converter captures, e.g. {@code "/id/", int,
 * "/name/", string}.
 *
 * <p>
 * Invariants, enforced on construction:
 * <ul>
 * <li>the first element is a {@link Literal}, possibly empty;</li>
 * <li>literals and captures alternate: two captures are never adjacent, since the boundary
 * between them would be ambiguous.</li>
 * </ul>
 *
 * <p>
 * Immutable and thread-safe. Matching is done by
 * {@link io.requestgate.core.routing.PathMatcher}; templates such as {@code /id/{int}} are
 * parsed by {@link io.requestgate.core.routing.ConverterRegistry#parse(String)}.
 */
public final class PathPattern {

    /** One element of a pattern. */
    public sealed interface Segment permits Literal, Capture {}

    /** Exact text the path must continue with. */
    public record Literal(String text) implements Segment {
        public Literal {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** A generic segment parsed by a converter. */
    public record Capture(Converter<?> converter) implements Segment {
        public Capture {
            Objects.requireNonNull(converter, "converter must not be null");
        }
    }

    private final List<Segment> segments;

    private PathPattern(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    /** The segments, starting with a literal and alternating with captures. */
    public List<Segment> segments() {
        return segments;
    }

    /** Number of capture segments. */
    public int captureCount() {
        int count = 0;
        for (Segment segment : segments) {
            if (segment instanceof Capture) {
                count++;
            }
        }
        return count;
    }

    /** A pattern with a single literal and no captures. */
    public static PathPattern literal(String path) {
        return builder().literal(path).build();
    }

    /** Starts a new pattern. */
    public static Builder builder() {
        return new Builder();
    }

    /** Renders the pattern in template syntax. */
    public String toTemplate() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (segment instanceof Literal literal) {
                sb.append(literal.text());
            } else if (segment instanceof Capture capture) {
                sb.append('{').append(capture.converter().name()).append('}');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathPattern that)) return false;
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return "PathPattern[" + toTemplate() + "]";
    }

    /** Builder enforcing the alternation invariant. Not thread-safe. */
    public static final class Builder {

        private final List<Segment> segments = new ArrayList<>();

        private Builder() {}

        /** Appends literal text; consecutive literals are joined. */
        public Builder literal(String text) {
            Objects.requireNonNull(text, "text must not be null");
            if (!segments.isEmpty() && segments.get(segments.size() - 1) instanceof Literal last) {
                segments.set(segments.size() - 1, new Literal(last.text() + text));
            } else {
                segments.add(new Literal(text));
            }
            return this;
        }

        /**
         * Appends a capture. A capture at the start is preceded by an implicit empty literal.
         *
         * @throws IllegalArgumentException if the previous element is a capture, or the literal
         *                                  between them is empty
         */
        public Builder capture(Converter<?> converter) {
            if (segments.isEmpty()) {
                segments.add(new Literal(""));
            }
            Segment last = segments.get(segments.size() - 1);
            if (last instanceof Capture
                    || (segments.size() > 1 && last instanceof Literal literal && literal.text().isEmpty())) {
                throw new IllegalArgumentException("Two captures must be separated by a non-empty literal");
            }
            segments.add(new Capture(converter));
            return this;
        }

        public PathPattern build() {
            if (segments.isEmpty()) {
                return new PathPattern(List.of(new Literal("")));
            }
            // a trailing empty literal would stop the last capture from taking the remainder
            if (segments.size() > 1 && segments.get(segments.size() - 1) instanceof Literal last && last.text().isEmpty()) {
                return new PathPattern(segments.subList(0, segments.size() - 1));
            }
            return new PathPattern(segments);
        }
    }
}
