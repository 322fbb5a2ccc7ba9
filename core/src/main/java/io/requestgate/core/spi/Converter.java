package io.requestgate.core.spi;

import java.util.Objects;
import java.util.function.Function;

/**
 * Parses one captured path segment into a typed value.
 *
 * <p>
 * Implementations signal malformed input by throwing {@link IllegalArgumentException}
 * ({@link NumberFormatException} included); the path matcher treats that as "this route does
 * not match". Implementations MUST be stateless and thread-safe.
 *
 * @param <T> the produced value type
 */
public interface Converter<T> {

    /**
     * Converts the captured text.
     *
     * @param segment the text between the surrounding literals, possibly empty
     * @return the converted value, never {@code null}
     * @throws IllegalArgumentException if the text is not a valid value
     */
    T convert(String segment);

    /** Name used in path templates, e.g. {@code int} for {@code /users/{int}}. */
    String name();

    /** Creates a named converter from a parsing function. */
    static <T> Converter<T> of(String name, Function<String, T> parser) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
        return new Converter<>() {
            @Override
            public T convert(String segment) {
                return parser.apply(segment);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return "Converter[" + name + "]";
            }
        };
    }
}
