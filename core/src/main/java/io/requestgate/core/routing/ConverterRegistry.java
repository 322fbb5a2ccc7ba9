package io.requestgate.core.routing;

import io.requestgate.core.model.PathPattern;
import io.requestgate.core.spi.Converter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named converters used to parse path templates. Manages registration and lookup by
 * converter name. Thread-safe; registration is expected to finish before route tables are
 * parsed.
 */
public final class ConverterRegistry {

    private final Map<String, Converter<?>> converters = new ConcurrentHashMap<>();

    /** Creates an empty registry. */
    public ConverterRegistry() {}

    /** Creates a registry holding the built-in converters ({@code string, int, long, float, uuid}). */
    public static ConverterRegistry withDefaults() {
        ConverterRegistry registry = new ConverterRegistry();
        registry.register(Converters.STRING);
        registry.register(Converters.INT);
        registry.register(Converters.LONG);
        registry.register(Converters.FLOAT);
        registry.register(Converters.UUID_CONVERTER);
        return registry;
    }

    /**
     * Registers a converter under its {@link Converter#name()}. If a converter with the same
     * name is already registered, it is replaced (last-write-wins semantics).
     *
     * @throws NullPointerException     if converter is null
     * @throws IllegalArgumentException if the name is empty or contains a brace
     */
    public void register(Converter<?> converter) {
        Objects.requireNonNull(converter, "converter must not be null");
        String name = converter.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("converter name must not be null or empty");
        }
        if (name.indexOf('{') >= 0 || name.indexOf('}') >= 0) {
            throw new IllegalArgumentException("converter name must not contain braces: '" + name + "'");
        }
        converters.put(name, converter);
    }

    /** Looks up a converter by name. */
    public Optional<Converter<?>> get(String name) {
        return Optional.ofNullable(converters.get(name));
    }

    /**
     * Looks up a converter by name, throwing if not found.
     *
     * @throws IllegalArgumentException if no converter is registered under the name
     */
    public Converter<?> require(String name) {
        return get(name)
                .orElseThrow(() -> new IllegalArgumentException("No converter registered for name: '" + name + "'"));
    }

    /** Returns the number of registered converters. */
    public int size() {
        return converters.size();
    }

    /**
     * Parses a path template such as {@code /id/{int}/name/{string}}. Each placeholder names a
     * registered converter.
     *
     * @throws IllegalArgumentException if a placeholder is unclosed, empty, unknown or directly
     *                                  follows another placeholder
     */
    public PathPattern parse(String template) {
        Objects.requireNonNull(template, "template must not be null");
        PathPattern.Builder builder = PathPattern.builder();
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf('{', pos);
            if (open < 0) {
                builder.literal(template.substring(pos));
                break;
            }
            if (open > pos) {
                builder.literal(template.substring(pos, open));
            }
            int close = template.indexOf('}', open);
            if (close < 0) {
                throw new IllegalArgumentException("Unclosed placeholder at index " + open + " in '" + template + "'");
            }
            String name = template.substring(open + 1, close).strip();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty placeholder at index " + open + " in '" + template + "'");
            }
            builder.capture(require(name));
            pos = close + 1;
        }
        return builder.build();
    }
}
