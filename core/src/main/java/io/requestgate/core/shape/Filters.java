package io.requestgate.core.shape;

import io.requestgate.core.shape.Filter.ArrayOf;
import io.requestgate.core.shape.Filter.Field;
import io.requestgate.core.shape.Filter.Kind;
import io.requestgate.core.shape.Filter.Leaf;
import io.requestgate.core.shape.Filter.ObjectOf;
import io.requestgate.core.shape.Filter.Options;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory methods for {@link Filter} trees.
 *
 * <pre>{@code
 * Filter item = Filters.object()
 *         .required("id", Filters.integer().withMin(0))
 *         .optional("description", Filters.string())
 *         .build();
 * }</pre>
 */
public final class Filters {

    private static final Leaf NUMBER = new Leaf(Kind.NUMBER, null, null);
    private static final Leaf INT = new Leaf(Kind.INT, null, null);
    private static final Leaf FLOAT = new Leaf(Kind.FLOAT, null, null);
    private static final Leaf STRING = new Leaf(Kind.STRING, null, null);
    private static final Leaf BOOLEAN = new Leaf(Kind.BOOLEAN, null, null);
    private static final Leaf NULL = new Leaf(Kind.NULL, null, null);

    private Filters() {}

    /** Any number; bounds via {@link Leaf#withMin}/{@link Leaf#withMax}. */
    public static Leaf number() {
        return NUMBER;
    }

    /** Integral numbers only. */
    public static Leaf integer() {
        return INT;
    }

    /** Floating-point numbers only. */
    public static Leaf floating() {
        return FLOAT;
    }

    public static Leaf string() {
        return STRING;
    }

    public static Leaf bool() {
        return BOOLEAN;
    }

    public static Leaf nullValue() {
        return NULL;
    }

    /** Arrays whose every element passes {@code items}. */
    public static Filter arrayOf(Filter items) {
        return new ArrayOf(items);
    }

    /** Values accepted by at least one of the alternatives. */
    public static Filter anyOf(Filter... alternatives) {
        return new Options(Arrays.asList(alternatives));
    }

    /** Starts an object filter; undeclared keys are rejected unless allowed. */
    public static ObjectBuilder object() {
        return new ObjectBuilder();
    }

    /** Builder for {@link ObjectOf}. Not thread-safe; the built filter is. */
    public static final class ObjectBuilder {

        private final Map<String, Field> fields = new LinkedHashMap<>();
        private boolean allowExtraKeys;

        private ObjectBuilder() {}

        /** Declares a key that must be present. */
        public ObjectBuilder required(String key, Filter filter) {
            return field(key, filter, true);
        }

        /** Declares a key that may be absent. */
        public ObjectBuilder optional(String key, Filter filter) {
            return field(key, filter, false);
        }

        /** Tolerates keys that are not declared. */
        public ObjectBuilder allowExtraKeys() {
            this.allowExtraKeys = true;
            return this;
        }

        public ObjectBuilder allowExtraKeys(boolean allow) {
            this.allowExtraKeys = allow;
            return this;
        }

        public Filter build() {
            return new ObjectOf(fields, allowExtraKeys);
        }

        private ObjectBuilder field(String key, Filter filter, boolean required) {
            Objects.requireNonNull(key, "key must not be null");
            if (fields.containsKey(key)) {
                throw new IllegalArgumentException("Key '" + key + "' declared twice");
            }
            fields.put(key, new Field(filter, required));
            return this;
        }
    }
}
