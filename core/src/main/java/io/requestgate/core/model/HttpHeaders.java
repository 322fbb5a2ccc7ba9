package io.requestgate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Case-insensitive HTTP header collection, used for request headers and for the extra response
 * headers a rejection carries.
 *
 * <p>
 * All header names are normalized to <strong>lowercase</strong> per RFC 9110 §5.1. The class is
 * immutable: {@link #with} and {@link #merge} return new instances.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    /** Internal storage: case-insensitive key order, values are non-empty lists. */
    private final TreeMap<String, List<String>> store;

    private HttpHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? Collections.unmodifiableList(values) : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(name);
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Header names in lowercase, sorted. */
    public List<String> names() {
        return List.copyOf(store.keySet());
    }

    /**
     * Returns a copy with {@code value} appended to the values of {@code name}.
     *
     * @param name  the header name
     * @param value the value to append
     * @return a new {@code HttpHeaders}
     */
    public HttpHeaders with(String name, String value) {
        TreeMap<String, List<String>> copy = copyStore();
        copy.computeIfAbsent(name.toLowerCase(), k -> new ArrayList<>()).add(value);
        return freeze(copy);
    }

    /**
     * Returns a copy in which every header of {@code other} replaces the header of the same
     * name in this collection.
     */
    public HttpHeaders merge(HttpHeaders other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        TreeMap<String, List<String>> copy = copyStore();
        other.store.forEach((key, values) -> copy.put(key, new ArrayList<>(values)));
        return freeze(copy);
    }

    /**
     * First-value-per-name view with lowercase keys.
     *
     * @return an unmodifiable map
     */
    public Map<String, String> toSingleValueMap() {
        Map<String, String> result = new TreeMap<>();
        store.forEach((key, values) -> {
            if (!values.isEmpty()) {
                result.put(key, values.get(0));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * All-values-per-name view with lowercase keys.
     *
     * @return an unmodifiable map
     */
    public Map<String, List<String>> toMultiValueMap() {
        Map<String, List<String>> result = new TreeMap<>();
        store.forEach((key, values) -> result.put(key, Collections.unmodifiableList(values)));
        return Collections.unmodifiableMap(result);
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map. Keys are normalized to lowercase.
     *
     * @param singleValue header name → single value
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((key, value) -> map.put(key.toLowerCase(), List.of(value)));
        return new HttpHeaders(map);
    }

    /**
     * Creates headers from a multi-value map. Keys are normalized to lowercase.
     *
     * @param multiValue header name → list of values
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((key, values) -> map.put(key.toLowerCase(), List.copyOf(values)));
        return new HttpHeaders(map);
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    private TreeMap<String, List<String>> copyStore() {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        store.forEach((key, values) -> copy.put(key, new ArrayList<>(values)));
        return copy;
    }

    private static HttpHeaders freeze(TreeMap<String, List<String>> mutable) {
        TreeMap<String, List<String>> frozen = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        mutable.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
        return new HttpHeaders(frozen);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + store.keySet();
    }
}
