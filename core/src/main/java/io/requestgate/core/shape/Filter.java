package io.requestgate.core.shape;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A predicate over a parsed JSON value that reports why it rejects.
 *
 * <p>
 * The hierarchy is sealed: leaves check a value's kind (and numeric range), {@link ArrayOf}
 * applies one filter to every element, {@link ObjectOf} checks declared keys, and
 * {@link Options} accepts what any alternative accepts. Rejections of nested values are
 * prefixed with their location, so a failure deep in a tree reads
 * {@code "items: 2: expected int, found 'x' of type string"}.
 *
 * <p>
 * Evaluation stops at the first failure; sibling checks are not run.
 *
 * <p>
 * Thread-safe and immutable: a filter carries no per-call state and may be shared by any number
 * of concurrent evaluations. Build instances with {@link Filters}.
 */
public sealed interface Filter {

    /**
     * Evaluates a value. A Java {@code null} is treated as JSON {@code null}.
     *
     * @param value the parsed JSON value
     * @return the verdict; its reason is empty if and only if the value is accepted
     */
    Verdict evaluate(JsonNode value);

    /** Kinds a {@link Leaf} can require. */
    enum Kind {
        /** Any number, integral or floating point. */
        NUMBER("number"),
        /** An integral number only; {@code 5.0} is not an int. */
        INT("int"),
        /** A floating-point number only; {@code 5} is not a float. */
        FLOAT("float"),
        STRING("string"),
        BOOLEAN("boolean"),
        NULL("null");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        /** Name used in rejection reasons and shape definitions. */
        public String label() {
            return label;
        }

        /** Whether {@code min}/{@code max} bounds apply to this kind. */
        public boolean numeric() {
            return this == NUMBER || this == INT || this == FLOAT;
        }

        boolean accepts(JsonNode node) {
            if (node == null || node.isMissingNode()) {
                return this == NULL;
            }
            return switch (this) {
                case NUMBER -> node.isNumber();
                case INT -> node.isIntegralNumber();
                case FLOAT -> node.isFloatingPointNumber();
                case STRING -> node.isTextual();
                case BOOLEAN -> node.isBoolean();
                case NULL -> node.isNull();
            };
        }
    }

    // ── Implementations ──

    /**
     * Exact kind check, plus an inclusive {@code [min, max]} range for numeric kinds. No coercion
     * between int and float takes place.
     *
     * @param kind the required kind
     * @param min  inclusive lower bound, or {@code null}
     * @param max  inclusive upper bound, or {@code null}
     */
    record Leaf(Kind kind, BigDecimal min, BigDecimal max) implements Filter {
        public Leaf {
            Objects.requireNonNull(kind, "kind must not be null");
            if ((min != null || max != null) && !kind.numeric()) {
                throw new IllegalArgumentException("Bounds only apply to numeric kinds, not " + kind.label());
            }
            if (min != null && max != null && min.compareTo(max) > 0) {
                throw new IllegalArgumentException("min " + min + " is greater than max " + max);
            }
        }

        /** Returns a copy with an inclusive lower bound. */
        public Leaf withMin(Number bound) {
            return new Leaf(kind, toDecimal(bound), max);
        }

        /** Returns a copy with an inclusive upper bound. */
        public Leaf withMax(Number bound) {
            return new Leaf(kind, min, toDecimal(bound));
        }

        @Override
        public Verdict evaluate(JsonNode value) {
            if (!kind.accepts(value)) {
                return Verdict.reject(JsonKinds.mismatch(kind.label(), value));
            }
            if (min == null && max == null) {
                return Verdict.accept();
            }
            if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
                return evaluateNonFinite(value.doubleValue());
            }
            BigDecimal number = value.decimalValue();
            if (min != null && number.compareTo(min) < 0) {
                return Verdict.reject("expected number not less than " + min.toPlainString() + ", found "
                        + JsonKinds.render(value));
            }
            if (max != null && number.compareTo(max) > 0) {
                return Verdict.reject("expected number not greater than " + max.toPlainString() + ", found "
                        + JsonKinds.render(value));
            }
            return Verdict.accept();
        }

        /** Overflowed literals such as {@code 1e400} parse to infinity and have no decimal form. */
        private Verdict evaluateNonFinite(double number) {
            if (min != null && !(number > 0)) {
                return Verdict.reject("expected number not less than " + min.toPlainString() + ", found " + number);
            }
            if (max != null && !(number < 0)) {
                return Verdict.reject("expected number not greater than " + max.toPlainString() + ", found " + number);
            }
            return Verdict.accept();
        }

        private static BigDecimal toDecimal(Number bound) {
            if (bound == null) {
                return null;
            }
            if (bound instanceof BigDecimal decimal) {
                return decimal;
            }
            return new BigDecimal(bound.toString());
        }
    }

    /**
     * Accepts arrays whose elements all pass {@code items}. The first failing element is
     * reported as {@code "<index>: <reason>"}.
     */
    record ArrayOf(Filter items) implements Filter {
        public ArrayOf {
            Objects.requireNonNull(items, "items must not be null");
        }

        @Override
        public Verdict evaluate(JsonNode value) {
            if (value == null || !value.isArray()) {
                return Verdict.reject(JsonKinds.mismatch("array", value));
            }
            for (int i = 0; i < value.size(); i++) {
                Verdict verdict = items.evaluate(value.get(i));
                if (verdict.rejected()) {
                    return verdict.at(i);
                }
            }
            return Verdict.accept();
        }
    }

    /**
     * A declared key of an {@link ObjectOf}.
     *
     * @param filter   filter for the key's value
     * @param required whether the key must be present
     */
    record Field(Filter filter, boolean required) {
        public Field {
            Objects.requireNonNull(filter, "filter must not be null");
        }
    }

    /**
     * Accepts objects whose declared keys pass their filters. Declared keys are checked in
     * declaration order: a present key failing its filter is reported as
     * {@code "<key>: <reason>"}, a missing required key as {@code "entry with key '<key>'
     * required"}. Unless {@code allowExtraKeys} is set, the first undeclared key of the value is
     * then reported as {@code "unsupported key '<key>'"}.
     *
     * @param fields         declared keys in declaration order
     * @param allowExtraKeys whether undeclared keys are tolerated
     */
    record ObjectOf(Map<String, Field> fields, boolean allowExtraKeys) implements Filter {
        public ObjectOf {
            Objects.requireNonNull(fields, "fields must not be null");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public Verdict evaluate(JsonNode value) {
            if (value == null || !value.isObject()) {
                return Verdict.reject(JsonKinds.mismatch("object", value));
            }
            for (Map.Entry<String, Field> entry : fields.entrySet()) {
                String key = entry.getKey();
                if (value.has(key)) {
                    Verdict verdict = entry.getValue().filter().evaluate(value.get(key));
                    if (verdict.rejected()) {
                        return verdict.at(key);
                    }
                } else if (entry.getValue().required()) {
                    return Verdict.reject("entry with key '" + key + "' required");
                }
            }
            if (!allowExtraKeys) {
                Iterator<String> names = value.fieldNames();
                while (names.hasNext()) {
                    String name = names.next();
                    if (!fields.containsKey(name)) {
                        return Verdict.reject("unsupported key '" + name + "'");
                    }
                }
            }
            return Verdict.accept();
        }
    }

    /**
     * Accepts what the first accepting alternative accepts; later alternatives are not
     * evaluated. If none accepts, the reasons of all alternatives are joined with {@code or}.
     *
     * @param alternatives the alternatives, in evaluation order
     */
    record Options(List<Filter> alternatives) implements Filter {
        public Options {
            alternatives = List.copyOf(alternatives);
            if (alternatives.isEmpty()) {
                throw new IllegalArgumentException("Options need at least one alternative");
            }
        }

        @Override
        public Verdict evaluate(JsonNode value) {
            StringBuilder reasons = new StringBuilder();
            for (Filter alternative : alternatives) {
                Verdict verdict = alternative.evaluate(value);
                if (verdict.accepted()) {
                    return verdict;
                }
                if (reasons.length() > 0) {
                    reasons.append(" or ");
                }
                reasons.append(verdict.reason());
            }
            return Verdict.reject("value not allowed (" + reasons + ")");
        }
    }
}
