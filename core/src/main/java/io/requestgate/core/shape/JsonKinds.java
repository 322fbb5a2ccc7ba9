package io.requestgate.core.shape;

import com.fasterxml.jackson.databind.JsonNode;

/** Naming of JSON value kinds for rejection reasons. */
final class JsonKinds {

    private static final int MAX_VALUE_LENGTH = 64;

    private JsonKinds() {}

    /** Kind name of a node: object, array, string, int, float, boolean, null. */
    static String kindOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "null";
        }
        if (node.isObject()) {
            return "object";
        }
        if (node.isArray()) {
            return "array";
        }
        if (node.isTextual()) {
            return "string";
        }
        if (node.isIntegralNumber()) {
            return "int";
        }
        if (node.isFloatingPointNumber()) {
            return "float";
        }
        if (node.isBoolean()) {
            return "boolean";
        }
        return node.getNodeType().name().toLowerCase();
    }

    /** Standard type-mismatch reason, e.g. {@code expected int, found 'abc' of type string}. */
    static String mismatch(String expected, JsonNode node) {
        return "expected " + expected + ", found '" + render(node) + "' of type " + kindOf(node);
    }

    /** Short text of a node: raw text for strings, JSON otherwise, truncated. */
    static String render(JsonNode node) {
        String text;
        if (node == null || node.isMissingNode()) {
            text = "null";
        } else if (node.isTextual()) {
            text = node.textValue();
        } else {
            text = node.toString();
        }
        if (text.length() > MAX_VALUE_LENGTH) {
            return text.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return text;
    }
}
