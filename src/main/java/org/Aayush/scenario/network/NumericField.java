package org.Aayush.scenario.network;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Decoded numeric attribute from a network description.
 * <p>
 * Upstream tooling emits numeric fields as a scalar, a numeric string, or a list
 * whose first element carries the value. This type is the only place that shape
 * is inspected. Parsers decode once at the boundary and then resolve to a plain
 * scalar through {@link #orDefault(double)}, so nothing past the parser ever sees
 * the raw form.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class NumericField {

    /**
     * Decoding outcome.
     */
    public enum State {
        /** Value decoded. */
        PRESENT,
        /** Attribute absent, null, or an empty list. */
        MISSING,
        /** Attribute present but not numeric. */
        INVALID
    }

    private static final NumericField MISSING_FIELD = new NumericField(State.MISSING, Double.NaN, null);

    private final State state;
    private final double value;
    /** Raw text of an invalid attribute, kept for warnings. */
    private final String raw;

    public static NumericField missing() {
        return MISSING_FIELD;
    }

    public static NumericField of(double value) {
        if (!Double.isFinite(value)) {
            return new NumericField(State.INVALID, Double.NaN, Double.toString(value));
        }
        return new NumericField(State.PRESENT, value, null);
    }

    /**
     * Decodes an XML attribute value.
     */
    public static NumericField decode(String text) {
        if (text == null || text.isBlank()) {
            return MISSING_FIELD;
        }
        try {
            return of(Double.parseDouble(text.trim()));
        } catch (NumberFormatException ex) {
            return new NumericField(State.INVALID, Double.NaN, text);
        }
    }

    /**
     * Decodes a JSON value: number, numeric string, or list (first element wins).
     */
    public static NumericField decode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return MISSING_FIELD;
        }
        if (node.isArray()) {
            if (node.isEmpty()) {
                return MISSING_FIELD;
            }
            JsonNode first = node.get(0);
            if (first.isArray()) {
                return new NumericField(State.INVALID, Double.NaN, node.toString());
            }
            return decode(first);
        }
        if (node.isNumber()) {
            return of(node.doubleValue());
        }
        if (node.isTextual()) {
            return decode(node.textValue());
        }
        return new NumericField(State.INVALID, Double.NaN, node.toString());
    }

    public boolean isPresent() {
        return state == State.PRESENT;
    }

    public boolean isInvalid() {
        return state == State.INVALID;
    }

    /**
     * Returns the decoded value, or {@code defaultValue} when missing or invalid.
     */
    public double orDefault(double defaultValue) {
        return isPresent() ? value : defaultValue;
    }

    /**
     * Returns the decoded value truncated toward zero, or {@code defaultValue}.
     */
    public int orDefaultInt(int defaultValue) {
        return isPresent() ? (int) value : defaultValue;
    }

    @Override
    public String toString() {
        switch (state) {
            case PRESENT:
                return Double.toString(value);
            case INVALID:
                return "INVALID(" + raw + ")";
            default:
                return "MISSING";
        }
    }
}
