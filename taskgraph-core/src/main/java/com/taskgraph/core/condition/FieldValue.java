package com.taskgraph.core.condition;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskgraph.core.exception.ValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed value of an entity field, a condition operand or a trigger payload entry.
 *
 * Every variant reports its {@link Kind}, so evaluation code switches over the kind
 * instead of probing runtime classes.
 */
public sealed interface FieldValue
    permits FieldValue.TextValue, FieldValue.NumberValue, FieldValue.BoolValue,
            FieldValue.DateValue, FieldValue.EnumValue, FieldValue.ListValue,
            FieldValue.EmptyValue {

    enum Kind {
        TEXT, NUMBER, BOOLEAN, DATE, ENUM, LIST, EMPTY
    }

    EmptyValue EMPTY = new EmptyValue();

    Kind kind();

    /**
     * Text form used for display, template substitution and lexical comparison.
     */
    String asText();

    /**
     * JSON form; also the serialized shape of every variant.
     */
    JsonNode toJson();

    default boolean isEmpty() {
        return false;
    }

    default Optional<BigDecimal> asNumber() {
        return Optional.empty();
    }

    default Optional<LocalDate> asDate() {
        return Optional.empty();
    }

    // ========== Variants ==========

    record TextValue(String value) implements FieldValue {
        public TextValue {
            value = value == null ? "" : value;
        }

        @Override
        public Kind kind() {
            return Kind.TEXT;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }

        @Override
        public Optional<BigDecimal> asNumber() {
            try {
                return Optional.of(new BigDecimal(value.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        @Override
        public Optional<LocalDate> asDate() {
            try {
                return Optional.of(LocalDate.parse(value.trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }
    }

    record NumberValue(BigDecimal value) implements FieldValue {
        public NumberValue {
            if (value == null) {
                throw new IllegalArgumentException("number value must not be null");
            }
        }

        public static NumberValue of(long value) {
            return new NumberValue(BigDecimal.valueOf(value));
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }

        @Override
        public Optional<BigDecimal> asNumber() {
            return Optional.of(value);
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }
    }

    record BoolValue(boolean value) implements FieldValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.booleanNode(value);
        }
    }

    record DateValue(LocalDate value) implements FieldValue {
        public DateValue {
            if (value == null) {
                throw new IllegalArgumentException("date value must not be null");
            }
        }

        @Override
        public Kind kind() {
            return Kind.DATE;
        }

        @Override
        public String asText() {
            return value.toString();
        }

        @Override
        public Optional<LocalDate> asDate() {
            return Optional.of(value);
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value.toString());
        }
    }

    /**
     * A symbolic value drawn from a closed set, such as a status or priority.
     * Compared case-insensitively.
     */
    record EnumValue(String symbol) implements FieldValue {
        public EnumValue {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("enum symbol must not be blank");
            }
        }

        @Override
        public Kind kind() {
            return Kind.ENUM;
        }

        @Override
        public String asText() {
            return symbol;
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(symbol);
        }
    }

    record ListValue(List<FieldValue> values) implements FieldValue {
        public ListValue {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public String asText() {
            List<String> parts = new ArrayList<>();
            for (FieldValue value : values) {
                parts.add(value.asText());
            }
            return String.join(", ", parts);
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            values.forEach(v -> array.add(v.toJson()));
            return array;
        }
    }

    record EmptyValue() implements FieldValue {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }

        @Override
        public String asText() {
            return "";
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @JsonValue
        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.nullNode();
        }
    }

    // ========== Factories ==========

    static FieldValue text(String value) {
        return value == null ? EMPTY : new TextValue(value);
    }

    static FieldValue symbol(String value) {
        return value == null || value.isBlank() ? EMPTY : new EnumValue(value);
    }

    static FieldValue date(LocalDate value) {
        return value == null ? EMPTY : new DateValue(value);
    }

    /**
     * Convert a plain Java value into its typed form.
     */
    static FieldValue of(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof FieldValue value) {
            return value;
        }
        if (raw instanceof String s) {
            return new TextValue(s);
        }
        if (raw instanceof BigDecimal d) {
            return new NumberValue(d);
        }
        if (raw instanceof Number n) {
            return new NumberValue(new BigDecimal(n.toString()));
        }
        if (raw instanceof Boolean b) {
            return new BoolValue(b);
        }
        if (raw instanceof LocalDate d) {
            return new DateValue(d);
        }
        if (raw instanceof Instant i) {
            return new DateValue(LocalDate.ofInstant(i, ZoneOffset.UTC));
        }
        if (raw instanceof Enum<?> e) {
            return new EnumValue(e.name().toLowerCase());
        }
        if (raw instanceof Collection<?> c) {
            List<FieldValue> values = new ArrayList<>();
            c.forEach(item -> values.add(of(item)));
            return new ListValue(values);
        }
        return new TextValue(raw.toString());
    }

    /**
     * Convert a JSON node into its typed form.
     * Objects of the form {"date": "2025-01-31"} and {"enum": "high"} select the
     * date and enum variants explicitly; any other object is rejected.
     */
    static FieldValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (node.isTextual()) {
            return new TextValue(node.textValue());
        }
        if (node.isNumber()) {
            return new NumberValue(node.decimalValue());
        }
        if (node.isBoolean()) {
            return new BoolValue(node.booleanValue());
        }
        if (node.isArray()) {
            List<FieldValue> values = new ArrayList<>();
            node.forEach(item -> values.add(fromJson(item)));
            return new ListValue(values);
        }
        if (node.isObject() && node.size() == 1) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            Map.Entry<String, JsonNode> entry = fields.next();
            if ("date".equals(entry.getKey()) && entry.getValue().isTextual()) {
                try {
                    return new DateValue(LocalDate.parse(entry.getValue().textValue()));
                } catch (DateTimeParseException e) {
                    throw new ValidationException("date", entry.getValue().textValue());
                }
            }
            if ("enum".equals(entry.getKey()) && entry.getValue().isTextual()) {
                return symbol(entry.getValue().textValue());
            }
        }
        throw new ValidationException("field value", "unsupported JSON value " + node);
    }
}
