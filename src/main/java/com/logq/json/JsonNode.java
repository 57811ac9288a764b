package com.logq.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

public sealed interface JsonNode {
    /**
     * A JSON object. Field order is the order the fields were added in, which is the
     * document order for parsed objects and the projection order for projected ones.
     */
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(newFieldMap());
        }

        public static MutableMap<String, JsonNode> newFieldMap() {
            return MapAdapter.adapt(new LinkedHashMap<>());
        }

        /** Returns the field value, or {@code null} when the field is absent. */
        public JsonNode get(String field) {
            return fields.get(field);
        }

        public boolean has(String field) {
            return fields.containsKey(field);
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }

        public static JsonArray of(JsonNode... elements) {
            return new JsonArray(Lists.mutable.of(elements));
        }
    }

    record JsonString(String value) implements JsonNode {}

    sealed interface JsonNumber extends JsonNode {
        String toJsonString();
        Number numberValue();

        default double doubleValue() {
            return numberValue().doubleValue();
        }

        record JsonLong(long value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public String toJsonString() {
                if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                    return Long.toString((long) value);
                }
                return Double.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {
        public static final JsonBoolean TRUE = new JsonBoolean(true);
        public static final JsonBoolean FALSE = new JsonBoolean(false);
    }

    record JsonNull() implements JsonNode {
        public static final JsonNull INSTANCE = new JsonNull();
    }
}
