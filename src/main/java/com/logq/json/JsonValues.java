package com.logq.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;

import java.util.OptionalInt;

/**
 * Value semantics the query engine applies to JSON values. A Java {@code null} argument stands
 * for a field that is absent from a record, which is distinct from a JSON {@code null}.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Converts a plain Java value to its JSON form. {@code null} becomes JSON null and
     * {@link JsonNode} values are returned unchanged.
     */
    public static JsonNode valueOf(Object value) {
        if (value == null) {
            return JsonNode.JsonNull.INSTANCE;
        } else if (value instanceof JsonNode) {
            return (JsonNode) value;
        } else if (value instanceof String) {
            return new JsonNode.JsonString((String) value);
        } else if (value instanceof Boolean) {
            return ((Boolean) value) ? JsonNode.JsonBoolean.TRUE : JsonNode.JsonBoolean.FALSE;
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return JsonNode.JsonNumber.of(((Number) value).longValue());
        } else if (value instanceof Number) {
            return JsonNode.JsonNumber.of(((Number) value).doubleValue());
        }
        throw new IllegalArgumentException("Not a JSON value: " + value.getClass().getName());
    }

    /**
     * Falsy values are absent, JSON null, {@code false}, zero, NaN and the empty string.
     * Arrays and objects are truthy even when empty.
     */
    public static boolean isTruthy(JsonNode node) {
        if (node == null || node instanceof JsonNode.JsonNull) {
            return false;
        }
        if (node instanceof JsonNode.JsonBoolean bool) {
            return bool.value();
        }
        if (node instanceof JsonNode.JsonNumber number) {
            double value = number.doubleValue();
            return value != 0 && !Double.isNaN(value);
        }
        if (node instanceof JsonNode.JsonString string) {
            return !string.value().isEmpty();
        }
        return true;
    }

    public static boolean strictEquals(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof JsonNode.JsonNumber x && b instanceof JsonNode.JsonNumber y) {
            return numbersEqual(x, y);
        }
        if (a instanceof JsonNode.JsonArray x && b instanceof JsonNode.JsonArray y) {
            MutableList<JsonNode> left = x.elements();
            MutableList<JsonNode> right = y.elements();
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!strictEquals(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof JsonNode.JsonObject x && b instanceof JsonNode.JsonObject y) {
            MutableMap<String, JsonNode> left = x.fields();
            MutableMap<String, JsonNode> right = y.fields();
            return left.size() == right.size()
                    && left.keyValuesView().allSatisfy(pair -> strictEquals(pair.getTwo(), right.get(pair.getOne())));
        }
        return a.equals(b);
    }

    /**
     * Orders two values for {@code $gt}/{@code $lt}. Only number/number, string/string and
     * boolean/boolean pairs are ordered; any other pair yields an empty result.
     */
    public static OptionalInt compareForFilter(JsonNode a, JsonNode b) {
        if (a instanceof JsonNode.JsonNumber x && b instanceof JsonNode.JsonNumber y) {
            return OptionalInt.of(compareNumbers(x, y));
        }
        if (a instanceof JsonNode.JsonString x && b instanceof JsonNode.JsonString y) {
            return OptionalInt.of(Integer.signum(x.value().compareTo(y.value())));
        }
        if (a instanceof JsonNode.JsonBoolean x && b instanceof JsonNode.JsonBoolean y) {
            return OptionalInt.of(Boolean.compare(x.value(), y.value()));
        }
        return OptionalInt.empty();
    }

    /**
     * Total order used for sorting: absent, null, booleans, numbers, strings, arrays, objects.
     * Arrays compare equal to each other, as do objects.
     */
    public static int compareForSort(JsonNode a, JsonNode b) {
        int rankA = sortRank(a);
        int rankB = sortRank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        return compareForFilter(a, b).orElse(0);
    }

    private static int sortRank(JsonNode node) {
        if (node == null) {
            return 0;
        } else if (node instanceof JsonNode.JsonNull) {
            return 1;
        } else if (node instanceof JsonNode.JsonBoolean) {
            return 2;
        } else if (node instanceof JsonNode.JsonNumber) {
            return 3;
        } else if (node instanceof JsonNode.JsonString) {
            return 4;
        } else if (node instanceof JsonNode.JsonArray) {
            return 5;
        }
        return 6;
    }

    private static boolean numbersEqual(JsonNode.JsonNumber a, JsonNode.JsonNumber b) {
        if (a instanceof JsonNode.JsonNumber.JsonLong x && b instanceof JsonNode.JsonNumber.JsonLong y) {
            return x.value() == y.value();
        }
        return a.doubleValue() == b.doubleValue();
    }

    private static int compareNumbers(JsonNode.JsonNumber a, JsonNode.JsonNumber b) {
        if (a instanceof JsonNode.JsonNumber.JsonLong x && b instanceof JsonNode.JsonNumber.JsonLong y) {
            return Long.compare(x.value(), y.value());
        }
        double left = a.doubleValue();
        double right = b.doubleValue();
        if (left < right) {
            return -1;
        }
        return left > right ? 1 : 0;
    }
}
