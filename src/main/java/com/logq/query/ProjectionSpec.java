package com.logq.query;

import com.logq.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Map;

/**
 * The fields kept by a projection, in output order.
 */
public record ProjectionSpec(MutableList<String> fields) {

    public static ProjectionSpec of(String... fields) {
        return new ProjectionSpec(Lists.mutable.of(fields));
    }

    /**
     * Reads {@code {"name": 1}}. A flag of {@code 1} or {@code true} keeps the field, {@code 0} or
     * {@code false} leaves it out.
     */
    public static ProjectionSpec parse(JsonNode.JsonObject document) {
        MutableList<String> fields = Lists.mutable.empty();
        for (Map.Entry<String, JsonNode> entry : document.fields().entrySet()) {
            if (isIncluded(entry.getKey(), entry.getValue())) {
                fields.add(entry.getKey());
            }
        }
        return new ProjectionSpec(fields);
    }

    private static boolean isIncluded(String field, JsonNode flag) {
        if (flag instanceof JsonNode.JsonBoolean) {
            return ((JsonNode.JsonBoolean) flag).value();
        }
        if (flag instanceof JsonNode.JsonNumber) {
            double value = ((JsonNode.JsonNumber) flag).doubleValue();
            if (value == 1) {
                return true;
            }
            if (value == 0) {
                return false;
            }
        }
        throw new InvalidFilterException("Projection flag for '" + field + "' must be 1, 0, true or false");
    }
}
