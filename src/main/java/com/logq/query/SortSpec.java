package com.logq.query;

import com.logq.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Map;

/**
 * Sort keys in tie-break order. Fields not listed never influence the ordering.
 */
public record SortSpec(MutableList<SortKey> keys) {

    public static SortSpec by(String field, Direction direction) {
        return new SortSpec(Lists.mutable.empty()).then(field, direction);
    }

    public SortSpec then(String field, Direction direction) {
        MutableList<SortKey> next = Lists.mutable.ofAll(keys);
        next.add(new SortKey(field, direction));
        return new SortSpec(next);
    }

    /** Reads {@code {"age": 1, "name": -1}}. */
    public static SortSpec parse(JsonNode.JsonObject document) {
        MutableList<SortKey> keys = Lists.mutable.empty();
        for (Map.Entry<String, JsonNode> entry : document.fields().entrySet()) {
            keys.add(new SortKey(entry.getKey(), Direction.of(entry.getKey(), entry.getValue())));
        }
        return new SortSpec(keys);
    }

    public record SortKey(String field, Direction direction) {}

    public enum Direction {
        ASCENDING(1),
        DESCENDING(-1);

        private final int sign;

        Direction(int sign) {
            this.sign = sign;
        }

        public int sign() {
            return sign;
        }

        static Direction of(String field, JsonNode value) {
            if (value instanceof JsonNode.JsonNumber) {
                double number = ((JsonNode.JsonNumber) value).doubleValue();
                if (number == 1) {
                    return ASCENDING;
                }
                if (number == -1) {
                    return DESCENDING;
                }
            }
            throw new InvalidFilterException("Sort direction for '" + field + "' must be 1 or -1");
        }
    }
}
