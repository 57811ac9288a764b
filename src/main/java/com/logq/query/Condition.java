package com.logq.query;

import com.logq.json.JsonNode;
import com.logq.json.JsonValues;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The operator set applied to one field. A {@code null} operand means the operator was not
 * written; a JSON null operand is a {@link JsonNode.JsonNull}.
 *
 * @param in a {@link JsonNode.JsonArray} of candidates, or {@link JsonNode.JsonNull}
 */
public record Condition(JsonNode eq, JsonNode gt, JsonNode lt, JsonNode in) {

    public static final Condition NONE = new Condition(null, null, null, null);

    public static Condition eq(Object value) {
        return NONE.withEq(value);
    }

    public static Condition gt(Object value) {
        return NONE.withGt(value);
    }

    public static Condition lt(Object value) {
        return NONE.withLt(value);
    }

    public static Condition in(Object... values) {
        return NONE.withIn(values);
    }

    public Condition withEq(Object value) {
        return new Condition(JsonValues.valueOf(value), gt, lt, in);
    }

    public Condition withGt(Object value) {
        return new Condition(eq, JsonValues.valueOf(value), lt, in);
    }

    public Condition withLt(Object value) {
        return new Condition(eq, gt, JsonValues.valueOf(value), in);
    }

    public Condition withIn(Object... values) {
        return new Condition(eq, gt, lt,
                new JsonNode.JsonArray(Lists.mutable.of(values).collect(JsonValues::valueOf)));
    }
}
