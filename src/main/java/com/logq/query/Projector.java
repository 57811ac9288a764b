package com.logq.query;

import com.logq.json.JsonNode;
import org.eclipse.collections.api.map.MutableMap;

public class Projector {
    /**
     * Builds a new record holding only the projected fields, in projection order. Fields the
     * record does not have are left out; {@code record} itself is not modified.
     */
    public JsonNode.JsonObject project(JsonNode.JsonObject record, ProjectionSpec projection) {
        MutableMap<String, JsonNode> fields = JsonNode.JsonObject.newFieldMap();
        for (String field : projection.fields()) {
            JsonNode value = record.get(field);
            if (value != null) {
                fields.put(field, value);
            }
        }
        return new JsonNode.JsonObject(fields);
    }
}
