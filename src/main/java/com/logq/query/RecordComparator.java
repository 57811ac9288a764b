package com.logq.query;

import com.logq.json.JsonNode;
import com.logq.json.JsonValues;

import java.util.Comparator;

public class RecordComparator implements Comparator<JsonNode.JsonObject> {
    private final SortSpec sortSpec;

    public RecordComparator(SortSpec sortSpec) {
        this.sortSpec = sortSpec;
    }

    @Override
    public int compare(JsonNode.JsonObject a, JsonNode.JsonObject b) {
        for (SortSpec.SortKey key : sortSpec.keys()) {
            int order = JsonValues.compareForSort(a.get(key.field()), b.get(key.field()));
            if (order > 0) {
                return key.direction().sign();
            } else if (order < 0) {
                return -key.direction().sign();
            }
        }
        return 0;
    }
}
