package com.logq.query;

import com.logq.json.JsonNode;
import com.logq.json.LogJsonParser;

import java.io.IOException;
import java.util.Optional;

/**
 * Optional post-processing of a query's matches.
 *
 * @param sort       ordering to apply, or {@code null} to keep log order
 * @param projection fields to keep, or {@code null} to return whole records
 */
public record FindOptions(SortSpec sort, ProjectionSpec projection) {

    public static final FindOptions NONE = new FindOptions(null, null);

    public static FindOptions sorted(SortSpec sort) {
        return new FindOptions(sort, null);
    }

    public static FindOptions projected(ProjectionSpec projection) {
        return new FindOptions(null, projection);
    }

    public FindOptions withSort(SortSpec sort) {
        return new FindOptions(sort, projection);
    }

    public FindOptions withProjection(ProjectionSpec projection) {
        return new FindOptions(sort, projection);
    }

    public Optional<SortSpec> sortSpec() {
        return Optional.ofNullable(sort);
    }

    public Optional<ProjectionSpec> projectionSpec() {
        return Optional.ofNullable(projection);
    }

    /** Reads {@code {"sort": {...}, "projection": {...}}}; either key may be left out. */
    public static FindOptions parse(String optionsJson) {
        if (optionsJson == null || optionsJson.isBlank()) {
            return NONE;
        }
        JsonNode node;
        try {
            node = new LogJsonParser().parse(optionsJson);
        } catch (IOException e) {
            throw new InvalidFilterException("Options are not valid JSON: " + e.getMessage(), e);
        }
        if (!(node instanceof JsonNode.JsonObject)) {
            throw new InvalidFilterException("Options must be a JSON object");
        }
        JsonNode.JsonObject options = (JsonNode.JsonObject) node;
        for (String key : options.fields().keysView()) {
            if (!key.equals("sort") && !key.equals("projection")) {
                throw new InvalidFilterException("Unknown option '" + key + "'");
            }
        }
        return new FindOptions(
                options.has("sort") ? SortSpec.parse(requireObject("sort", options.get("sort"))) : null,
                options.has("projection") ? ProjectionSpec.parse(requireObject("projection", options.get("projection"))) : null);
    }

    static JsonNode.JsonObject requireObject(String name, JsonNode node) {
        if (!(node instanceof JsonNode.JsonObject)) {
            throw new InvalidFilterException(name + " must be a JSON object");
        }
        return (JsonNode.JsonObject) node;
    }
}
