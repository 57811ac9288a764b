package com.logq.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Streaming JSON reader producing {@link JsonNode} trees. Every parse consumes exactly one
 * JSON value; anything after it other than whitespace is rejected.
 */
public class LogJsonParser {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser);
        }
    }

    public JsonNode parse(String text) throws IOException {
        try (JsonParser parser = factory.createParser(text)) {
            return parseDocument(parser);
        }
    }

    /** Parses {@code text} and requires the value to be a JSON object. */
    public JsonNode.JsonObject parseObject(String text) throws IOException {
        JsonNode node = parse(text);
        if (node instanceof JsonNode.JsonObject obj) {
            return obj;
        }
        throw new IOException("Expected a JSON object but found " + describe(node));
    }

    private JsonNode parseDocument(JsonParser parser) throws IOException {
        JsonToken first = parser.nextToken();
        if (first == null) {
            throw new IOException("Empty JSON input");
        }
        JsonNode value = parseValue(parser, first);
        JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw new IOException("Unexpected content after JSON value: " + trailing);
        }
        return value;
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                    ? JsonNode.JsonNumber.of(parser.getDoubleValue())
                    : JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> JsonNode.JsonBoolean.TRUE;
            case VALUE_FALSE -> JsonNode.JsonBoolean.FALSE;
            case VALUE_NULL -> JsonNode.JsonNull.INSTANCE;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        MutableMap<String, JsonNode> fields = JsonNode.JsonObject.newFieldMap();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            JsonNode value = parseValue(parser, parser.nextToken());
            fields.put(fieldName, value);
        }

        return new JsonNode.JsonObject(fields);
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        MutableList<JsonNode> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new JsonNode.JsonArray(elements);
    }

    static String describe(JsonNode node) {
        if (node instanceof JsonNode.JsonObject) {
            return "object";
        } else if (node instanceof JsonNode.JsonArray) {
            return "array";
        } else if (node instanceof JsonNode.JsonString) {
            return "string";
        } else if (node instanceof JsonNode.JsonNumber) {
            return "number";
        } else if (node instanceof JsonNode.JsonBoolean) {
            return "boolean";
        }
        return "null";
    }
}
