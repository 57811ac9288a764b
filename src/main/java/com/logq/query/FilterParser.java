package com.logq.query;

import com.logq.json.JsonNode;
import com.logq.json.LogJsonParser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.io.IOException;
import java.util.Map;

/**
 * Reads a filter document such as {@code {"age": {"$gt": 21}}} into a {@link Filter}.
 * <p>
 * The shape is decided once, in this order: a document with {@code $and} or {@code $or} is a
 * {@link Filter.Multi}, one with {@code $text} is a {@link Filter.Text}, anything else is a
 * {@link Filter.Conditional}. Documents that fit none of these cleanly are rejected with an
 * {@link InvalidFilterException}.
 */
public class FilterParser {
    private static final String TEXT = "$text";
    private static final String EQ = "$eq";
    private static final String GT = "$gt";
    private static final String LT = "$lt";
    private static final String IN = "$in";
    private static final ImmutableSet<String> OPERATORS = Sets.immutable.of(EQ, GT, LT, IN);

    private final LogJsonParser jsonParser = new LogJsonParser();

    public Filter parse(String filterJson) {
        if (filterJson == null || filterJson.isBlank()) {
            return Filter.all();
        }
        JsonNode node;
        try {
            node = jsonParser.parse(filterJson);
        } catch (IOException e) {
            throw new InvalidFilterException("Filter is not valid JSON: " + e.getMessage(), e);
        }
        if (!(node instanceof JsonNode.JsonObject document)) {
            throw new InvalidFilterException("Filter must be a JSON object");
        }
        return parse(document);
    }

    public Filter parse(JsonNode.JsonObject document) {
        MutableMap<String, JsonNode> fields = document.fields();
        boolean hasAnd = fields.containsKey(Filter.Combinator.AND.key());
        boolean hasOr = fields.containsKey(Filter.Combinator.OR.key());

        if (hasAnd && hasOr) {
            throw new InvalidFilterException("Filter cannot combine $and and $or");
        }
        if (hasAnd || hasOr) {
            Filter.Combinator combinator = hasAnd ? Filter.Combinator.AND : Filter.Combinator.OR;
            requireSingleKey(fields, combinator.key());
            return parseMulti(combinator, fields.get(combinator.key()));
        }
        if (fields.containsKey(TEXT)) {
            requireSingleKey(fields, TEXT);
            if (!(fields.get(TEXT) instanceof JsonNode.JsonString query)) {
                throw new InvalidFilterException("$text must be a string");
            }
            return new Filter.Text(query.value());
        }
        return parseConditional(document);
    }

    private Filter.Multi parseMulti(Filter.Combinator combinator, JsonNode operand) {
        if (!(operand instanceof JsonNode.JsonArray array)) {
            throw new InvalidFilterException(combinator.key() + " must be an array of filters");
        }
        MutableList<Filter.Conditional> filters = Lists.mutable.empty();
        for (JsonNode element : array.elements()) {
            if (!(element instanceof JsonNode.JsonObject conditional)) {
                throw new InvalidFilterException(combinator.key() + " elements must be objects");
            }
            filters.add(parseConditional(conditional));
        }
        return new Filter.Multi(combinator, filters);
    }

    private Filter.Conditional parseConditional(JsonNode.JsonObject document) {
        MutableList<Filter.FieldCondition> conditions = Lists.mutable.empty();
        for (Map.Entry<String, JsonNode> entry : document.fields().entrySet()) {
            String field = entry.getKey();
            if (field.startsWith("$")) {
                throw new InvalidFilterException("Unexpected operator " + field + " in conditional filter");
            }
            if (!(entry.getValue() instanceof JsonNode.JsonObject operators)) {
                throw new InvalidFilterException("Condition for field '" + field + "' must be an object");
            }
            conditions.add(new Filter.FieldCondition(field, parseCondition(field, operators)));
        }
        return new Filter.Conditional(conditions);
    }

    private Condition parseCondition(String field, JsonNode.JsonObject operators) {
        for (String operator : operators.fields().keysView()) {
            if (!OPERATORS.contains(operator)) {
                throw new InvalidFilterException("Unknown operator " + operator + " on field '" + field + "'");
            }
        }
        JsonNode in = operators.get(IN);
        if (in != null && !(in instanceof JsonNode.JsonArray) && !(in instanceof JsonNode.JsonNull)) {
            throw new InvalidFilterException("$in on field '" + field + "' must be an array");
        }
        return new Condition(operators.get(EQ), operators.get(GT), operators.get(LT), in);
    }

    private static void requireSingleKey(MutableMap<String, JsonNode> fields, String key) {
        if (fields.size() != 1) {
            throw new InvalidFilterException(key + " cannot be combined with other keys");
        }
    }
}
