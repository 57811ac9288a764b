package com.logq.query;

import com.logq.json.JsonNode;
import com.logq.json.JsonValues;
import org.eclipse.collections.api.block.predicate.Predicate;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Decides whether a record matches a {@link Filter}.
 * <p>
 * {@link #compile(Filter)} prepares a predicate once per query so that text patterns are built a
 * single time rather than per record.
 */
public class FilterEvaluator {
    private final ImmutableList<String> textSearchFields;
    private final OperandPresence operandPresence;

    public FilterEvaluator(Iterable<String> textSearchFields) {
        this(textSearchFields, OperandPresence.TRUTHY);
    }

    public FilterEvaluator(Iterable<String> textSearchFields, OperandPresence operandPresence) {
        this.textSearchFields = Lists.immutable.ofAll(textSearchFields);
        this.operandPresence = operandPresence;
    }

    public boolean matches(JsonNode.JsonObject record, Filter filter) {
        return compile(filter).accept(record);
    }

    public Predicate<JsonNode.JsonObject> compile(Filter filter) {
        if (filter instanceof Filter.Multi multi) {
            if (multi.combinator() == Filter.Combinator.AND) {
                return record -> multi.filters().allSatisfy(each -> matchesConditional(record, each));
            }
            return record -> multi.filters().anySatisfy(each -> matchesConditional(record, each));
        }
        if (filter instanceof Filter.Text text) {
            ImmutableList<Pattern> patterns = wordPatterns(text.query());
            return record -> matchesText(record, patterns);
        }
        Filter.Conditional conditional = (Filter.Conditional) filter;
        return record -> matchesConditional(record, conditional);
    }

    boolean matchesConditional(JsonNode.JsonObject record, Filter.Conditional filter) {
        boolean result = true;
        for (Filter.FieldCondition fieldCondition : filter.conditions()) {
            JsonNode value = record.get(fieldCondition.field());
            Condition condition = fieldCondition.condition();

            if (applies(condition.eq())) {
                result &= JsonValues.strictEquals(value, condition.eq());
            }
            if (applies(condition.lt())) {
                result &= compare(value, condition.lt()) < 0;
            }
            if (applies(condition.gt())) {
                result &= compare(value, condition.gt()) > 0;
            }
            if (applies(condition.in())) {
                result &= isMember(value, condition.in());
            }
        }
        return result;
    }

    private boolean applies(JsonNode operand) {
        if (operandPresence == OperandPresence.PRESENT) {
            return operand != null;
        }
        return JsonValues.isTruthy(operand);
    }

    // Unordered pairs compare as 0 so that neither $gt nor $lt holds.
    private static int compare(JsonNode value, JsonNode operand) {
        OptionalInt order = JsonValues.compareForFilter(value, operand);
        return order.orElse(0);
    }

    private static boolean isMember(JsonNode value, JsonNode candidates) {
        if (candidates instanceof JsonNode.JsonArray array) {
            return array.elements().anySatisfy(each -> JsonValues.strictEquals(value, each));
        }
        return false;
    }

    private boolean matchesText(JsonNode.JsonObject record, ImmutableList<Pattern> patterns) {
        for (String field : textSearchFields) {
            if (!(record.get(field) instanceof JsonNode.JsonString string)) {
                continue;
            }
            String text = string.value();
            if (patterns.anySatisfy(pattern -> pattern.matcher(text).find())) {
                return true;
            }
        }
        return false;
    }

    // Runs of whitespace count as one separator and empty words are dropped, so a blank query
    // matches nothing instead of matching every word boundary.
    static ImmutableList<Pattern> wordPatterns(String query) {
        String trimmed = query.trim();
        if (trimmed.isEmpty()) {
            return Lists.immutable.empty();
        }
        return Lists.immutable.of(trimmed.split("\\s+"))
                .collect(word -> Pattern.compile("\\b" + Pattern.quote(word) + "\\b",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
    }
}
