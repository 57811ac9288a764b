package com.logq.query;

import com.logq.json.JsonNode;
import org.eclipse.collections.api.block.predicate.Predicate;
import org.eclipse.collections.api.list.MutableList;

/**
 * Filters, orders and projects a snapshot of decoded records. Holds no state between calls.
 */
public class QueryExecutor {
    private final FilterEvaluator evaluator;
    private final Projector projector = new Projector();

    public QueryExecutor(FilterEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public MutableList<JsonNode.JsonObject> execute(Filter filter, FindOptions options,
                                                    MutableList<JsonNode.JsonObject> records) {
        Predicate<JsonNode.JsonObject> predicate = evaluator.compile(filter);
        MutableList<JsonNode.JsonObject> results = records.select(predicate);

        if (options == null) {
            return results;
        }
        if (options.sort() != null) {
            results.sortThis(new RecordComparator(options.sort()));
        }
        if (options.projection() != null) {
            ProjectionSpec projection = options.projection();
            results = results.collect(record -> projector.project(record, projection));
        }
        return results;
    }
}
