package com.logq.query;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A query expression. Exactly one of three shapes; the shape is fixed when the value is built,
 * either by {@link FilterParser} or by the factory methods here.
 */
public sealed interface Filter {

    /** Matches every record. */
    static Conditional all() {
        return new Conditional(Lists.mutable.empty());
    }

    static Conditional where(String field, Condition condition) {
        return all().and(field, condition);
    }

    static Multi and(Conditional... filters) {
        return new Multi(Combinator.AND, Lists.mutable.of(filters));
    }

    static Multi or(Conditional... filters) {
        return new Multi(Combinator.OR, Lists.mutable.of(filters));
    }

    static Text text(String query) {
        return new Text(query);
    }

    /** Field conditions joined by an implicit AND. */
    record Conditional(MutableList<FieldCondition> conditions) implements Filter {
        public Conditional and(String field, Condition condition) {
            MutableList<FieldCondition> next = Lists.mutable.ofAll(conditions);
            next.add(new FieldCondition(field, condition));
            return new Conditional(next);
        }
    }

    record FieldCondition(String field, Condition condition) {}

    /** {@code $and} / {@code $or} over conditional filters. */
    record Multi(Combinator combinator, MutableList<Conditional> filters) implements Filter {}

    /** Whole-word, case-insensitive search over the configured text fields. */
    record Text(String query) implements Filter {}

    enum Combinator {
        AND("$and"),
        OR("$or");

        private final String key;

        Combinator(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }
}
