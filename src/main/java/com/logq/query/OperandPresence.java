package com.logq.query;

/**
 * Decides when a comparison operator written in a conditional filter takes part in matching.
 */
public enum OperandPresence {
    /**
     * An operator applies only when its operand is truthy, so {@code {"$eq": 0}},
     * {@code {"$eq": ""}}, {@code {"$eq": false}} and {@code {"$eq": null}} are ignored.
     * Matches the behaviour of existing callers of the log format.
     */
    TRUTHY,
    /** Every operator written in the filter applies, whatever its operand. */
    PRESENT
}
