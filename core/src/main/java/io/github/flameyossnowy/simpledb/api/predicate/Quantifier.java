package io.github.flameyossnowy.simpledb.api.predicate;

/**
 * How a condition applies to a multi-valued attribute.
 */
public enum Quantifier {
    /** At least one value satisfies the condition. */
    ANY,
    /** Every value satisfies the condition, rendered as {@code every(attr)}. */
    EVERY
}
