package com.mathide.core.parser;

/**
 * Decode stages tried by {@link ResilientDecoder}, in order. Each later stage is more
 * destructive than the one before it.
 */
public enum DecodeStage {
    /** Input decoded as-is. */
    DIRECT,
    /** Known math commands inside string literals re-escaped by {@link ExpressionRepair}. */
    EXPRESSION_REPAIR,
    /** Every lone backslash outside a recognized escape is doubled. */
    DOUBLE_ESCAPES,
    /** Every lone backslash outside a recognized escape is deleted. */
    STRIP_ESCAPES
}
