package io.rulegate.server.core.filter;

import io.rulegate.server.core.expression.CompiledExpression;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.expression.ExpressionException;

import java.util.Objects;

/**
 * Compiles subscription filters.
 */
public final class RecordFilters {

    private RecordFilters() {}

    /**
     * Validate and compile a filter. The source is always checked against the full grammar first;
     * {@link FilterMode#RESTRICTED} additionally requires the comparison-chain shape.
     *
     * @throws ExpressionException if the filter does not parse or has an unsupported shape
     */
    public static RecordFilter compile(String source, FilterMode mode, ExpressionEvaluator evaluator)
            throws ExpressionException {
        Objects.requireNonNull(mode, "mode");
        CompiledExpression expression = evaluator.compile(source);
        return switch (mode) {
            case RESTRICTED -> RestrictedRecordFilter.from(expression);
            case FULL -> new ExpressionRecordFilter(expression, evaluator);
        };
    }
}
