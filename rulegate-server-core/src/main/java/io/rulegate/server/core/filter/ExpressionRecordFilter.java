package io.rulegate.server.core.filter;

import io.rulegate.server.core.expression.CompiledExpression;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.expression.ExpressionException;

import java.util.Map;
import java.util.Objects;

final class ExpressionRecordFilter implements RecordFilter {

    private final CompiledExpression expression;
    private final ExpressionEvaluator evaluator;

    ExpressionRecordFilter(CompiledExpression expression, ExpressionEvaluator evaluator) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public String source() {
        return expression.source();
    }

    @Override
    public boolean matches(Map<String, Object> record) throws ExpressionException {
        return evaluator.testRecord(expression, record);
    }

    @Override
    public String toString() {
        return "ExpressionRecordFilter{" + source() + "}";
    }
}
