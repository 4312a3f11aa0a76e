package io.rulegate.server.core.filter;

import io.rulegate.server.core.expression.ExpressionException;

import java.util.Map;

/**
 * Compiled subscription filter. Matching is a pure function of the record.
 */
public interface RecordFilter {

    String source();

    boolean matches(Map<String, Object> record) throws ExpressionException;
}
