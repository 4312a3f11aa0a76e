package io.rulegate.server.core.expression;

/**
 * Static bounds applied while parsing.
 *
 * @param maxLength maximum source length in characters
 * @param maxDepth  maximum nesting depth (parentheses, negations, call arguments, {@code &&}/{@code ||} chains)
 * @param maxTokens maximum number of tokens
 */
public record ExpressionLimits(int maxLength, int maxDepth, int maxTokens) {

    public static final int DEFAULT_MAX_LENGTH = 4096;
    public static final int DEFAULT_MAX_DEPTH = 32;
    public static final int DEFAULT_MAX_TOKENS = 1024;

    public ExpressionLimits {
        if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be > 0");
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
        if (maxTokens <= 0) throw new IllegalArgumentException("maxTokens must be > 0");
    }

    public static ExpressionLimits defaults() {
        return new ExpressionLimits(DEFAULT_MAX_LENGTH, DEFAULT_MAX_DEPTH, DEFAULT_MAX_TOKENS);
    }
}
