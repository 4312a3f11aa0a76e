package io.rulegate.server.core.expression;

import java.util.Objects;

/**
 * Immutable parse result of an expression; safe to cache and share across threads.
 */
public final class CompiledExpression {

    private final String source;
    private final Node root;

    CompiledExpression(String source, Node root) {
        this.source = Objects.requireNonNull(source, "source");
        this.root = Objects.requireNonNull(root, "root");
    }

    public String source() {
        return source;
    }

    public Node root() {
        return root;
    }

    @Override
    public String toString() {
        return source;
    }
}
