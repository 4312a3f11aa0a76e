package io.rulegate.server.core.expression;

/**
 * Failure to parse or evaluate a rule expression.
 *
 * <p>Rule checks resolve this to deny; it never crosses a rule-check boundary.
 */
public class ExpressionException extends Exception {

    public enum Phase {
        PARSE,
        EVALUATE
    }

    private final Phase phase;
    private final int position;

    public ExpressionException(Phase phase, String message, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.phase = phase;
        this.position = position;
    }

    public ExpressionException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.position = -1;
    }

    static ExpressionException parse(String message, int position) {
        return new ExpressionException(Phase.PARSE, message, position);
    }

    static ExpressionException evaluate(String message) {
        return new ExpressionException(Phase.EVALUATE, message, -1);
    }

    public Phase phase() {
        return phase;
    }

    /** Source offset of a parse error, or -1. */
    public int position() {
        return position;
    }
}
