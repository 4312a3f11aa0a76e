package io.rulegate.server.core.expression;

import io.rulegate.server.spi.RuleContext;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses and evaluates rule expressions over a {@link RuleContext}.
 *
 * <p>The evaluator is pure and bounded: the only names in scope are the context roots
 * {@code auth}, {@code record} and {@code data}, and the only callable functions are the closed
 * {@link Node.Function} set. It performs no I/O and holds no mutable state, so one instance can
 * be shared by all threads.
 *
 * <p>Every failure surfaces as a checked {@link ExpressionException}; callers decide the outcome
 * (rule checks deny).
 */
public final class ExpressionEvaluator {

    public static final String ROOT_AUTH = "auth";
    public static final String ROOT_RECORD = "record";
    public static final String ROOT_DATA = "data";

    private final Clock clock;
    private final ExpressionLimits limits;

    public ExpressionEvaluator() {
        this(Clock.systemUTC(), ExpressionLimits.defaults());
    }

    public ExpressionEvaluator(Clock clock, ExpressionLimits limits) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * Parse without a context. Used to validate expressions once, ahead of evaluation.
     *
     * @throws ExpressionException with phase {@link ExpressionException.Phase#PARSE}
     */
    public CompiledExpression compile(String source) throws ExpressionException {
        if (source == null) throw ExpressionException.parse("expression is null", -1);
        List<Token> tokens = new ExpressionTokenizer(source, limits).tokenize();
        Node root = new ExpressionParser(tokens, limits).parse();
        return new CompiledExpression(source, root);
    }

    /**
     * Parse and evaluate in one step.
     */
    public Object evaluate(String source, RuleContext context) throws ExpressionException {
        return evaluate(compile(source).root(), context);
    }

    public Object evaluate(CompiledExpression expression, RuleContext context) throws ExpressionException {
        return evaluate(expression.root(), context);
    }

    /**
     * Evaluate a (sub)tree against a context.
     */
    public Object evaluate(Node node, RuleContext context) throws ExpressionException {
        return run(node, new Scope(Objects.requireNonNull(context, "context"), false));
    }

    /**
     * Evaluate and coerce to boolean.
     */
    public boolean test(CompiledExpression expression, RuleContext context) throws ExpressionException {
        return Values.truthy(evaluate(expression, context));
    }

    /**
     * Evaluate a subscription filter: identifiers that are not a context root resolve against
     * the record, so {@code status = 'x'} reads {@code record.status}.
     */
    public boolean testRecord(CompiledExpression expression, Map<String, Object> record) throws ExpressionException {
        return Values.truthy(run(expression.root(), new Scope(RuleContext.recordOnly(record), true)));
    }

    private Object run(Node node, Scope scope) throws ExpressionException {
        try {
            return eval(node, scope);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            throw new ExpressionException(ExpressionException.Phase.EVALUATE, "evaluation failed: " + e, e);
        }
    }

    private Object eval(Node node, Scope scope) throws ExpressionException {
        if (node instanceof Node.Literal literal) {
            return literal.value();
        }
        if (node instanceof Node.FieldAccess field) {
            return resolve(field, scope);
        }
        if (node instanceof Node.UnaryOp unary) {
            return !Values.truthy(eval(unary.operand(), scope));
        }
        if (node instanceof Node.BinaryOp binary) {
            return binary(binary, scope);
        }
        if (node instanceof Node.Call call) {
            return call(call, scope);
        }
        throw ExpressionException.evaluate("unsupported node " + node.getClass().getSimpleName());
    }

    private Object binary(Node.BinaryOp op, Scope scope) throws ExpressionException {
        switch (op.operator()) {
            case AND:
                return Values.truthy(eval(op.left(), scope)) && Values.truthy(eval(op.right(), scope));
            case OR:
                return Values.truthy(eval(op.left(), scope)) || Values.truthy(eval(op.right(), scope));
            default:
                break;
        }
        Object left = eval(op.left(), scope);
        Object right = eval(op.right(), scope);
        return switch (op.operator()) {
            case EQ -> Values.equal(left, right);
            case NEQ -> !Values.equal(left, right);
            case GT -> Values.compare(left, right) > 0;
            case GTE -> Values.compare(left, right) >= 0;
            case LT -> Values.compare(left, right) < 0;
            case LTE -> Values.compare(left, right) <= 0;
            default -> throw ExpressionException.evaluate("unexpected operator " + op.operator());
        };
    }

    private Object resolve(Node.FieldAccess field, Scope scope) throws ExpressionException {
        List<String> path = field.path();
        Object current;
        int start = 1;
        switch (field.root()) {
            case ROOT_AUTH -> current = scope.context.auth();
            case ROOT_RECORD -> current = scope.context.record();
            case ROOT_DATA -> current = scope.context.data();
            default -> {
                if (!scope.implicitRecord) {
                    throw ExpressionException.evaluate("unknown identifier '" + field.root() + "'");
                }
                current = scope.context.record();
                start = 0;
            }
        }
        for (int i = start; i < path.size() && current != null; i++) {
            current = member(current, path.get(i));
        }
        return current;
    }

    private static Object member(Object container, String name) {
        if (container instanceof Map<?, ?> map) {
            return map.get(name);
        }
        if (container instanceof List<?> list) {
            try {
                int i = Integer.parseInt(name);
                return i >= 0 && i < list.size() ? list.get(i) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private Object call(Node.Call call, Scope scope) throws ExpressionException {
        List<Node> args = call.arguments();
        switch (call.function()) {
            case NOW:
                return DateTimeFormatter.ISO_INSTANT.format(clock.instant());
            case CONTAINS:
                return contains(eval(args.get(0), scope), eval(args.get(1), scope));
            case SIZE:
                return size(eval(args.get(0), scope));
            case IS_EMPTY:
                return isEmpty(eval(args.get(0), scope));
            case IS_NOT_EMPTY:
                return !isEmpty(eval(args.get(0), scope));
            default:
                throw ExpressionException.evaluate("unsupported function " + call.function().functionName());
        }
    }

    private static boolean contains(Object sequence, Object value) throws ExpressionException {
        if (sequence == null) return false;
        if (sequence instanceof Collection<?> c) {
            for (Object element : c) {
                if (Values.equal(element, value)) return true;
            }
            return false;
        }
        if (sequence instanceof CharSequence s) {
            return value != null && s.toString().contains(String.valueOf(value));
        }
        if (sequence instanceof Map<?, ?> m) {
            return value != null && m.containsKey(String.valueOf(value));
        }
        throw ExpressionException.evaluate("$contains does not accept " + Values.typeName(sequence));
    }

    private static long size(Object value) throws ExpressionException {
        if (value == null) return 0L;
        if (value instanceof CharSequence s) return s.length();
        if (value instanceof Collection<?> c) return c.size();
        if (value instanceof Map<?, ?> m) return m.size();
        throw ExpressionException.evaluate("$size does not accept " + Values.typeName(value));
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof CharSequence s) return s.length() == 0;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }

    private record Scope(RuleContext context, boolean implicitRecord) {}
}
