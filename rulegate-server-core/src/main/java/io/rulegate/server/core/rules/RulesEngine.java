package io.rulegate.server.core.rules;

import io.rulegate.core.RuleType;
import io.rulegate.server.core.expression.CompiledExpression;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.expression.ExpressionException;
import io.rulegate.server.core.expression.Node;
import io.rulegate.server.core.expression.Values;
import io.rulegate.server.spi.AccessRule;
import io.rulegate.server.spi.CollectionRules;
import io.rulegate.server.spi.FilterFragment;
import io.rulegate.server.spi.RuleContext;
import io.rulegate.server.spi.RulesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers whether an operation on a collection is allowed for a context.
 *
 * <p>Rules are looked up through the {@link RulesProvider} on every call, so rule changes apply
 * to the next check. Parsed expressions are cached by source text. Every failure denies.
 */
public final class RulesEngine {

    private static final Logger log = LoggerFactory.getLogger(RulesEngine.class);
    private static final int MAX_CACHED_EXPRESSIONS = 4096;

    private final RulesProvider rulesProvider;
    private final ExpressionEvaluator evaluator;
    private final Map<String, CompiledExpression> cache = new ConcurrentHashMap<>();

    public RulesEngine(RulesProvider rulesProvider, ExpressionEvaluator evaluator) {
        this.rulesProvider = Objects.requireNonNull(rulesProvider, "rulesProvider");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    /**
     * Check one operation.
     *
     * @return {@code true} only if the context is admin or the rule allows it
     */
    public boolean checkRule(String collection, RuleType type, RuleContext context) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(context, "context");
        if (context.admin()) return true;

        AccessRule rule = ruleFor(collection, type);
        if (rule instanceof AccessRule.DenyAll) return false;
        if (rule instanceof AccessRule.AllowAll) return true;

        String source = ((AccessRule.Expression) rule).source();
        try {
            return evaluator.test(compiled(source), context);
        } catch (ExpressionException e) {
            log.warn("Rule {} of collection '{}' failed, denying: {}", type, collection, e.getMessage());
            return false;
        }
    }

    /**
     * Compile the collection's list rule into a storage-level predicate.
     *
     * @return the fragment, or {@code null} when the rule has no push-down form and must be
     *         checked per record
     */
    public FilterFragment generateFilter(String collection, RuleContext context) {
        Objects.requireNonNull(context, "context");
        if (context.admin()) return FilterFragment.alwaysTrue();

        AccessRule rule = ruleFor(collection, RuleType.LIST);
        if (rule instanceof AccessRule.DenyAll) return FilterFragment.alwaysFalse();
        if (rule instanceof AccessRule.AllowAll) return FilterFragment.alwaysTrue();

        String source = ((AccessRule.Expression) rule).source();
        CompiledExpression expression;
        try {
            expression = compiled(source);
        } catch (ExpressionException e) {
            log.warn("List rule of collection '{}' does not parse, denying: {}", collection, e.getMessage());
            return FilterFragment.alwaysFalse();
        }
        return pushDown(expression.root(), context);
    }

    /**
     * Validate an expression without a context.
     */
    public CompiledExpression compile(String source) throws ExpressionException {
        return compiled(source);
    }

    AccessRule ruleFor(String collection, RuleType type) {
        if (collection == null || collection.isBlank()) return AccessRule.denyAll();
        try {
            return rulesProvider.find(collection).orElseGet(CollectionRules::denyAll).rule(type);
        } catch (RuntimeException e) {
            log.warn("Rules lookup for collection '{}' failed, denying", collection, e);
            return AccessRule.denyAll();
        }
    }

    private CompiledExpression compiled(String source) throws ExpressionException {
        CompiledExpression cached = cache.get(source);
        if (cached != null) return cached;
        CompiledExpression expression = evaluator.compile(source);
        if (cache.size() >= MAX_CACHED_EXPRESSIONS) {
            cache.clear();
        }
        cache.putIfAbsent(source, expression);
        return expression;
    }

    private FilterFragment pushDown(Node node, RuleContext context) {
        if (!referencesRecord(node)) {
            return fold(node, context);
        }
        if (node instanceof Node.BinaryOp op) {
            switch (op.operator()) {
                case EQ:
                    return equality(op, context);
                case AND:
                    return and(pushDown(op.left(), context), pushDown(op.right(), context));
                case OR:
                    return or(pushDown(op.left(), context), pushDown(op.right(), context));
                default:
                    return null;
            }
        }
        return null;
    }

    private FilterFragment equality(Node.BinaryOp op, RuleContext context) {
        Node.FieldAccess field;
        Node other;
        if (isRecordField(op.left()) && !referencesRecord(op.right())) {
            field = (Node.FieldAccess) op.left();
            other = op.right();
        } else if (isRecordField(op.right()) && !referencesRecord(op.left())) {
            field = (Node.FieldAccess) op.right();
            other = op.left();
        } else {
            return null;
        }
        try {
            return new FilterFragment.FieldEquals(field.subPath(), evaluator.evaluate(other, context));
        } catch (ExpressionException e) {
            return FilterFragment.alwaysFalse();
        }
    }

    private FilterFragment fold(Node node, RuleContext context) {
        try {
            return Values.truthy(evaluator.evaluate(node, context))
                    ? FilterFragment.alwaysTrue()
                    : FilterFragment.alwaysFalse();
        } catch (ExpressionException e) {
            return FilterFragment.alwaysFalse();
        }
    }

    private static FilterFragment and(FilterFragment left, FilterFragment right) {
        if (left instanceof FilterFragment.AlwaysFalse || right instanceof FilterFragment.AlwaysFalse) {
            return FilterFragment.alwaysFalse();
        }
        if (left == null || right == null) return null;
        if (left instanceof FilterFragment.AlwaysTrue) return right;
        if (right instanceof FilterFragment.AlwaysTrue) return left;
        List<FilterFragment> parts = new ArrayList<>();
        flatten(left, FilterFragment.And.class, parts);
        flatten(right, FilterFragment.And.class, parts);
        return new FilterFragment.And(parts);
    }

    private static FilterFragment or(FilterFragment left, FilterFragment right) {
        if (left instanceof FilterFragment.AlwaysTrue || right instanceof FilterFragment.AlwaysTrue) {
            return FilterFragment.alwaysTrue();
        }
        if (left == null || right == null) return null;
        if (left instanceof FilterFragment.AlwaysFalse) return right;
        if (right instanceof FilterFragment.AlwaysFalse) return left;
        List<FilterFragment> parts = new ArrayList<>();
        flatten(left, FilterFragment.Or.class, parts);
        flatten(right, FilterFragment.Or.class, parts);
        return new FilterFragment.Or(parts);
    }

    private static void flatten(FilterFragment fragment, Class<?> kind, List<FilterFragment> out) {
        if (kind == FilterFragment.And.class && fragment instanceof FilterFragment.And and) {
            out.addAll(and.parts());
        } else if (kind == FilterFragment.Or.class && fragment instanceof FilterFragment.Or or) {
            out.addAll(or.parts());
        } else {
            out.add(fragment);
        }
    }

    private static boolean isRecordField(Node node) {
        return node instanceof Node.FieldAccess field
                && ExpressionEvaluator.ROOT_RECORD.equals(field.root())
                && field.path().size() > 1;
    }

    private static boolean referencesRecord(Node node) {
        if (node instanceof Node.FieldAccess field) {
            return ExpressionEvaluator.ROOT_RECORD.equals(field.root());
        }
        if (node instanceof Node.BinaryOp op) {
            return referencesRecord(op.left()) || referencesRecord(op.right());
        }
        if (node instanceof Node.UnaryOp op) {
            return referencesRecord(op.operand());
        }
        if (node instanceof Node.Call call) {
            for (Node argument : call.arguments()) {
                if (referencesRecord(argument)) return true;
            }
        }
        return false;
    }
}
