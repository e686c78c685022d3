package com.herzen.oracle.sandbox;

import com.herzen.oracle.sandbox.SandboxEnvironment.BuiltinFunction;
import com.herzen.oracle.sandbox.SandboxEnvironment.Namespace;
import com.herzen.oracle.sandbox.SandboxModels.*;
import com.herzen.oracle.sandbox.SandboxValues.Tuple;

import java.util.*;

public class ExpressionEvaluator {
    private final SandboxLimits limits;
    private final RandomSource randomSource;

    public ExpressionEvaluator(SandboxLimits limits, RandomSource randomSource) {
        this.limits = limits;
        this.randomSource = randomSource;
    }

    public SandboxLimits limits() {
        return limits;
    }

    public Object evaluate(String expression, Map<String, ?> context) {
        return evaluate(expression, context, false);
    }

    public Object evaluate(String expression, Map<String, ?> context, boolean allowRandom) {
        return run(expression, context, allowRandom ? randomSource : null);
    }

    /** Evaluates with the {@code random} namespace bound to the given source. */
    public Object evaluate(String expression, Map<String, ?> context, RandomSource random) {
        return run(expression, context, Objects.requireNonNull(random, "random"));
    }

    public boolean evaluateBoolean(String expression, Map<String, ?> context) {
        return SandboxValues.truthy(evaluate(expression, context));
    }

    /** Parses and checks an expression without running it. */
    public Node compile(String expression, Set<String> contextNames, boolean allowRandom) {
        String expr = expression == null ? "" : expression.strip();
        if (expr.isEmpty()) {
            throw new SandboxException(SandboxException.EMPTY_EXPRESSION, "Empty expression");
        }
        if (expr.length() > limits.maxExpressionLength()) {
            throw new SandboxException(SandboxException.EXPRESSION_TOO_LONG,
                    "Expression too long: " + expr.length() + " > " + limits.maxExpressionLength());
        }
        Node tree = ExpressionParser.parse(expr);
        new SandboxPolicy(contextNames, allowRandom).check(tree);
        return tree;
    }

    private Object run(String expression, Map<String, ?> context, RandomSource random) {
        Map<String, ?> ctx = context == null ? Map.of() : context;
        Node tree = compile(expression, ctx.keySet(), random != null);
        Map<String, Object> scope = new HashMap<>();
        ctx.forEach((k, v) -> scope.put(k, SandboxValues.normalize(v)));
        try {
            return new Execution(scope, SandboxEnvironment.create(random)).eval(tree);
        } catch (SandboxException | EvaluationException e) {
            throw e;
        } catch (ArithmeticException | ClassCastException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new EvaluationException("evaluation failed: " + e.getMessage(), e);
        }
    }

    private final class Execution {
        private final Map<String, Object> scope;
        private final SandboxEnvironment environment;
        private int steps;

        Execution(Map<String, Object> scope, SandboxEnvironment environment) {
            this.scope = scope;
            this.environment = environment;
        }

        Object eval(Node node) {
            if (++steps > limits.maxEvaluationSteps()) {
                throw new SandboxException(SandboxException.STEP_BUDGET_EXCEEDED,
                        "Evaluation exceeded " + limits.maxEvaluationSteps() + " steps");
            }
            return switch (node.kind()) {
                case CONSTANT -> ((Constant) node).value();
                case NAME -> resolveName(((Name) node).id());
                case ATTRIBUTE -> resolveAttribute((Attribute) node);
                case UNARY_OP -> unary((UnaryOp) node);
                case BINARY_OP -> binary((BinOp) node);
                case BOOL_OP -> bool((BoolOp) node);
                case COMPARE -> compare((Compare) node);
                case CONDITIONAL -> {
                    Conditional cond = (Conditional) node;
                    yield SandboxValues.truthy(eval(cond.test())) ? eval(cond.body()) : eval(cond.orElse());
                }
                case CALL -> call((Call) node);
                case TUPLE -> sized(new Tuple(evalAll(((TupleLiteral) node).elements())));
                case LIST -> sized(Collections.unmodifiableList(evalAll(((ListLiteral) node).elements())));
                case DICT -> sized(dict((DictLiteral) node));
                case SUBSCRIPT -> subscript((Subscript) node);
                case SLICE -> throw new EvaluationException("slice is only valid as a subscript");
            };
        }

        private Object resolveName(String id) {
            if (scope.containsKey(id)) return scope.get(id);
            if (environment.isBound(id)) return environment.lookup(id);
            throw new SandboxException(SandboxException.UNKNOWN_IDENTIFIER, "Unknown identifier: " + id);
        }

        private Object resolveAttribute(Attribute attribute) {
            Object owner = eval(attribute.value());
            if (!(owner instanceof Namespace namespace)) {
                throw new SandboxException(SandboxException.DISALLOWED_ATTRIBUTE,
                        "Attribute access on '" + SandboxValues.typeName(owner) + "' is not permitted");
            }
            return namespace.member(attribute.attr()).orElseThrow(() -> new SandboxException(
                    SandboxException.DISALLOWED_ATTRIBUTE, "Disallowed " + namespace.name() + " member: " + attribute.attr()));
        }

        private Object unary(UnaryOp op) {
            Object operand = eval(op.operand());
            return switch (op.op()) {
                case PLUS -> SandboxValues.positive(operand);
                case MINUS -> SandboxValues.negate(operand);
                case NOT -> !SandboxValues.truthy(operand);
            };
        }

        private Object binary(BinOp op) {
            Object left = eval(op.left());
            Object right = eval(op.right());
            int maxLength = limits.maxSequenceLength();
            return switch (op.op()) {
                case ADD -> SandboxValues.add(left, right, maxLength);
                case SUB -> SandboxValues.subtract(left, right);
                case MUL -> SandboxValues.multiply(left, right, maxLength);
                case DIV -> SandboxValues.trueDivide(left, right);
                case FLOOR_DIV -> SandboxValues.floorDivide(left, right);
                case MOD -> SandboxValues.modulo(left, right);
                case POW -> SandboxValues.power(left, right);
            };
        }

        private Object bool(BoolOp op) {
            Object value = null;
            for (Node operand : op.values()) {
                value = eval(operand);
                boolean truth = SandboxValues.truthy(value);
                if (op.op() == BoolOperator.AND && !truth) return value;
                if (op.op() == BoolOperator.OR && truth) return value;
            }
            return value;
        }

        private Object compare(Compare cmp) {
            Object left = eval(cmp.left());
            for (int i = 0; i < cmp.ops().size(); i++) {
                CompareOperator operator = cmp.ops().get(i);
                Object right = eval(cmp.comparators().get(i));
                boolean holds = switch (operator) {
                    case EQ -> SandboxValues.valueEquals(left, right);
                    case NOT_EQ -> !SandboxValues.valueEquals(left, right);
                    case LT -> SandboxValues.order(left, right, operator.symbol()) < 0;
                    case LT_E -> SandboxValues.order(left, right, operator.symbol()) <= 0;
                    case GT -> SandboxValues.order(left, right, operator.symbol()) > 0;
                    case GT_E -> SandboxValues.order(left, right, operator.symbol()) >= 0;
                    case IN -> SandboxValues.contains(right, left);
                    case NOT_IN -> !SandboxValues.contains(right, left);
                    case IS -> SandboxValues.identical(left, right);
                    case IS_NOT -> !SandboxValues.identical(left, right);
                };
                if (!holds) return false;
                left = right;
            }
            return true;
        }

        private Object call(Call call) {
            Object callee = eval(call.func());
            if (!(callee instanceof BuiltinFunction function)) {
                throw new EvaluationException("'" + SandboxValues.typeName(callee) + "' object is not callable");
            }
            return function.call(evalAll(call.args()));
        }

        private Object dict(DictLiteral dict) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < dict.keys().size(); i++) {
                Object key = eval(dict.keys().get(i));
                if (key instanceof List || key instanceof Map) {
                    throw new EvaluationException("unhashable type: '" + SandboxValues.typeName(key) + "'");
                }
                Object value = eval(dict.values().get(i));
                Object existing = map.keySet().stream()
                        .filter(k -> SandboxValues.valueEquals(k, key))
                        .findFirst()
                        .orElse(key);
                map.put(existing, value);
            }
            return Collections.unmodifiableMap(map);
        }

        private Object subscript(Subscript sub) {
            Object value = eval(sub.value());
            if (sub.index() instanceof Slice slice) {
                return SandboxValues.slice(value, evalOptional(slice.lower()), evalOptional(slice.upper()), evalOptional(slice.step()));
            }
            return SandboxValues.index(value, eval(sub.index()));
        }

        private Object sized(Object value) {
            return SandboxValues.checkSize(value, limits.maxSequenceLength());
        }

        private Object evalOptional(Node node) {
            return node == null ? null : eval(node);
        }

        private List<Object> evalAll(List<Node> nodes) {
            SandboxValues.checkLength(nodes.size(), limits.maxSequenceLength());
            List<Object> values = new ArrayList<>(nodes.size());
            for (Node n : nodes) values.add(eval(n));
            return values;
        }
    }
}
