package com.herzen.oracle.sandbox;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Pattern;

import static com.herzen.oracle.sandbox.SandboxValues.*;

final class SandboxFunctions {
    private static final Pattern FLOAT_LITERAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private SandboxFunctions() {}

    static Object abs(List<Object> args) {
        arity("abs", args, 1, 1);
        Object x = args.get(0);
        if (x instanceof Double d) return Math.abs(d);
        if (isInteger(x)) {
            try {
                return Math.absExact(asLong(x));
            } catch (ArithmeticException e) {
                throw new EvaluationException("integer overflow");
            }
        }
        throw new EvaluationException("bad operand type for abs(): '" + typeName(x) + "'");
    }

    static Object round(List<Object> args) {
        arity("round", args, 1, 2);
        Object x = args.get(0);
        if (!isNumber(x)) throw new EvaluationException("type " + typeName(x) + " doesn't define round()");
        Object digits = args.size() == 2 ? args.get(1) : null;
        if (digits == null) {
            if (isInteger(x)) return asLong(x);
            double d = (Double) x;
            if (!Double.isFinite(d)) throw new EvaluationException("cannot convert float " + formatFloat(d) + " to integer");
            return toLong(Math.rint(d));
        }
        if (!isInteger(digits)) {
            throw new EvaluationException("'" + typeName(digits) + "' object cannot be interpreted as an integer");
        }
        int n = (int) Math.max(-400, Math.min(400, asLong(digits)));
        if (isInteger(x)) {
            if (n >= 0) return asLong(x);
            return new BigDecimal(asLong(x)).setScale(n, RoundingMode.HALF_EVEN).longValue();
        }
        double d = (Double) x;
        if (!Double.isFinite(d)) return d;
        return new BigDecimal(d).setScale(n, RoundingMode.HALF_EVEN).doubleValue();
    }

    static Object extreme(String name, List<Object> args, int direction) {
        if (args.isEmpty()) throw new EvaluationException(name + " expected at least 1 argument, got 0");
        List<Object> candidates = args.size() == 1 ? iterate(args.get(0)) : args;
        if (candidates.isEmpty()) throw new EvaluationException(name + "() arg is an empty sequence");
        Object best = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            Object candidate = candidates.get(i);
            if (order(candidate, best, direction > 0 ? ">" : "<") * direction > 0) {
                best = candidate;
            }
        }
        return best;
    }

    static Object toInt(List<Object> args) {
        arity("int", args, 0, 2);
        if (args.isEmpty()) return 0L;
        Object x = args.get(0);
        if (args.size() == 2) {
            if (!(x instanceof String s)) throw new EvaluationException("int() can't convert non-string with explicit base");
            return parseInt(s, (int) asLong(args.get(1)));
        }
        if (isInteger(x)) return asLong(x);
        if (x instanceof Double d) {
            if (!Double.isFinite(d)) throw new EvaluationException("cannot convert float " + formatFloat(d) + " to integer");
            return toLong(d < 0 ? Math.ceil(d) : Math.floor(d));
        }
        if (x instanceof String s) return parseInt(s, 10);
        throw new EvaluationException("int() argument must be a string or a number, not '" + typeName(x) + "'");
    }

    private static long parseInt(String s, int base) {
        if (base < 2 || base > 36) throw new EvaluationException("int() base must be >= 2 and <= 36");
        String text = s.trim().replace("_", "");
        try {
            return Long.parseLong(text.startsWith("+") ? text.substring(1) : text, base);
        } catch (NumberFormatException e) {
            throw new EvaluationException("invalid literal for int() with base " + base + ": " + repr(s));
        }
    }

    static Object toFloat(List<Object> args) {
        arity("float", args, 0, 1);
        if (args.isEmpty()) return 0.0;
        Object x = args.get(0);
        if (isNumber(x)) return toDouble(x);
        if (x instanceof String s) {
            String text = s.trim().toLowerCase();
            switch (text) {
                case "inf", "+inf", "infinity", "+infinity" -> {
                    return Double.POSITIVE_INFINITY;
                }
                case "-inf", "-infinity" -> {
                    return Double.NEGATIVE_INFINITY;
                }
                case "nan", "+nan", "-nan" -> {
                    return Double.NaN;
                }
                default -> {
                    if (FLOAT_LITERAL.matcher(text).matches()) return Double.parseDouble(text);
                    throw new EvaluationException("could not convert string to float: " + repr(s));
                }
            }
        }
        throw new EvaluationException("float() argument must be a string or a number, not '" + typeName(x) + "'");
    }

    static Object pow(List<Object> args) {
        arity("pow", args, 2, 3);
        if (args.size() == 2) return power(args.get(0), args.get(1));
        Object base = args.get(0);
        Object exp = args.get(1);
        Object mod = args.get(2);
        if (!isInteger(base) || !isInteger(exp) || !isInteger(mod)) {
            throw new EvaluationException("pow() 3rd argument not allowed unless all arguments are integers");
        }
        long m = asLong(mod);
        if (m == 0) throw new EvaluationException("pow() 3rd argument cannot be 0");
        if (asLong(exp) < 0) throw new EvaluationException("pow() 2nd argument cannot be negative when 3rd argument specified");
        BigInteger modulus = BigInteger.valueOf(m).abs();
        BigInteger r = BigInteger.valueOf(asLong(base)).modPow(BigInteger.valueOf(asLong(exp)), modulus);
        if (m < 0 && r.signum() != 0) r = r.add(BigInteger.valueOf(m));
        return r.longValue();
    }

    static Object sum(List<Object> args) {
        arity("sum", args, 1, 2);
        Object total = args.size() == 2 ? args.get(1) : 0L;
        if (total instanceof String) throw new EvaluationException("sum() can't sum strings");
        for (Object item : iterate(args.get(0))) {
            total = add(total, item, Integer.MAX_VALUE);
        }
        return total;
    }

    static Object len(List<Object> args) {
        arity("len", args, 1, 1);
        return (long) length(args.get(0));
    }

    static Object sqrt(List<Object> args) {
        arity("sqrt", args, 1, 1);
        double x = toDouble(args.get(0));
        if (x < 0) throw new EvaluationException("math domain error");
        return Math.sqrt(x);
    }

    static Object trig(String name, List<Object> args, DoubleUnaryOperator fn) {
        arity(name, args, 1, 1);
        double x = toDouble(args.get(0));
        if (Double.isInfinite(x)) throw new EvaluationException("math domain error");
        return fn.applyAsDouble(x);
    }

    static Object inverseTrig(String name, List<Object> args, DoubleUnaryOperator fn) {
        arity(name, args, 1, 1);
        double x = toDouble(args.get(0));
        if (x < -1.0 || x > 1.0) throw new EvaluationException("math domain error");
        return fn.applyAsDouble(x);
    }

    static Object unary(String name, List<Object> args, DoubleUnaryOperator fn) {
        arity(name, args, 1, 1);
        return fn.applyAsDouble(toDouble(args.get(0)));
    }

    static Object gcd(List<Object> args) {
        BigInteger result = BigInteger.ZERO;
        for (Object arg : args) {
            if (!isInteger(arg)) {
                throw new EvaluationException("'" + typeName(arg) + "' object cannot be interpreted as an integer");
            }
            result = result.gcd(BigInteger.valueOf(asLong(arg)));
        }
        try {
            return result.longValueExact();
        } catch (ArithmeticException e) {
            throw new EvaluationException("integer overflow");
        }
    }

    static Object rounding(String name, List<Object> args, DoubleUnaryOperator fn) {
        arity(name, args, 1, 1);
        Object x = args.get(0);
        if (isInteger(x)) return asLong(x);
        double d = toDouble(x);
        if (!Double.isFinite(d)) throw new EvaluationException("cannot convert float " + formatFloat(d) + " to integer");
        return toLong(fn.applyAsDouble(d));
    }

    static Object randint(List<Object> args, RandomSource random) {
        arity("randint", args, 2, 2);
        return random.nextInt(asLong(args.get(0)), asLong(args.get(1)));
    }

    static Object uniform(List<Object> args, RandomSource random) {
        arity("uniform", args, 2, 2);
        return random.nextDouble(toDouble(args.get(0)), toDouble(args.get(1)));
    }

    static Object choice(List<Object> args, RandomSource random) {
        arity("choice", args, 1, 1);
        List<Object> options = iterate(args.get(0));
        if (options.isEmpty()) throw new EvaluationException("cannot choose from an empty sequence");
        return random.choose(options);
    }

    private static long toLong(double integral) {
        if (integral >= 0x1p63 || integral < -0x1p63) throw new EvaluationException("integer overflow");
        return (long) integral;
    }

    private static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + " to " + max;
            throw new EvaluationException(name + "() takes " + expected + " arguments (" + args.size() + " given)");
        }
    }
}
