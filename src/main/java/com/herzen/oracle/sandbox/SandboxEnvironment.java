package com.herzen.oracle.sandbox;

import java.util.*;
import java.util.function.Function;

public final class SandboxEnvironment {
    public static final String MATH = "math";
    public static final String RANDOM = "random";

    public record BuiltinFunction(String name, Function<List<Object>, Object> body) {
        public Object call(List<Object> args) {
            return body.apply(args);
        }
    }

    public record Namespace(String name, Map<String, Object> members) {
        public Optional<Object> member(String attr) {
            return Optional.ofNullable(members.get(attr));
        }
    }

    private static final Map<String, Object> BUILTINS;
    private static final Map<String, Object> MATH_MEMBERS;
    private static final Namespace MATH_NAMESPACE;
    private static final Set<String> RANDOM_MEMBER_NAMES = Set.of("randint", "uniform", "choice");

    static {
        Map<String, Object> builtins = new LinkedHashMap<>();
        register(builtins, "abs", SandboxFunctions::abs);
        register(builtins, "round", SandboxFunctions::round);
        register(builtins, "min", args -> SandboxFunctions.extreme("min", args, -1));
        register(builtins, "max", args -> SandboxFunctions.extreme("max", args, 1));
        register(builtins, "int", SandboxFunctions::toInt);
        register(builtins, "float", SandboxFunctions::toFloat);
        register(builtins, "pow", SandboxFunctions::pow);
        register(builtins, "sum", SandboxFunctions::sum);
        register(builtins, "len", SandboxFunctions::len);
        BUILTINS = Collections.unmodifiableMap(builtins);

        Map<String, Object> math = new LinkedHashMap<>();
        register(math, "sqrt", SandboxFunctions::sqrt);
        register(math, "sin", args -> SandboxFunctions.trig("sin", args, Math::sin));
        register(math, "cos", args -> SandboxFunctions.trig("cos", args, Math::cos));
        register(math, "tan", args -> SandboxFunctions.trig("tan", args, Math::tan));
        register(math, "asin", args -> SandboxFunctions.inverseTrig("asin", args, Math::asin));
        register(math, "acos", args -> SandboxFunctions.inverseTrig("acos", args, Math::acos));
        register(math, "atan", args -> SandboxFunctions.unary("atan", args, Math::atan));
        register(math, "degrees", args -> SandboxFunctions.unary("degrees", args, Math::toDegrees));
        register(math, "radians", args -> SandboxFunctions.unary("radians", args, Math::toRadians));
        math.put("pi", Math.PI);
        math.put("e", Math.E);
        register(math, "gcd", SandboxFunctions::gcd);
        register(math, "ceil", args -> SandboxFunctions.rounding("ceil", args, Math::ceil));
        register(math, "floor", args -> SandboxFunctions.rounding("floor", args, Math::floor));
        MATH_MEMBERS = Collections.unmodifiableMap(math);
        MATH_NAMESPACE = new Namespace(MATH, MATH_MEMBERS);
    }

    private static final SandboxEnvironment WITHOUT_RANDOM = new SandboxEnvironment(null);

    private final Map<String, Object> globals;

    private SandboxEnvironment(RandomSource random) {
        Map<String, Object> globals = new HashMap<>(BUILTINS);
        globals.putAll(MATH_MEMBERS);
        globals.put(MATH, MATH_NAMESPACE);
        if (random != null) {
            globals.put(RANDOM, randomNamespace(random));
        }
        this.globals = Collections.unmodifiableMap(globals);
    }

    public static SandboxEnvironment create(RandomSource random) {
        return random == null ? WITHOUT_RANDOM : new SandboxEnvironment(random);
    }

    public boolean isBound(String name) {
        return globals.containsKey(name);
    }

    public Object lookup(String name) {
        return globals.get(name);
    }

    public static Set<String> builtinNames() {
        return BUILTINS.keySet();
    }

    public static Set<String> mathMemberNames() {
        return MATH_MEMBERS.keySet();
    }

    public static Set<String> randomMemberNames() {
        return RANDOM_MEMBER_NAMES;
    }

    private static Namespace randomNamespace(RandomSource random) {
        Map<String, Object> members = new LinkedHashMap<>();
        register(members, "randint", args -> SandboxFunctions.randint(args, random));
        register(members, "uniform", args -> SandboxFunctions.uniform(args, random));
        register(members, "choice", args -> SandboxFunctions.choice(args, random));
        return new Namespace(RANDOM, Collections.unmodifiableMap(members));
    }

    private static void register(Map<String, Object> target, String name, Function<List<Object>, Object> body) {
        target.put(name, new BuiltinFunction(name, body));
    }
}
