package com.herzen.oracle;

import com.herzen.oracle.pattern.CyclicDependencyException;
import com.herzen.oracle.pattern.PatternModels.*;
import com.herzen.oracle.pattern.ResolutionException;
import com.herzen.oracle.pattern.VariableResolver;
import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.SandboxLimits;
import com.herzen.oracle.sandbox.SeededRandomSource;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableResolverTest {
    private final VariableResolver resolver = new VariableResolver(new ExpressionEvaluator(SandboxLimits.defaults(), null));

    @Test
    void resolvesCalculatedVariableAfterItsDependency() {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        specs.put("x", new CalculatedSpec("{y}+1"));
        specs.put("y", new IntSpec(1L, 1L));

        Map<String, Object> values = resolver.resolve(specs, new SeededRandomSource(1));
        assertEquals(1L, values.get("y"));
        assertEquals(2L, values.get("x"));
    }

    @Test
    void resolvesChainsInDependencyOrder() {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        specs.put("area", new CalculatedSpec("{side} ** 2"));
        specs.put("perimeter", new CalculatedSpec("4 * {length}"));
        specs.put("side", new CalculatedSpec("{length}"));
        specs.put("length", new IntSpec(3L, 3L));

        Map<String, Object> values = resolver.resolve(specs, new SeededRandomSource(1));
        assertEquals(9L, values.get("area"));
        assertEquals(12L, values.get("perimeter"));
    }

    @Test
    void parenthesisesNegativeValuesOnSubstitution() {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        specs.put("n", new IntSpec(-3L, -3L));
        specs.put("square", new CalculatedSpec("{n}**2"));

        assertEquals(9L, resolver.resolve(specs, new SeededRandomSource(1)).get("square"));
    }

    @Test
    void drawsWithinRangesAndRoundsFloats() {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        specs.put("i", new IntSpec(5L, 10L));
        specs.put("f", new FloatSpec(0.0, 1.0, 1));
        specs.put("c", new ChoiceSpec(List.of("red", "blue")));

        for (int seed = 0; seed < 20; seed++) {
            Map<String, Object> values = resolver.resolve(specs, new SeededRandomSource(seed));
            long i = (Long) values.get("i");
            double f = (Double) values.get("f");
            assertTrue(i >= 5 && i <= 10);
            assertTrue(f >= 0.0 && f <= 1.0);
            assertEquals(f, Math.round(f * 10) / 10.0, 1e-12);
            assertTrue(List.of("red", "blue").contains(values.get("c")));
        }
    }

    @Test
    void sameSeedGivesSameDraw() {
        Map<String, VariableSpec> specs = Map.of("a", new IntSpec(1L, 1000L), "b", new FloatSpec(null, null, null));
        assertEquals(resolver.resolve(specs, new SeededRandomSource(42)), resolver.resolve(specs, new SeededRandomSource(42)));
    }

    @Test
    void reportsCycleNamingBothVariables() {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        specs.put("x", new CalculatedSpec("{y}+1"));
        specs.put("y", new CalculatedSpec("{x}+1"));

        CyclicDependencyException ex = assertThrows(CyclicDependencyException.class,
                () -> resolver.resolve(specs, new SeededRandomSource(1)));
        assertEquals(List.of("x", "y"), ex.unresolved());
        assertTrue(ex.cycle().containsAll(List.of("x", "y")));
        assertTrue(ex.getMessage().contains("x") && ex.getMessage().contains("y"));
    }

    @Test
    void reportsUndefinedReferenceAndItsDependents() {
        Map<String, VariableSpec> specs = new LinkedHashMap<>();
        specs.put("a", new IntSpec(1L, 1L));
        specs.put("b", new CalculatedSpec("{missing} + {a}"));
        specs.put("c", new CalculatedSpec("{b} * 2"));

        ResolutionException ex = assertThrows(ResolutionException.class, () -> resolver.resolve(specs, new SeededRandomSource(1)));
        assertFalse(ex instanceof CyclicDependencyException);
        assertEquals(List.of("b", "c"), ex.unresolved());
        assertTrue(ex.undefinedReferences().contains("missing"));
    }

    @Test
    void appliesSpecDefaults() {
        assertEquals(new IntSpec(1L, 100L), new IntSpec(null, null));
        assertEquals(new FloatSpec(1.0, 100.0, 2), new FloatSpec(null, null, null));
        assertEquals(List.of(1L, 2L, 3L), new ChoiceSpec(null).choices());
        assertEquals("{a} + {b}", new CalculatedSpec(null).formula());
    }
}
