package com.herzen.oracle.pattern;

import com.herzen.oracle.pattern.PatternModels.*;
import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.RandomSource;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

@Component
public class VariableResolver {
    private final ExpressionEvaluator evaluator;

    public VariableResolver(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Map<String, Object> resolve(Map<String, VariableSpec> specs, RandomSource random) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        Map<String, CalculatedSpec> calculated = new LinkedHashMap<>();
        specs.forEach((name, spec) -> {
            if (spec instanceof CalculatedSpec c) {
                calculated.put(name, c);
            } else {
                resolved.put(name, draw(spec, random));
            }
        });
        if (calculated.isEmpty()) return Collections.unmodifiableMap(resolved);

        Map<String, List<String>> dependents = new HashMap<>();
        Map<String, Integer> pendingDeps = new LinkedHashMap<>();
        Set<String> undefined = new LinkedHashSet<>();
        Set<String> blocked = new HashSet<>();
        calculated.forEach((name, spec) -> {
            int deps = 0;
            for (String ref : Placeholders.references(spec.formula())) {
                if (calculated.containsKey(ref)) {
                    dependents.computeIfAbsent(ref, k -> new ArrayList<>()).add(name);
                    deps++;
                } else if (!resolved.containsKey(ref)) {
                    undefined.add(ref);
                    blocked.add(name);
                }
            }
            pendingDeps.put(name, deps);
        });

        Deque<String> ready = new ArrayDeque<>();
        pendingDeps.forEach((name, deps) -> {
            if (deps == 0 && !blocked.contains(name)) ready.add(name);
        });
        while (!ready.isEmpty()) {
            String name = ready.poll();
            String formula = Placeholders.substitute(calculated.get(name).formula(), resolved)
                    .orElseThrow(() -> new IllegalStateException("dependencies of " + name + " not resolved"));
            resolved.put(name, evaluator.evaluate(formula, resolved));
            for (String dependent : dependents.getOrDefault(name, List.of())) {
                int left = pendingDeps.merge(dependent, -1, Integer::sum);
                if (left == 0 && !blocked.contains(dependent)) ready.add(dependent);
            }
        }

        List<String> unresolved = calculated.keySet().stream().filter(n -> !resolved.containsKey(n)).sorted().toList();
        if (!unresolved.isEmpty()) {
            List<String> cycle = findCycle(unresolved, calculated);
            if (!cycle.isEmpty()) throw new CyclicDependencyException(unresolved, cycle);
            throw new ResolutionException(unresolved, undefined);
        }
        return Collections.unmodifiableMap(resolved);
    }

    Object draw(VariableSpec spec, RandomSource random) {
        if (spec instanceof IntSpec i) {
            return random.nextInt(i.min(), i.max());
        }
        if (spec instanceof FloatSpec f) {
            double value = random.nextDouble(f.min(), f.max());
            return BigDecimal.valueOf(value).setScale(Math.max(0, f.decimals()), RoundingMode.HALF_EVEN).doubleValue();
        }
        if (spec instanceof ChoiceSpec c) {
            return random.choose(c.choices());
        }
        throw new IllegalArgumentException("not a random variable: " + spec);
    }

    private List<String> findCycle(List<String> unresolved, Map<String, CalculatedSpec> calculated) {
        Set<String> candidates = new HashSet<>(unresolved);
        Set<String> visited = new HashSet<>();
        for (String start : unresolved) {
            Deque<String> path = new ArrayDeque<>();
            List<String> cycle = walk(start, candidates, calculated, new HashSet<>(), visited, path);
            if (!cycle.isEmpty()) return cycle;
        }
        return List.of();
    }

    private List<String> walk(String node, Set<String> candidates, Map<String, CalculatedSpec> calculated,
                              Set<String> visiting, Set<String> visited, Deque<String> path) {
        if (visited.contains(node)) return List.of();
        path.addLast(node);
        if (!visiting.add(node)) {
            List<String> trail = new ArrayList<>(path);
            return trail.subList(trail.indexOf(node), trail.size());
        }
        for (String next : Placeholders.references(calculated.get(node).formula())) {
            if (!candidates.contains(next)) continue;
            List<String> cycle = walk(next, candidates, calculated, visiting, visited, path);
            if (!cycle.isEmpty()) return cycle;
        }
        visiting.remove(node);
        visited.add(node);
        path.removeLast();
        return List.of();
    }
}
