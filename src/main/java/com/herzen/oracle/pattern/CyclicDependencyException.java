package com.herzen.oracle.pattern;

import java.util.List;
import java.util.Set;

public class CyclicDependencyException extends ResolutionException {
    private final List<String> cycle;

    public CyclicDependencyException(List<String> unresolved, List<String> cycle) {
        super("Unresolved calculated variables: " + String.join(", ", unresolved)
                + " (cycle: " + String.join(" -> ", cycle) + ")", unresolved, Set.of());
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
