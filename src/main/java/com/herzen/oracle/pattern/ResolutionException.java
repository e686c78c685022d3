package com.herzen.oracle.pattern;

import java.util.List;
import java.util.Set;

public class ResolutionException extends RuntimeException {
    private final List<String> unresolved;
    private final Set<String> undefinedReferences;

    public ResolutionException(List<String> unresolved, Set<String> undefinedReferences) {
        this("Unresolved calculated variables: " + String.join(", ", unresolved)
                + (undefinedReferences.isEmpty() ? "" : " (undefined references: " + String.join(", ", undefinedReferences) + ")"),
                unresolved, undefinedReferences);
    }

    protected ResolutionException(String message, List<String> unresolved, Set<String> undefinedReferences) {
        super(message);
        this.unresolved = List.copyOf(unresolved);
        this.undefinedReferences = Set.copyOf(undefinedReferences);
    }

    public List<String> unresolved() {
        return unresolved;
    }

    public Set<String> undefinedReferences() {
        return undefinedReferences;
    }
}
