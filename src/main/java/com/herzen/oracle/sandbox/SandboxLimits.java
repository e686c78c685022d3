package com.herzen.oracle.sandbox;

public record SandboxLimits(int maxExpressionLength,
                            int maxStatements,
                            int maxEvaluationSteps,
                            int maxSequenceLength) {
    public static SandboxLimits defaults() {
        return new SandboxLimits(300, 20, 10_000, 10_000);
    }
}
