package com.herzen.oracle.solver;

import com.herzen.oracle.sandbox.SandboxValues;

import java.util.List;

public class SolverModels {
    public enum StepKind {ASSIGNMENT, EXPRESSION, RETURN}

    public record SolverStep(StepKind kind, String expression, String target, Object value) {
        public String describe() {
            String rendered = SandboxValues.str(value);
            return switch (kind) {
                case ASSIGNMENT -> "Step: " + target + " = " + expression + " = " + rendered;
                case EXPRESSION -> "Evaluate: " + expression + " = " + rendered;
                case RETURN -> expression.isEmpty() ? "Final: " + rendered : "Final: " + expression + " = " + rendered;
            };
        }
    }

    public record SolverRun(Object result, List<SolverStep> steps) {
        public List<String> describe() {
            return steps.stream().map(SolverStep::describe).toList();
        }
    }
}
