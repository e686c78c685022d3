package com.herzen.oracle.validation;

import com.herzen.oracle.pattern.PatternModels.*;
import com.herzen.oracle.pattern.Placeholders;
import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.SandboxException;
import com.herzen.oracle.solver.SolverExecutor;
import com.herzen.oracle.validation.ValidationModels.PatternIssue;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

@Component
public class PatternDefinitionValidator {
    private static final Pattern PATTERN_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final ExpressionEvaluator evaluator;
    private final SolverExecutor solverExecutor;

    public PatternDefinitionValidator(ExpressionEvaluator evaluator, SolverExecutor solverExecutor) {
        this.evaluator = evaluator;
        this.solverExecutor = solverExecutor;
    }

    public List<PatternIssue> validate(PatternTemplate pattern) {
        List<PatternIssue> issues = new ArrayList<>();

        required(pattern.patternId(), "pattern_id", issues);
        required(pattern.topic(), "topic", issues);
        required(pattern.templateText(), "template_text", issues);
        if (pattern.patternId() != null && !pattern.patternId().isBlank() && !PATTERN_ID.matcher(pattern.patternId()).matches()) {
            issues.add(new PatternIssue("INVALID_PATTERN_ID", "Pattern id may only contain letters, digits, '_' and '-': " + pattern.patternId(), "pattern_id"));
        }
        if (pattern.marks() < 1) {
            issues.add(new PatternIssue("INVALID_MARKS", "Marks must be at least 1: " + pattern.marks(), "marks"));
        }
        if (!(pattern.difficulty() >= 0.0 && pattern.difficulty() <= 1.0)) {
            issues.add(new PatternIssue("INVALID_DIFFICULTY", "Difficulty must be between 0 and 1: " + pattern.difficulty(), "difficulty"));
        }

        Map<String, VariableSpec> variables = pattern.variables();
        variables.forEach((name, spec) -> variable(name, spec, variables.keySet(), issues));

        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String name : variables.keySet()) {
            if (hasCycle(name, variables, visiting, visited)) {
                issues.add(new PatternIssue("CYCLE_DETECTED", "Calculated variables depend on each other in a cycle", "variables." + name));
                break;
            }
        }

        Set<String> ruleNames = new HashSet<>(variables.keySet());
        if (pattern.hasSolver()) ruleNames.add(SolverExecutor.RESULT_VARIABLE);
        for (int i = 0; i < pattern.validationRules().size(); i++) {
            String rule = pattern.validationRules().get(i);
            String field = "validation_rules[" + i + "]";
            references(rule, ruleNames, field, issues);
            expression(rule, ruleNames, field, issues);
        }

        if (pattern.hasSolver()) {
            try {
                solverExecutor.check(pattern.solverCode(), variables.keySet());
            } catch (SandboxException e) {
                issues.add(new PatternIssue("INVALID_EXPRESSION", e.getMessage(), "solver_code"));
            }
        }
        return issues;
    }

    private void variable(String name, VariableSpec spec, Set<String> names, List<PatternIssue> issues) {
        String field = "variables." + name;
        if (spec instanceof IntSpec i && i.min() > i.max()) {
            issues.add(new PatternIssue("INVALID_RANGE", "min " + i.min() + " is greater than max " + i.max(), field));
        } else if (spec instanceof FloatSpec f) {
            if (f.min() > f.max()) {
                issues.add(new PatternIssue("INVALID_RANGE", "min " + f.min() + " is greater than max " + f.max(), field));
            }
            if (f.decimals() < 0) {
                issues.add(new PatternIssue("INVALID_DECIMALS", "decimals must not be negative: " + f.decimals(), field));
            }
        } else if (spec instanceof ChoiceSpec c && c.choices().isEmpty()) {
            issues.add(new PatternIssue("EMPTY_CHOICES", "Choice variable has no choices", field));
        } else if (spec instanceof CalculatedSpec c) {
            references(c.formula(), names, field, issues);
            expression(c.formula(), names, field, issues);
        }
    }

    private void references(String text, Set<String> names, String field, List<PatternIssue> issues) {
        for (String ref : Placeholders.references(text)) {
            if (!names.contains(ref)) {
                issues.add(new PatternIssue("UNDEFINED_REFERENCE", "Reference to undefined variable: {" + ref + "}", field));
            }
        }
    }

    private void expression(String text, Set<String> names, String field, List<PatternIssue> issues) {
        try {
            evaluator.compile(Placeholders.replaceAll(text, "0"), names, false);
        } catch (SandboxException e) {
            issues.add(new PatternIssue("INVALID_EXPRESSION", e.getMessage(), field));
        }
    }

    private void required(String value, String field, List<PatternIssue> issues) {
        if (value == null || value.isBlank()) {
            issues.add(new PatternIssue("MISSING_FIELD", "Missing required field: " + field, field));
        }
    }

    private boolean hasCycle(String node, Map<String, VariableSpec> variables, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        if (variables.get(node) instanceof CalculatedSpec c) {
            for (String next : Placeholders.references(c.formula())) {
                if (variables.containsKey(next) && hasCycle(next, variables, visiting, visited)) return true;
            }
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }
}
