package com.herzen.oracle.validation;

import com.herzen.oracle.pattern.Placeholders;
import com.herzen.oracle.sandbox.EvaluationException;
import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.validation.ValidationModels.RuleOutcome;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ValidationRuleChecker {
    private final ExpressionEvaluator evaluator;

    public ValidationRuleChecker(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public RuleOutcome check(List<String> rules, Map<String, Object> variables) {
        for (String rule : rules) {
            Optional<String> rendered = Placeholders.substitute(rule, variables);
            if (rendered.isEmpty()) {
                return RuleOutcome.fail(rule, "unknown placeholder");
            }
            try {
                if (!evaluator.evaluateBoolean(rendered.get(), variables)) {
                    return RuleOutcome.fail(rule, "false for " + rendered.get());
                }
            } catch (EvaluationException e) {
                return RuleOutcome.fail(rule, e.getMessage());
            }
        }
        return RuleOutcome.pass();
    }
}
