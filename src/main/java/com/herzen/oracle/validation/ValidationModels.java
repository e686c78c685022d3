package com.herzen.oracle.validation;

public class ValidationModels {
    public record PatternIssue(String code, String message, String field) {}

    public record RuleOutcome(boolean passed, String failedRule, String reason) {
        public static RuleOutcome pass() {
            return new RuleOutcome(true, null, null);
        }

        public static RuleOutcome fail(String rule, String reason) {
            return new RuleOutcome(false, rule, reason);
        }
    }
}
