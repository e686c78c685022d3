package com.herzen.oracle.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.herzen.oracle.sandbox.SandboxValues;

import java.time.LocalDateTime;
import java.util.*;

public class PatternModels {
    public record PatternTemplate(@JsonProperty("pattern_id") String patternId,
                                  @JsonProperty("topic") String topic,
                                  @JsonProperty("marks") int marks,
                                  @JsonProperty("difficulty") double difficulty,
                                  @JsonProperty("template_text") String templateText,
                                  @JsonProperty("variables") Map<String, VariableSpec> variables,
                                  @JsonProperty("solution_template") List<String> solutionTemplate,
                                  @JsonProperty("answer_template") String answerTemplate,
                                  @JsonProperty("socratic_hints") List<SocraticHint> socraticHints,
                                  @JsonProperty("validation_rules") List<String> validationRules,
                                  @JsonProperty("solver_code") String solverCode,
                                  @JsonProperty("created_at") LocalDateTime createdAt,
                                  @JsonProperty("updated_at") LocalDateTime updatedAt) {
        public PatternTemplate {
            variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
            solutionTemplate = solutionTemplate == null ? List.of() : List.copyOf(solutionTemplate);
            answerTemplate = answerTemplate == null ? "" : answerTemplate;
            socraticHints = socraticHints == null ? List.of() : List.copyOf(socraticHints);
            validationRules = validationRules == null ? List.of() : List.copyOf(validationRules);
            createdAt = createdAt == null ? LocalDateTime.now() : createdAt;
            updatedAt = updatedAt == null ? createdAt : updatedAt;
        }

        public boolean hasSolver() {
            return solverCode != null && !solverCode.isBlank();
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type", defaultImpl = IntSpec.class)
    @JsonSubTypes({
            @JsonSubTypes.Type(value = IntSpec.class, name = "int"),
            @JsonSubTypes.Type(value = FloatSpec.class, name = "float"),
            @JsonSubTypes.Type(value = ChoiceSpec.class, name = "choice"),
            @JsonSubTypes.Type(value = CalculatedSpec.class, name = "calculated")
    })
    public sealed interface VariableSpec permits IntSpec, FloatSpec, ChoiceSpec, CalculatedSpec {}

    public record IntSpec(@JsonProperty("min") Long min, @JsonProperty("max") Long max) implements VariableSpec {
        public IntSpec {
            min = min == null ? 1L : min;
            max = max == null ? 100L : max;
        }
    }

    public record FloatSpec(@JsonProperty("min") Double min,
                            @JsonProperty("max") Double max,
                            @JsonProperty("decimals") Integer decimals) implements VariableSpec {
        public FloatSpec {
            min = min == null ? 1.0 : min;
            max = max == null ? 100.0 : max;
            decimals = decimals == null ? 2 : decimals;
        }
    }

    public record ChoiceSpec(@JsonProperty("choices") List<Object> choices) implements VariableSpec {
        public ChoiceSpec {
            choices = choices == null ? List.of(1L, 2L, 3L) : choices.stream().map(SandboxValues::normalize).toList();
        }
    }

    public record CalculatedSpec(@JsonProperty("formula") String formula) implements VariableSpec {
        public CalculatedSpec {
            formula = formula == null ? "{a} + {b}" : formula;
        }
    }

    public record SocraticHint(@JsonProperty("level") int level,
                               @JsonProperty("hint") String hint,
                               @JsonProperty("nudge") String nudge) {}

    public record GeneratedQuestion(@JsonProperty("question_id") String questionId,
                                    @JsonProperty("pattern_id") String patternId,
                                    @JsonProperty("topic") String topic,
                                    @JsonProperty("question_text") String questionText,
                                    @JsonProperty("solution_steps") List<String> solutionSteps,
                                    @JsonProperty("final_answer") String finalAnswer,
                                    @JsonProperty("marks") int marks,
                                    @JsonProperty("difficulty") double difficulty,
                                    @JsonProperty("variables") Map<String, Object> variables,
                                    @JsonProperty("socratic_hints") List<SocraticHint> socraticHints,
                                    @JsonProperty("attempts") int attempts,
                                    @JsonProperty("generated_at") LocalDateTime generatedAt) {}

    public record PatternStats(@JsonProperty("total_patterns") int totalPatterns,
                               @JsonProperty("topics") Map<String, Long> topics,
                               @JsonProperty("last_updated") LocalDateTime lastUpdated,
                               @JsonProperty("generations") Map<String, Long> generations) {}

    public record PatternHealthReport(@JsonProperty("pattern_id") String patternId,
                                      @JsonProperty("samples") int samples,
                                      @JsonProperty("successes") int successes,
                                      @JsonProperty("failures") List<String> failures,
                                      @JsonProperty("distinct_questions") int distinctQuestions,
                                      @JsonProperty("answers_round_trip") boolean answersRoundTrip) {
        public boolean healthy() {
            return failures.isEmpty() && answersRoundTrip;
        }
    }
}
