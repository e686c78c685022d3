package com.herzen.oracle.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.herzen.oracle.config.OracleProperties;
import com.herzen.oracle.pattern.PatternModels.*;
import com.herzen.oracle.pattern.TemplateRenderer;
import com.herzen.oracle.pattern.VariableResolver;
import com.herzen.oracle.repository.GenerationAuditJdbcRepository;
import com.herzen.oracle.repository.GenerationAuditJdbcRepository.AuditRow;
import com.herzen.oracle.repository.PatternRepository;
import com.herzen.oracle.sandbox.EvaluationException;
import com.herzen.oracle.sandbox.RandomSource;
import com.herzen.oracle.solver.SolverExecutor;
import com.herzen.oracle.validation.PatternDefinitionValidator;
import com.herzen.oracle.validation.ValidationModels.PatternIssue;
import com.herzen.oracle.validation.ValidationModels.RuleOutcome;
import com.herzen.oracle.validation.ValidationRuleChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

@Service
public class PatternService {
    private static final Logger log = LoggerFactory.getLogger(PatternService.class);
    private static final Set<String> UPDATABLE_FIELDS = Set.of(
            "topic", "marks", "difficulty", "template_text", "variables", "solution_template",
            "answer_template", "socratic_hints", "validation_rules", "solver_code", "created_at");

    private final PatternRepository repository;
    private final GenerationAuditJdbcRepository auditRepository;
    private final PatternDefinitionValidator definitionValidator;
    private final VariableResolver variableResolver;
    private final SolverExecutor solverExecutor;
    private final TemplateRenderer renderer;
    private final ValidationRuleChecker ruleChecker;
    private final RandomSource randomSource;
    private final ObjectMapper objectMapper;
    private final int maxAttempts;

    private final Map<String, PatternTemplate> cache = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public PatternService(PatternRepository repository,
                          GenerationAuditJdbcRepository auditRepository,
                          PatternDefinitionValidator definitionValidator,
                          VariableResolver variableResolver,
                          SolverExecutor solverExecutor,
                          TemplateRenderer renderer,
                          ValidationRuleChecker ruleChecker,
                          RandomSource randomSource,
                          ObjectMapper objectMapper,
                          OracleProperties properties) {
        this.repository = repository;
        this.auditRepository = auditRepository;
        this.definitionValidator = definitionValidator;
        this.variableResolver = variableResolver;
        this.solverExecutor = solverExecutor;
        this.renderer = renderer;
        this.ruleChecker = ruleChecker;
        this.randomSource = randomSource;
        this.objectMapper = objectMapper;
        this.maxAttempts = Math.max(1, properties.patterns().maxAttempts());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        loadAll();
    }

    public int loadAll() {
        writeLock.lock();
        try {
            List<PatternTemplate> patterns = repository.loadAll();
            cache.clear();
            for (PatternTemplate pattern : patterns) {
                List<PatternIssue> issues = definitionValidator.validate(pattern);
                if (!issues.isEmpty()) {
                    log.warn("Pattern {} loaded with definition issues: {}", pattern.patternId(), issues);
                }
                if (pattern.patternId() == null || pattern.patternId().isBlank()) {
                    log.warn("Skipping pattern without pattern_id");
                    continue;
                }
                if (cache.put(pattern.patternId(), pattern) != null) {
                    log.warn("Duplicate pattern id {}, keeping the last file read", pattern.patternId());
                }
            }
            log.info("Loaded {} patterns", cache.size());
            return cache.size();
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<PatternTemplate> getPattern(String patternId) {
        return patternId == null ? Optional.empty() : Optional.ofNullable(cache.get(patternId));
    }

    public List<PatternTemplate> findPatterns(String topic, Integer marks) {
        return cache.values().stream()
                .filter(p -> topic == null || topic.equals(p.topic()))
                .filter(p -> marks == null || marks == p.marks())
                .sorted(Comparator.comparing(PatternTemplate::patternId))
                .toList();
    }

    public GeneratedQuestion generateQuestion(String patternId) {
        return generateQuestion(patternId, randomSource);
    }

    public GeneratedQuestion generateQuestion(String patternId, RandomSource random) {
        PatternTemplate pattern = getPattern(patternId).orElseThrow(() -> new PatternNotFoundException(patternId));
        try {
            GeneratedQuestion question = generate(pattern, random);
            auditRepository.record(new AuditRow(patternId, GenerationAuditJdbcRepository.ACCEPTED, question.attempts(),
                    question.questionId(), null, null));
            return question;
        } catch (RuntimeException e) {
            log.warn("Generation failed for pattern {}: {}", patternId, e.getMessage());
            auditRepository.record(new AuditRow(patternId, GenerationAuditJdbcRepository.FAILED,
                    e instanceof GenerationFailedException g ? g.attempts() : 0, null, e.getMessage(), null));
            throw e;
        }
    }

    private GeneratedQuestion generate(PatternTemplate pattern, RandomSource random) {
        String lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Map<String, Object> variables;
            try {
                variables = resolve(pattern, random);
            } catch (EvaluationException e) {
                lastFailure = e.getMessage();
                log.debug("Attempt {} for {} rejected: {}", attempt, pattern.patternId(), lastFailure);
                continue;
            }

            String questionText = renderer.render(pattern.templateText(), variables);
            List<String> solutionSteps = pattern.solutionTemplate().stream()
                    .map(step -> renderer.render(step, variables))
                    .toList();
            String finalAnswer = renderer.render(pattern.answerTemplate(), variables);

            RuleOutcome outcome = ruleChecker.check(pattern.validationRules(), variables);
            if (!outcome.passed()) {
                lastFailure = "rule '" + outcome.failedRule() + "' failed: " + outcome.reason();
                log.debug("Attempt {} for {} rejected: {}", attempt, pattern.patternId(), lastFailure);
                continue;
            }

            return new GeneratedQuestion(
                    "PAT_" + pattern.patternId() + "_" + random.nextInt(1000, 9999),
                    pattern.patternId(),
                    pattern.topic(),
                    questionText,
                    solutionSteps,
                    finalAnswer,
                    pattern.marks(),
                    pattern.difficulty(),
                    variables,
                    pattern.socraticHints(),
                    attempt,
                    LocalDateTime.now());
        }
        throw new GenerationFailedException(pattern.patternId(), maxAttempts, lastFailure);
    }

    private Map<String, Object> resolve(PatternTemplate pattern, RandomSource random) {
        Map<String, Object> resolved = variableResolver.resolve(pattern.variables(), random);
        if (!pattern.hasSolver()) return resolved;
        Map<String, Object> withResult = new LinkedHashMap<>(resolved);
        withResult.put(SolverExecutor.RESULT_VARIABLE, solverExecutor.execute(pattern.solverCode(), resolved));
        return Collections.unmodifiableMap(withResult);
    }

    public PatternTemplate addPattern(PatternTemplate pattern) {
        List<PatternIssue> issues = definitionValidator.validate(pattern);
        if (!issues.isEmpty()) throw new InvalidPatternException(pattern.patternId(), issues);
        writeLock.lock();
        try {
            repository.save(pattern);
            boolean replaced = cache.put(pattern.patternId(), pattern) != null;
            log.info("{} pattern {}", replaced ? "Replaced" : "Added", pattern.patternId());
            return pattern;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean updatePattern(String patternId, Map<String, ?> updates) {
        writeLock.lock();
        try {
            PatternTemplate current = getPattern(patternId).orElse(null);
            if (current == null) return false;

            ObjectNode tree = objectMapper.valueToTree(current);
            updates.forEach((field, value) -> {
                if (UPDATABLE_FIELDS.contains(field)) {
                    tree.set(field, objectMapper.valueToTree(value));
                } else {
                    log.debug("Ignoring update of field {} on pattern {}", field, patternId);
                }
            });
            tree.put("pattern_id", patternId);
            tree.put("updated_at", LocalDateTime.now().toString());

            PatternTemplate updated;
            try {
                updated = objectMapper.treeToValue(tree, PatternTemplate.class);
            } catch (JsonProcessingException e) {
                throw new InvalidPatternException(patternId,
                        List.of(new PatternIssue("INVALID_VALUE", e.getOriginalMessage(), null)));
            }
            List<PatternIssue> issues = definitionValidator.validate(updated);
            if (!issues.isEmpty()) throw new InvalidPatternException(patternId, issues);

            repository.save(updated);
            cache.put(patternId, updated);
            log.info("Updated pattern {}", patternId);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean deletePattern(String patternId) {
        writeLock.lock();
        try {
            if (patternId == null || !cache.containsKey(patternId)) return false;
            if (!repository.archive(patternId)) {
                log.warn("Pattern {} had no stored file to archive", patternId);
            }
            cache.remove(patternId);
            log.info("Archived pattern {}", patternId);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public PatternStats stats() {
        Map<String, Long> topics = cache.values().stream()
                .collect(Collectors.groupingBy(p -> Objects.requireNonNullElse(p.topic(), ""), TreeMap::new, Collectors.counting()));
        LocalDateTime lastUpdated = cache.values().stream()
                .map(PatternTemplate::updatedAt)
                .max(Comparator.naturalOrder())
                .orElse(null);
        return new PatternStats(cache.size(), topics, lastUpdated,
                auditRepository.countByPattern(GenerationAuditJdbcRepository.ACCEPTED));
    }

    /**
     * Generates {@code samples} questions without recording them and reports how the pattern behaves.
     */
    public PatternHealthReport inspect(String patternId, int samples) {
        if (samples < 1) throw new IllegalArgumentException("samples must be positive: " + samples);
        PatternTemplate pattern = getPattern(patternId).orElseThrow(() -> new PatternNotFoundException(patternId));
        int successes = 0;
        List<String> failures = new ArrayList<>();
        Set<String> texts = new HashSet<>();
        boolean roundTrip = true;
        for (int i = 0; i < samples; i++) {
            try {
                GeneratedQuestion question = generate(pattern, randomSource);
                successes++;
                texts.add(question.questionText());
                roundTrip &= renderer.render(pattern.answerTemplate(), question.variables()).equals(question.finalAnswer());
            } catch (RuntimeException e) {
                failures.add(e.getMessage());
            }
        }
        return new PatternHealthReport(patternId, samples, successes, failures, texts.size(), roundTrip);
    }
}
