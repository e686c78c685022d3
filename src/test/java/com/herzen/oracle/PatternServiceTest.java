package com.herzen.oracle;

import com.herzen.oracle.pattern.CyclicDependencyException;
import com.herzen.oracle.pattern.PatternModels.*;
import com.herzen.oracle.pattern.TemplateRenderer;
import com.herzen.oracle.repository.GenerationAuditJdbcRepository;
import com.herzen.oracle.repository.GenerationAuditJdbcRepository.AuditRow;
import com.herzen.oracle.sandbox.SeededRandomSource;
import com.herzen.oracle.service.GenerationFailedException;
import com.herzen.oracle.service.InvalidPatternException;
import com.herzen.oracle.service.PatternNotFoundException;
import com.herzen.oracle.service.PatternService;
import com.herzen.oracle.validation.ValidationModels.PatternIssue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PatternServiceTest {
    private static final List<String> FIXTURES = List.of(
            "quadratic_nature_of_roots.json", "quadratic_equal_roots.json", "impossible_rule.json",
            "rectangle_solver.json", "cyclic_variables.json", "broken.json");

    @TempDir
    static Path patternDir;

    @DynamicPropertySource
    static void patternDirectory(DynamicPropertyRegistry registry) throws IOException {
        for (String name : FIXTURES) {
            try (InputStream in = PatternServiceTest.class.getResourceAsStream("/patterns/" + name)) {
                Files.copy(in, patternDir.resolve(name), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        registry.add("oracle.patterns.directory", () -> patternDir.toString());
    }

    @Autowired
    private PatternService patternService;

    @Autowired
    private TemplateRenderer renderer;

    @Autowired
    private GenerationAuditJdbcRepository auditRepository;

    @Test
    void loadsPatternFilesAndSkipsUnreadableOnes() {
        assertTrue(patternService.loadAll() >= 5);
        assertTrue(patternService.getPattern("quadratic_nature_of_roots").isPresent());
        assertTrue(patternService.getPattern("broken").isEmpty());

        PatternTemplate equalRoots = patternService.getPattern("quadratic_equal_roots").orElseThrow();
        assertEquals(new IntSpec(1L, 1L), equalRoots.variables().get("a"));
        assertEquals(List.of(4L), ((ChoiceSpec) equalRoots.variables().get("c")).choices());
        assertEquals(equalRoots.createdAt(), equalRoots.updatedAt());
    }

    @Test
    void classifiesEqualRootsForPerfectSquare() {
        GeneratedQuestion question = patternService.generateQuestion("quadratic_equal_roots");

        assertEquals(0L, question.variables().get("discriminant"));
        assertEquals("equal", question.variables().get("nature"));
        assertEquals("The roots are equal (D = 0)", question.finalAnswer());
        assertEquals("Find the nature of roots of 1x² + 4x + 4 = 0.", question.questionText());
        assertEquals(List.of("D = 4² - 4(1)(4) = 0", "The roots are equal, x = -2.0"), question.solutionSteps());
        assertEquals(1, question.attempts());
        assertTrue(question.questionId().matches("PAT_quadratic_equal_roots_\\d{4}"));
        assertEquals(1, question.socraticHints().size());
    }

    @Test
    void generatedQuestionsSatisfyRulesAndReproduceTheirAnswer() {
        PatternTemplate pattern = patternService.getPattern("quadratic_nature_of_roots").orElseThrow();
        for (int seed = 0; seed < 25; seed++) {
            GeneratedQuestion question = patternService.generateQuestion(pattern.patternId(), new SeededRandomSource(seed));

            long d = (Long) question.variables().get("discriminant");
            long b = (Long) question.variables().get("b");
            long c = (Long) question.variables().get("c");
            assertTrue(d >= 0);
            assertEquals(b * b - 4 * c, d);
            assertEquals(question.finalAnswer(), renderer.render(pattern.answerTemplate(), question.variables()));
            assertFalse(question.questionText().contains("{"));
            question.solutionSteps().forEach(step -> assertFalse(step.contains("{"), step));
        }
    }

    @Test
    void sameSeedReproducesTheQuestion() {
        GeneratedQuestion first = patternService.generateQuestion("quadratic_nature_of_roots", new SeededRandomSource(99));
        GeneratedQuestion second = patternService.generateQuestion("quadratic_nature_of_roots", new SeededRandomSource(99));

        assertEquals(first.questionId(), second.questionId());
        assertEquals(first.questionText(), second.questionText());
        assertEquals(first.variables(), second.variables());
    }

    @Test
    void bindsSolverResultIntoVariables() {
        GeneratedQuestion question = patternService.generateQuestion("rectangle_solver", new SeededRandomSource(5));
        long l = (Long) question.variables().get("l");
        long w = (Long) question.variables().get("w");

        assertEquals(l * w, question.variables().get("solver_result"));
        assertEquals(String.valueOf(l * w), question.finalAnswer());
    }

    @Test
    void givesUpAfterBoundedAttempts() {
        GenerationFailedException ex = assertThrows(GenerationFailedException.class,
                () -> patternService.generateQuestion("impossible_rule"));
        assertEquals(50, ex.attempts());
        assertEquals("impossible_rule", ex.patternId());
        assertTrue(ex.getMessage().contains("{a} > 100"), ex.getMessage());

        AuditRow last = auditRepository.findByPattern("impossible_rule").stream().reduce((a, b) -> b).orElseThrow();
        assertEquals(GenerationAuditJdbcRepository.FAILED, last.outcome());
        assertEquals(50, last.attempts());
        assertNull(last.questionId());
    }

    @Test
    void resolutionFailureIsNotRetried() {
        CyclicDependencyException ex = assertThrows(CyclicDependencyException.class,
                () -> patternService.generateQuestion("cyclic_variables"));
        assertEquals(List.of("x", "y"), ex.unresolved());
    }

    @Test
    void unknownPatternFailsImmediately() {
        assertThrows(PatternNotFoundException.class, () -> patternService.generateQuestion("no_such_pattern"));
        assertTrue(patternService.getPattern("no_such_pattern").isEmpty());
    }

    @Test
    void addsUpdatesAndArchivesPattern() throws IOException {
        PatternTemplate created = patternService.addPattern(linearPattern("linear_temp"));
        assertTrue(Files.exists(patternDir.resolve("linear_temp.json")));
        assertEquals(created, patternService.getPattern("linear_temp").orElseThrow());

        assertTrue(patternService.updatePattern("linear_temp", Map.of("marks", 5, "pattern_id", "hijacked", "topic", "Linear Equations")));
        PatternTemplate updated = patternService.getPattern("linear_temp").orElseThrow();
        assertEquals(5, updated.marks());
        assertEquals("Linear Equations", updated.topic());
        assertEquals("linear_temp", updated.patternId());
        assertEquals(created.createdAt(), updated.createdAt());
        assertFalse(updated.updatedAt().isBefore(created.updatedAt()));
        assertTrue(patternService.getPattern("hijacked").isEmpty());

        patternService.loadAll();
        assertEquals(5, patternService.getPattern("linear_temp").orElseThrow().marks());

        assertTrue(patternService.deletePattern("linear_temp"));
        assertTrue(patternService.getPattern("linear_temp").isEmpty());
        assertFalse(Files.exists(patternDir.resolve("linear_temp.json")));
        String archived = "linear_temp_" + LocalDate.now().format(DateTimeFormatter.ofPattern("yyyyMMdd")) + ".json";
        assertTrue(Files.exists(patternDir.resolve("archive").resolve(archived)));
        assertFalse(patternService.deletePattern("linear_temp"));
    }

    @Test
    void updateOfUnknownPatternReturnsFalse() {
        assertFalse(patternService.updatePattern("missing_pattern", Map.of("marks", 3)));
    }

    @Test
    void rejectsInvalidDefinitions() {
        Map<String, VariableSpec> vars = new LinkedHashMap<>();
        vars.put("x", new CalculatedSpec("{y} + 1"));
        vars.put("y", new CalculatedSpec("{x} + 1"));
        PatternTemplate cyclic = new PatternTemplate("cyclic_new", "Algebra", 1, 0.5, "{x}", vars,
                null, "{x}", null, null, null, null, null);

        InvalidPatternException ex = assertThrows(InvalidPatternException.class, () -> patternService.addPattern(cyclic));
        assertTrue(ex.issues().stream().map(PatternIssue::code).anyMatch("CYCLE_DETECTED"::equals));
        assertFalse(Files.exists(patternDir.resolve("cyclic_new.json")));
        assertTrue(patternService.getPattern("cyclic_new").isEmpty());
    }

    @Test
    void rejectsUpdateThatBreaksThePattern() {
        patternService.addPattern(linearPattern("linear_guarded"));

        assertThrows(InvalidPatternException.class, () -> patternService.updatePattern("linear_guarded", Map.of("marks", 0)));
        assertEquals(2, patternService.getPattern("linear_guarded").orElseThrow().marks());
    }

    @Test
    void findsPatternsByTopicAndMarks() {
        List<PatternTemplate> quadratic = patternService.findPatterns("Quadratic Equations", null);
        assertEquals(List.of("quadratic_equal_roots", "quadratic_nature_of_roots"),
                quadratic.stream().map(PatternTemplate::patternId).toList());

        assertTrue(patternService.findPatterns(null, 1).stream().allMatch(p -> p.marks() == 1));
        assertTrue(patternService.findPatterns("Quadratic Equations", 5).isEmpty());
        assertEquals(patternService.stats().totalPatterns(), patternService.findPatterns(null, null).size());
    }

    @Test
    void reportsStatsWithGenerationCounts() {
        patternService.generateQuestion("quadratic_equal_roots");

        PatternStats stats = patternService.stats();
        assertTrue(stats.topics().get("Quadratic Equations") >= 2);
        assertNotNull(stats.lastUpdated());
        assertTrue(stats.generations().get("quadratic_equal_roots") >= 1);
        assertTrue(auditRepository.findByPattern("quadratic_equal_roots").stream()
                .anyMatch(row -> row.outcome().equals(GenerationAuditJdbcRepository.ACCEPTED)
                        && row.questionId().startsWith("PAT_quadratic_equal_roots_")));
    }

    @Test
    void inspectsPatternHealth() {
        PatternHealthReport healthy = patternService.inspect("quadratic_equal_roots", 5);
        assertEquals(5, healthy.successes());
        assertEquals(1, healthy.distinctQuestions());
        assertTrue(healthy.answersRoundTrip());
        assertTrue(healthy.healthy());

        PatternHealthReport failing = patternService.inspect("impossible_rule", 2);
        assertEquals(0, failing.successes());
        assertEquals(2, failing.failures().size());
        assertFalse(failing.healthy());
    }

    private PatternTemplate linearPattern(String id) {
        Map<String, VariableSpec> vars = new LinkedHashMap<>();
        vars.put("a", new IntSpec(2L, 9L));
        vars.put("x", new IntSpec(1L, 10L));
        vars.put("b", new CalculatedSpec("{a} * {x}"));
        return new PatternTemplate(id, "Algebra", 2, 0.4, "Solve {a}x = {b}", vars,
                List.of("x = {b} / {a} = {b // a}"), "x = {x}",
                List.of(new SocraticHint(1, "Divide both sides", "By {a}")),
                List.of("{b} % {a} == 0"), null, null, null);
    }
}
