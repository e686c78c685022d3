package com.herzen.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.oracle.pattern.PatternModels.*;
import com.herzen.oracle.repository.FilePatternRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FilePatternRepositoryTest {
    @TempDir
    Path dir;

    private FilePatternRepository repository() {
        return new FilePatternRepository(dir, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void savedPatternLoadsBackUnchanged() throws IOException {
        Map<String, VariableSpec> vars = new LinkedHashMap<>();
        vars.put("n", new IntSpec(2L, 12L));
        vars.put("r", new FloatSpec(0.5, 4.5, 1));
        vars.put("unit", new ChoiceSpec(List.of("cm", "m")));
        vars.put("area", new CalculatedSpec("round(3.14 * {r} ** 2, 2)"));
        PatternTemplate pattern = new PatternTemplate("circle_area", "Mensuration", 3, 0.6,
                "Find the area of a circle of radius {r} {unit}.", vars,
                List.of("A = 3.14 × {r}² = {area}"), "{area} {unit}²",
                List.of(new SocraticHint(1, "Recall the formula", "A = πr²")),
                List.of("{area} > 0"), null,
                LocalDateTime.of(2025, 3, 1, 10, 15), LocalDateTime.of(2025, 3, 2, 8, 0));

        FilePatternRepository repository = repository();
        repository.save(pattern);

        assertEquals(List.of(pattern), repository.loadAll());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of("circle_area.json"), files.map(p -> p.getFileName().toString()).toList());
        }
        String json = Files.readString(dir.resolve("circle_area.json"));
        assertTrue(json.contains("\"type\" : \"calculated\""), json);
        assertTrue(json.contains("\"created_at\" : \"2025-03-01T10:15"), json);
    }

    @Test
    void saveReplacesExistingFile() {
        FilePatternRepository repository = repository();
        repository.save(simple("replace_me", 1));
        repository.save(simple("replace_me", 4));

        List<PatternTemplate> loaded = repository.loadAll();
        assertEquals(1, loaded.size());
        assertEquals(4, loaded.get(0).marks());
    }

    @Test
    void readsHandWrittenFilesLeniently() throws IOException {
        Files.writeString(dir.resolve("lenient.json"), """
                {
                  "pattern_id": "lenient",
                  "topic": "Arithmetic",
                  "marks": 1,
                  "difficulty": 0.2,
                  "author": "someone",
                  "template_text": "{a} + {b}",
                  "variables": {"a": {"min": 3, "max": 7}, "b": {"type": "int"}}
                }
                """);

        PatternTemplate pattern = repository().loadAll().get(0);
        assertEquals(new IntSpec(3L, 7L), pattern.variables().get("a"));
        assertEquals(new IntSpec(1L, 100L), pattern.variables().get("b"));
        assertEquals("", pattern.answerTemplate());
        assertTrue(pattern.validationRules().isEmpty());
        assertEquals(pattern.createdAt(), pattern.updatedAt());
    }

    @Test
    void skipsUnreadableFilesAndIgnoresOtherEntries() throws IOException {
        FilePatternRepository repository = repository();
        repository.save(simple("good", 2));
        Files.writeString(dir.resolve("bad.json"), "{ \"pattern_id\": ");
        Files.writeString(dir.resolve("notes.txt"), "not a pattern");
        Files.createDirectories(dir.resolve("archive"));
        Files.writeString(dir.resolve("archive").resolve("old_20240101.json"), "{}");

        assertEquals(List.of("good"), repository.loadAll().stream().map(PatternTemplate::patternId).toList());
    }

    @Test
    void archivesIntoDatedFile() {
        FilePatternRepository repository = repository();
        repository.save(simple("retired", 1));

        assertTrue(repository.archive("retired"));
        assertFalse(Files.exists(dir.resolve("retired.json")));
        String name = "retired_" + LocalDate.now().format(DateTimeFormatter.ofPattern("yyyyMMdd")) + ".json";
        assertTrue(Files.exists(dir.resolve("archive").resolve(name)));
        assertTrue(repository.loadAll().isEmpty());
        assertFalse(repository.archive("retired"));
    }

    @Test
    void keepsWritingAndArchivesTheFileAPatternWasReadFrom() throws IOException {
        Files.writeString(dir.resolve("renamed.json"), """
                {"pattern_id": "actual_id", "topic": "Arithmetic", "marks": 1, "difficulty": 0.2,
                 "template_text": "{a}", "variables": {"a": {"min": 1, "max": 2}}}
                """);
        FilePatternRepository repository = repository();
        PatternTemplate loaded = repository.loadAll().get(0);

        repository.save(simple("actual_id", 3));
        assertFalse(Files.exists(dir.resolve("actual_id.json")));
        assertEquals(3, repository.loadAll().get(0).marks());
        assertEquals("actual_id", loaded.patternId());

        assertTrue(repository.archive("actual_id"));
        assertFalse(Files.exists(dir.resolve("renamed.json")));
        assertTrue(repository.loadAll().isEmpty());
    }

    @Test
    void createsMissingDirectory() {
        FilePatternRepository repository = new FilePatternRepository(dir.resolve("nested/patterns"),
                new ObjectMapper().findAndRegisterModules());
        assertTrue(repository.loadAll().isEmpty());
        assertTrue(Files.isDirectory(repository.directory()));
    }

    private PatternTemplate simple(String id, int marks) {
        return new PatternTemplate(id, "Arithmetic", marks, 0.1, "What is {a} + 1?",
                Map.of("a", new IntSpec(1L, 9L)), null, "{a + 1}", null, null, null, null, null);
    }
}
