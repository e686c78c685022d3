package com.herzen.oracle.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.herzen.oracle.config.OracleProperties;
import com.herzen.oracle.pattern.PatternModels.PatternTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.*;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

@Repository
public class FilePatternRepository implements PatternRepository {
    private static final Logger log = LoggerFactory.getLogger(FilePatternRepository.class);
    private static final DateTimeFormatter ARCHIVE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final ReentrantLock writeLock = new ReentrantLock();
    // pattern_id -> file it was read from, which need not be <pattern_id>.json
    private final Map<String, Path> files = new ConcurrentHashMap<>();

    @Autowired
    public FilePatternRepository(OracleProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.patterns().directory()), objectMapper);
    }

    public FilePatternRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public List<PatternTemplate> loadAll() {
        ensureDirectory(directory);
        List<Path> listed;
        try (Stream<Path> listing = Files.list(directory)) {
            listed = listing.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PatternStorageException("Cannot list pattern directory " + directory, e);
        }

        List<PatternTemplate> patterns = new ArrayList<>();
        files.clear();
        for (Path file : listed) {
            try {
                PatternTemplate pattern = mapper.readValue(file.toFile(), PatternTemplate.class);
                if (pattern.patternId() != null) files.put(pattern.patternId(), file);
                patterns.add(pattern);
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable pattern file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return patterns;
    }

    @Override
    public void save(PatternTemplate pattern) {
        writeLock.lock();
        try {
            ensureDirectory(directory);
            Path target = fileOf(pattern.patternId());
            Path temp = Files.createTempFile(directory, pattern.patternId() + "-", ".tmp");
            try {
                mapper.writeValue(temp.toFile(), pattern);
                move(temp, target);
                files.put(pattern.patternId(), target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new PatternStorageException("Cannot write pattern " + pattern.patternId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean archive(String patternId) {
        writeLock.lock();
        try {
            Path source = fileOf(patternId);
            if (!Files.exists(source)) return false;
            Path archiveDir = directory.resolve("archive");
            ensureDirectory(archiveDir);
            Path target = archiveDir.resolve(patternId + "_" + LocalDate.now().format(ARCHIVE_DATE) + EXTENSION);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            files.remove(patternId);
            return true;
        } catch (IOException e) {
            throw new PatternStorageException("Cannot archive pattern " + patternId, e);
        } finally {
            writeLock.unlock();
        }
    }

    private Path fileOf(String patternId) {
        return files.getOrDefault(patternId, directory.resolve(patternId + EXTENSION));
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PatternStorageException("Cannot create directory " + dir, e);
        }
    }
}
