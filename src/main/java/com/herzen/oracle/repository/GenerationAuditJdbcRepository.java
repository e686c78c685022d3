package com.herzen.oracle.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class GenerationAuditJdbcRepository {
    public static final String ACCEPTED = "ACCEPTED";
    public static final String FAILED = "FAILED";
    private static final int MAX_DETAIL_LENGTH = 1000;

    private final JdbcTemplate jdbcTemplate;

    public GenerationAuditJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void record(AuditRow row) {
        jdbcTemplate.update(
                "INSERT INTO generation_audit(pattern_id, outcome, attempts, question_id, detail, ts) VALUES (?,?,?,?,?,?)",
                row.patternId(), row.outcome(), row.attempts(), row.questionId(), truncate(row.detail()),
                (row.ts() == null ? Instant.now() : row.ts()).toString()
        );
    }

    public List<AuditRow> findByPattern(String patternId) {
        return jdbcTemplate.query(
                "SELECT pattern_id, outcome, attempts, question_id, detail, ts FROM generation_audit WHERE pattern_id = ? ORDER BY id",
                (rs, n) -> new AuditRow(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getString(4), rs.getString(5), Instant.parse(rs.getString(6))),
                patternId
        );
    }

    public Map<String, Long> countByPattern(String outcome) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT pattern_id, COUNT(*) FROM generation_audit WHERE outcome = ? GROUP BY pattern_id ORDER BY pattern_id",
                rs -> {
                    counts.put(rs.getString(1), rs.getLong(2));
                },
                outcome
        );
        return counts;
    }

    private static String truncate(String detail) {
        return detail == null || detail.length() <= MAX_DETAIL_LENGTH ? detail : detail.substring(0, MAX_DETAIL_LENGTH);
    }

    public record AuditRow(String patternId, String outcome, int attempts, String questionId, String detail, Instant ts) {}
}
