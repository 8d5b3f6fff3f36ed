package com.cityhunt.repository;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class ProgressJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public ProgressJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ProgressRow> find(String groupId) {
        List<ProgressRow> rows = jdbcTemplate.query(
                "SELECT group_id, current_stage, completed_stages, row_version, last_updated FROM group_progress WHERE group_id=?",
                (rs, n) -> new ProgressRow(rs.getString(1), rs.getInt(2), parseStages(rs.getString(3)),
                        rs.getLong(4), Instant.parse(rs.getString(5))),
                groupId);
        return rows.stream().findFirst();
    }

    public boolean insertInitial(ProgressRow row) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO group_progress(group_id, current_stage, completed_stages, row_version, last_updated) VALUES (?,?,?,?,?)",
                    row.groupId(), row.currentStage(), toStagesString(row.completedStages()), row.version(), row.lastUpdated().toString());
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public boolean compareAndSet(ProgressRow next, long expectedVersion) {
        int updated = jdbcTemplate.update(
                "UPDATE group_progress SET current_stage=?, completed_stages=?, row_version=?, last_updated=? WHERE group_id=? AND row_version=?",
                next.currentStage(), toStagesString(next.completedStages()), next.version(), next.lastUpdated().toString(),
                next.groupId(), expectedVersion);
        return updated == 1;
    }

    private String toStagesString(List<Integer> stages) {
        return stages.stream().sorted().map(String::valueOf).collect(Collectors.joining(","));
    }

    private List<Integer> parseStages(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .distinct()
                .sorted()
                .toList();
    }

    public record ProgressRow(String groupId, int currentStage, List<Integer> completedStages, long version, Instant lastUpdated) {}
}
