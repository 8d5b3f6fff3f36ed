package com.cityhunt.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class AuthorizationJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AuthorizationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void grant(String groupId, String sessionId, Instant ts) {
        jdbcTemplate.update(
                "MERGE INTO authorizations(group_id, session_id, ts) KEY(group_id, session_id) VALUES (?,?,?)",
                groupId, sessionId, ts.toString());
    }

    public List<AuthorizationRow> loadGrants(String groupId) {
        return jdbcTemplate.query(
                "SELECT group_id, session_id, ts FROM authorizations WHERE group_id=? ORDER BY ts",
                (rs, n) -> new AuthorizationRow(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3))),
                groupId);
    }

    public record AuthorizationRow(String groupId, String sessionId, Instant ts) {}
}
