package com.cityhunt.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CredentialJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CredentialJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> findPin(String groupId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT pin FROM group_pins WHERE group_id=?",
                (rs, n) -> rs.getString(1),
                groupId);
        return rows.stream().findFirst();
    }

    public void save(String groupId, String pin) {
        jdbcTemplate.update("MERGE INTO group_pins(group_id, pin) KEY(group_id) VALUES (?,?)", groupId, pin);
    }
}
