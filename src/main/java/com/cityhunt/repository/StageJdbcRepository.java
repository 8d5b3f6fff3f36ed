package com.cityhunt.repository;

import com.cityhunt.stage.StageIds;
import com.cityhunt.stage.StageModels.MediaItem;
import com.cityhunt.stage.StageModels.StageDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class StageJdbcRepository {
    private static final TypeReference<List<MediaItem>> MEDIA_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public StageJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<StageDefinition> findByNumber(int stageNumber) {
        List<StageDefinition> rows = jdbcTemplate.query(
                "SELECT stage_number, stage_name, title, description, media, media_type, answer, validation_function, hint FROM stages WHERE stage_key=?",
                (rs, n) -> new StageDefinition(
                        rs.getInt(1), rs.getString(2), rs.getString(3), rs.getString(4),
                        readMedia(rs.getString(5)), rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9)),
                StageIds.key(stageNumber));
        return rows.stream().findFirst();
    }

    public long count() {
        Long value = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM stages", Long.class);
        return value == null ? 0 : value;
    }

    public void save(String stageKey, StageDefinition s) {
        jdbcTemplate.update(
                "MERGE INTO stages(stage_key, stage_number, stage_name, title, description, media, media_type, answer, validation_function, hint) KEY(stage_key) VALUES (?,?,?,?,?,?,?,?,?,?)",
                stageKey, s.stageNumber(), s.stageName(), s.title(), s.description(),
                writeMedia(s.media()), s.mediaType(), s.answer(), s.validationFunction(), s.hint());
    }

    private List<MediaItem> readMedia(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, MEDIA_LIST);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable media column: " + e.getOriginalMessage(), e);
        }
    }

    private String writeMedia(List<MediaItem> media) {
        try {
            return objectMapper.writeValueAsString(media == null ? List.of() : media);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Media not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
