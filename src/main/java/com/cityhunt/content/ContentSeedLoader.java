package com.cityhunt.content;

import com.cityhunt.repository.CredentialJdbcRepository;
import com.cityhunt.repository.StageJdbcRepository;
import com.cityhunt.stage.StageIds;
import com.cityhunt.stage.StageModels.MediaItem;
import com.cityhunt.stage.StageModels.StageDefinition;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.OptionalInt;

@Component
public class ContentSeedLoader implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ContentSeedLoader.class);

    private final StageJdbcRepository stages;
    private final CredentialJdbcRepository credentials;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String stagesFile;
    private final String groupsFile;

    public ContentSeedLoader(StageJdbcRepository stages,
                             CredentialJdbcRepository credentials,
                             ObjectMapper objectMapper,
                             ResourceLoader resourceLoader,
                             @Value("${hunt.content.stages-file:}") String stagesFile,
                             @Value("${hunt.content.groups-file:}") String groupsFile) {
        this.stages = stages;
        this.credentials = credentials;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.stagesFile = stagesFile;
        this.groupsFile = groupsFile;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!stagesFile.isBlank()) {
            int imported = importStages(readArray(stagesFile));
            log.info("Imported {} stage document(s) from {}", imported, stagesFile);
        }
        if (!groupsFile.isBlank()) {
            int imported = importGroups(readArray(groupsFile));
            log.info("Imported {} group credential(s) from {}", imported, groupsFile);
        }
    }

    public int importStages(JsonNode array) {
        requireNonEmptyArray(array, "Stages data");
        int imported = 0;
        for (JsonNode node : array) {
            SeedStage seed;
            try {
                seed = objectMapper.convertValue(node, SeedStage.class);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable stage entry {}: {}", node, e.getMessage());
                continue;
            }
            String key = seed.stageId() != null ? StageIds.key(seed.stageId()) : seed.docId();
            if (key == null || key.isBlank()) {
                log.warn("Skipping stage without docId or stageId: {}", node);
                continue;
            }
            OptionalInt number = seed.stageId() != null ? OptionalInt.of(seed.stageId()) : StageIds.tryParse(key);
            if (number.isEmpty() || number.getAsInt() < 1 || !key.equals(StageIds.key(number.getAsInt()))) {
                log.warn("Skipping stage whose key {} does not name a stage number", key);
                continue;
            }
            stages.save(key, new StageDefinition(number.getAsInt(), seed.stageName(), seed.title(), seed.description(),
                    seed.media(), seed.mediaType(), seed.answer(), seed.validationFunction(), seed.hint()));
            imported++;
        }
        return imported;
    }

    public int importGroups(JsonNode array) {
        requireNonEmptyArray(array, "Groups data");
        int imported = 0;
        for (JsonNode node : array) {
            SeedGroup seed;
            try {
                seed = objectMapper.convertValue(node, SeedGroup.class);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable group entry: {}", e.getMessage());
                continue;
            }
            if (seed.groupId() == null || seed.groupId().isBlank() || seed.pin() == null || seed.pin().isBlank()) {
                log.warn("Skipping group entry without groupId or pin");
                continue;
            }
            credentials.save(seed.groupId(), seed.pin());
            imported++;
        }
        return imported;
    }

    private JsonNode readArray(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Seed file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading or parsing " + location, e);
        }
    }

    private static void requireNonEmptyArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new IllegalStateException(what + " must be an array");
        }
        if (node.isEmpty()) {
            throw new IllegalStateException(what + " is empty");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeedStage(Integer stageId,
                            String docId,
                            String stageName,
                            String title,
                            String description,
                            List<MediaItem> media,
                            String mediaType,
                            String answer,
                            String validationFunction,
                            String hint) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeedGroup(String groupId, String pin) {}
}
