package com.cityhunt;

import com.cityhunt.repository.CredentialJdbcRepository;
import com.cityhunt.repository.StageJdbcRepository;
import com.cityhunt.stage.StageIds;
import com.cityhunt.stage.StageModels.MediaItem;
import com.cityhunt.stage.StageModels.MediaKind;
import com.cityhunt.stage.StageModels.StageDefinition;

import java.util.List;

final class HuntFixtures {
    static final int TOTAL_STAGES = 5;
    static final int TERMINAL_STAGE = 5;

    static final List<StageDefinition> STAGES = List.of(
            new StageDefinition(1, "Old Town", "The clock tower", "Find the name painted under the clock.",
                    List.of(new MediaItem(MediaKind.IMAGE, "https://cdn.example.org/clock.jpg", "Clock tower")),
                    "image", "cityhunt", null, "Look up."),
            new StageDefinition(2, "Market", "Stall row", "What is the merchant guarding?",
                    List.of(), null, "treasure,hidden,secret", "stage2", "Think of pirates."),
            new StageDefinition(3, null, "Library", "Read the plaque aloud.",
                    List.of(new MediaItem(MediaKind.VIDEO, "https://cdn.example.org/plaque.mp4", "Plaque walkthrough")),
                    "video", "keyword", "stage3", null),
            new StageDefinition(4, "Harbor", "The pier", "Name the lighthouse.",
                    List.of(), "none", "beacon", "no-such-policy", "Count the lamps."),
            new StageDefinition(TERMINAL_STAGE, "Finish", "You made it", "Meet at the fountain.",
                    List.of(), "none", "", null, null)
    );

    private HuntFixtures() {}

    static void seed(StageJdbcRepository stages, CredentialJdbcRepository credentials) {
        STAGES.forEach(s -> stages.save(StageIds.key(s.stageNumber()), s));
        credentials.save("group1", "1234");
        credentials.save("group2", "0042");
    }
}
