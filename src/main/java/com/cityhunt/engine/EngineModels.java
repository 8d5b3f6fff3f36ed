package com.cityhunt.engine;

import com.cityhunt.stage.StageModels.MediaItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class EngineModels {
    public record AuthorizeResponse(boolean success, String message, String groupId) {}

    public record StageContentResponse(boolean success,
                                       int stageId,
                                       String stageName,
                                       String title,
                                       String description,
                                       List<MediaItem> media,
                                       String mediaType,
                                       @JsonProperty("isCompleted") boolean isCompleted,
                                       @JsonProperty("isUnlocked") boolean isUnlocked,
                                       boolean hasAnswer) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AnswerResponse(boolean success, boolean correct, String hint, String message) {}

    public record GroupProgressResponse(boolean success,
                                        int currentStage,
                                        List<Integer> completedStages,
                                        long totalStages) {}
}
