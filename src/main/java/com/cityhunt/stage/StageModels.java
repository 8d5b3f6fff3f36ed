package com.cityhunt.stage;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class StageModels {
    public enum MediaKind {
        @JsonProperty("image") IMAGE,
        @JsonProperty("video") VIDEO
    }

    public record MediaItem(@JsonAlias("type") MediaKind kind, String url, @JsonAlias("alt") String altText) {}

    public record StageDefinition(int stageNumber,
                                  String stageName,
                                  String title,
                                  String description,
                                  List<MediaItem> media,
                                  String mediaType,
                                  String answer,
                                  String validationFunction,
                                  String hint) {
        public StageDefinition {
            media = media == null ? List.of() : List.copyOf(media);
        }

        public boolean terminal() {
            return answer == null || answer.isEmpty();
        }
    }
}
