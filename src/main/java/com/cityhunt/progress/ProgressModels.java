package com.cityhunt.progress;

import java.time.Instant;
import java.util.List;

public class ProgressModels {
    public record ProgressRecord(int highestReachedStage, List<Integer> completedStages, Instant lastUpdated) {
        public ProgressRecord {
            completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
        }

        public static ProgressRecord zero() {
            return new ProgressRecord(0, List.of(), null);
        }

        public boolean isCompleted(int stageNumber) {
            return completedStages.contains(stageNumber);
        }
    }
}
