package com.cityhunt.progress;

import com.cityhunt.progress.ProgressModels.ProgressRecord;

public final class StageGate {
    private StageGate() {}

    public static boolean isUnlocked(ProgressRecord progress, int requestedStage) {
        if (requestedStage < 1) return false;
        int highest = progress == null ? 0 : progress.highestReachedStage();
        return requestedStage - 1 <= highest;
    }
}
