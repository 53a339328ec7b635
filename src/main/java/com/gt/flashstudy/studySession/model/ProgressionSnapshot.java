package com.gt.flashstudy.studySession.model;

import com.gt.flashstudy.model.LearnerProgression;

public record ProgressionSnapshot(int level, int currentXp, int nextLevelXp, long totalXp, int currentStreak) {

    public static ProgressionSnapshot of(LearnerProgression progression) {
        return new ProgressionSnapshot(progression.level(), progression.currentXp(), progression.nextLevelXp(),
                progression.totalXp(), progression.currentStreak());
    }
}
