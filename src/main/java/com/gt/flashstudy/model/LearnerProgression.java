package com.gt.flashstudy.model;

import java.time.LocalDate;

public record LearnerProgression(String learnerId,
                                 int level,
                                 int currentXp,
                                 int nextLevelXp,
                                 long totalXp,
                                 int currentStreak,
                                 int longestStreak,
                                 boolean streakShieldActive,
                                 LocalDate streakShieldUsedDate,
                                 int totalCardsLearned,
                                 int totalCardsMastered,
                                 int totalDecksCompleted,
                                 long totalTimeSpentSeconds,
                                 int totalAnswers,
                                 int totalCorrectAnswers) {

    public LearnerProgression withLevelState(int level, int currentXp, int nextLevelXp, long totalXp) {
        return new LearnerProgression(learnerId, level, currentXp, nextLevelXp, totalXp, currentStreak, longestStreak,
                streakShieldActive, streakShieldUsedDate, totalCardsLearned, totalCardsMastered, totalDecksCompleted,
                totalTimeSpentSeconds, totalAnswers, totalCorrectAnswers);
    }

    public LearnerProgression withStreak(int currentStreak, int longestStreak, boolean streakShieldActive, LocalDate streakShieldUsedDate) {
        return new LearnerProgression(learnerId, level, currentXp, nextLevelXp, totalXp, currentStreak, longestStreak,
                streakShieldActive, streakShieldUsedDate, totalCardsLearned, totalCardsMastered, totalDecksCompleted,
                totalTimeSpentSeconds, totalAnswers, totalCorrectAnswers);
    }
}
