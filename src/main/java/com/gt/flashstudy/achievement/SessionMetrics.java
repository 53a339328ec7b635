package com.gt.flashstudy.achievement;

// Figures of a single session that session-scoped achievements are checked against
public record SessionMetrics(int correctCount,
                             int durationSeconds,
                             int totalCards,
                             int completedAtHour,
                             int score,
                             int sessionXp) { }
