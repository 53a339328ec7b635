package com.gt.flashstudy.model;

import java.time.LocalDate;

// Additive per-day counters; a write adds these values to whatever the day already holds
public record DailyProgress(String learnerId,
                            LocalDate date,
                            int cardsStudied,
                            int cardsLearned,
                            int timeSpentSeconds,
                            int xpEarned,
                            int sessionsCompleted) {

    public boolean isEmpty() {
        return cardsStudied == 0 && cardsLearned == 0 && timeSpentSeconds == 0 && xpEarned == 0 && sessionsCompleted == 0;
    }
}
