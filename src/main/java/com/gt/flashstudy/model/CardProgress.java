package com.gt.flashstudy.model;

import java.time.Instant;
import java.time.LocalDate;

public record CardProgress(String learnerId,
                           String cardId,
                           CardStatus status,
                           double easeFactor,
                           int interval,
                           int repetitions,
                           LocalDate nextReviewDate,
                           int timesSeen,
                           int timesCorrect,
                           int timesIncorrect,
                           Instant lastReviewedAt) {

    public static CardProgress notStarted(String learnerId, String cardId, double initialEaseFactor) {
        return new CardProgress(learnerId, cardId, CardStatus.New, initialEaseFactor, 0, 0, null, 0, 0, 0, null);
    }
}
