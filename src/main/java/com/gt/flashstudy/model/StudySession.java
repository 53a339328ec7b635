package com.gt.flashstudy.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StudySession(String id,
                           String learnerId,
                           @JsonIgnore String guestToken,
                           String deckId,
                           String title,
                           SelectionMethod selectionMethod,
                           List<String> selectedCardIds,
                           int totalCards,
                           int currentCardIndex,
                           Map<String, AnswerOutcome> answers,
                           int streak,
                           int sessionXp,
                           SessionStatus status,
                           Instant startedAt,
                           Instant completedAt,
                           Instant lastActivityAt,
                           int durationSeconds,
                           Integer score,
                           Integer correctCount,
                           Integer incorrectCount,
                           Integer skippedCount,
                           Integer startingLevel) {

    public boolean isGuest() {
        return learnerId == null;
    }

    public int countAnswers(AnswerOutcome outcome) {
        int count = 0;
        for (AnswerOutcome answer : answers.values()) {
            if (answer == outcome) {
                count++;
            }
        }
        return count;
    }

    public StudySession withProgress(int currentCardIndex, Map<String, AnswerOutcome> answers, int streak, int sessionXp,
                                     int durationSeconds, Instant lastActivityAt) {
        return new StudySession(id, learnerId, guestToken, deckId, title, selectionMethod, selectedCardIds, totalCards,
                currentCardIndex, answers, streak, sessionXp, status, startedAt, completedAt, lastActivityAt, durationSeconds,
                score, correctCount, incorrectCount, skippedCount, startingLevel);
    }

    public StudySession withCompletion(int durationSeconds, int score, int correctCount, int incorrectCount, int skippedCount,
                                       Instant completedAt) {
        return new StudySession(id, learnerId, guestToken, deckId, title, selectionMethod, selectedCardIds, totalCards,
                currentCardIndex, answers, streak, sessionXp, SessionStatus.Completed, startedAt, completedAt, completedAt,
                durationSeconds, score, correctCount, incorrectCount, skippedCount, startingLevel);
    }

    public StudySession withAbandonment(Instant abandonedAt) {
        return new StudySession(id, learnerId, guestToken, deckId, title, selectionMethod, selectedCardIds, totalCards,
                currentCardIndex, answers, streak, sessionXp, SessionStatus.Abandoned, startedAt, completedAt, abandonedAt,
                durationSeconds, score, correctCount, incorrectCount, skippedCount, startingLevel);
    }
}
