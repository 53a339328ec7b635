package com.gt.flashstudy.studySession.model;

import java.util.List;

/**
 * Final figures reported by the client when a session is finished.
 *
 * @param score derived from the correct count and the session size when absent
 */
public record SessionOutcome(Integer score,
                             int correctCount,
                             int incorrectCount,
                             int skippedCount,
                             int durationSeconds,
                             List<CardOutcome> cardProgressUpdates) { }
