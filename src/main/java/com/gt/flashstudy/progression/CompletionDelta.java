package com.gt.flashstudy.progression;

/**
 * The part of a finished session not yet credited by its autosaves.
 *
 * @param masteredChange cards that became mastered minus cards that lost mastery
 */
public record CompletionDelta(int answers, int correctAnswers, int cardsLearned, int masteredChange, int timeSpentSeconds) { }
