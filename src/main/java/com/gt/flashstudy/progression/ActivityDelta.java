package com.gt.flashstudy.progression;

/**
 * What one autosave adds on top of the previously stored session snapshot.
 *
 * @param xp signed, a negative value is XP spent during the session
 */
public record ActivityDelta(int answers, int correctAnswers, int xp, int timeSpentSeconds) {

    public boolean isEmpty() {
        return answers == 0 && correctAnswers == 0 && xp == 0 && timeSpentSeconds == 0;
    }
}
