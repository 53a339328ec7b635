package com.gt.flashstudy.studySession;

import com.gt.flashstudy.model.AnswerOutcome;
import com.gt.flashstudy.model.StudySession;
import com.gt.flashstudy.progression.ActivityDelta;

import java.util.Map;

/**
 * Computes what a session write adds on top of the session's stored snapshot.
 * <p>
 * Deltas are always taken against the values persisted on the session row, never against a separate counter. A
 * retried or duplicated write that carries the same absolute values therefore produces an empty delta.
 */
public class SessionDeltas {

    // A card counts once, when it first gets a real answer. Skips are not answers, so a skipped card is still
    // unanswered; a changed answer is stored but not credited again.
    public static ActivityDelta between(StudySession stored, StudySession updated) {
        int newAnswers = 0;
        int newCorrectAnswers = 0;
        for (Map.Entry<String, AnswerOutcome> answer : updated.answers().entrySet()) {
            if (answer.getValue() != AnswerOutcome.Skipped && !isAnswered(stored.answers().get(answer.getKey()))) {
                newAnswers++;
                if (answer.getValue() == AnswerOutcome.Correct) {
                    newCorrectAnswers++;
                }
            }
        }

        return new ActivityDelta(
                newAnswers,
                newCorrectAnswers,
                updated.sessionXp() - stored.sessionXp(),
                Math.max(0, updated.durationSeconds() - stored.durationSeconds()));
    }

    private static boolean isAnswered(AnswerOutcome outcome) {
        return outcome != null && outcome != AnswerOutcome.Skipped;
    }

    public static int remainingTime(StudySession stored, int finalDurationSeconds) {
        return Math.max(0, finalDurationSeconds - stored.durationSeconds());
    }

    public static int remainingCorrectAnswers(StudySession stored, int finalCorrectCount) {
        return Math.max(0, finalCorrectCount - stored.countAnswers(AnswerOutcome.Correct));
    }

    // Never less than the remaining correct answers, those are answers too
    public static int remainingAnswers(StudySession stored, int finalCorrectCount, int finalIncorrectCount) {
        int storedAnswers = stored.countAnswers(AnswerOutcome.Correct) + stored.countAnswers(AnswerOutcome.Incorrect);
        int remainingAnswers = Math.max(0, finalCorrectCount + finalIncorrectCount - storedAnswers);
        return Math.max(remainingAnswers, remainingCorrectAnswers(stored, finalCorrectCount));
    }

    public static int scoreOf(int correctCount, int totalCards) {
        if (totalCards <= 0) {
            return 0;
        }
        return (int) Math.round(correctCount * 100.0 / totalCards);
    }
}
