package com.gt.flashstudy.studySession.model;

import com.gt.flashstudy.model.StudySession;

import java.util.List;

public record CompletionResult(StudySession session,
                               int xpEarned,
                               boolean leveledUp,
                               Integer oldLevel,
                               Integer newLevel,
                               List<String> newAchievements,
                               Integer newStreak,
                               int cardsLearned,
                               int cardsMastered) {

    public static CompletionResult forGuest(StudySession session) {
        return new CompletionResult(session, session.sessionXp(), false, null, null, List.of(), null, 0, 0);
    }
}
