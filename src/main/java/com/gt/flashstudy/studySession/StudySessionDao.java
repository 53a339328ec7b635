package com.gt.flashstudy.studySession;

import com.gt.flashstudy.model.SessionStatus;
import com.gt.flashstudy.model.StudySession;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface StudySessionDao {

    void createSession(StudySession studySession);

    StudySession loadSession(String sessionId);

    // Locks the session row until the surrounding transaction ends
    StudySession loadSessionForUpdate(String sessionId);

    void saveSessionProgress(StudySession studySession);

    void saveSessionCompletion(StudySession studySession);

    void saveSessionAbandonment(StudySession studySession);

    List<StudySession> loadLearnerSessions(String learnerId, SessionStatus status, String deckId, int limit, int offset);

    Set<String> loadActiveSessionCardIds(String learnerId);

    int purgeInactiveGuestSessions(Instant cutoff);
}
