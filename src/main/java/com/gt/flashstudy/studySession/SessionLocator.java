package com.gt.flashstudy.studySession;

import com.gt.flashstudy.exception.NotFoundException;
import com.gt.flashstudy.exception.UserAccessException;
import com.gt.flashstudy.model.StudySession;
import com.gt.flashstudy.util.GuestTokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

// Loads sessions on behalf of a caller, enforcing who may see them
@Component
public class SessionLocator {

    private static final Logger log = LoggerFactory.getLogger(SessionLocator.class);

    private final StudySessionDao studySessionDao;

    @Autowired
    public SessionLocator(StudySessionDao studySessionDao) {
        this.studySessionDao = studySessionDao;
    }

    // Sessions of other learners are reported as missing
    public StudySession findOwnedSession(String learnerId, String sessionId, boolean lockForUpdate) {
        StudySession studySession = load(sessionId, lockForUpdate);

        if (studySession == null || studySession.isGuest() || !studySession.learnerId().equals(learnerId)) {
            throw new NotFoundException("Study session " + sessionId + " not found");
        }
        return studySession;
    }

    // Autosave tells the caller the session is not theirs rather than pretending it does not exist
    public StudySession findSessionForAutosave(String learnerId, String sessionId) {
        StudySession studySession = load(sessionId, true);

        if (studySession == null) {
            throw new NotFoundException("Study session " + sessionId + " not found");
        }
        if (studySession.isGuest() || !studySession.learnerId().equals(learnerId)) {
            log.error("Learner {} attempted to save study session {} owned by someone else", learnerId, sessionId);
            throw new UserAccessException("Learner " + learnerId + " does not have access to study session " + sessionId);
        }
        return studySession;
    }

    public StudySession findGuestSession(String guestToken, String sessionId, boolean lockForUpdate) {
        GuestTokenUtil.requireValidGuestToken(guestToken);
        StudySession studySession = load(sessionId, lockForUpdate);

        if (studySession == null || !studySession.isGuest() || !GuestTokenUtil.tokensMatch(guestToken, studySession.guestToken())) {
            throw new NotFoundException("Guest study session " + sessionId + " not found");
        }
        return studySession;
    }

    private StudySession load(String sessionId, boolean lockForUpdate) {
        return lockForUpdate ? studySessionDao.loadSessionForUpdate(sessionId) : studySessionDao.loadSession(sessionId);
    }
}
