package com.gt.flashstudy.studySession.model;

import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.StudySession;

import java.util.List;
import java.util.Map;

/**
 * A session with its cards in working set order and the learner's progress on them. The counts are only known right
 * after creation and are {@code null} on a resumed session.
 */
public record SessionView(StudySession session,
                          List<Card> cards,
                          Map<String, CardProgress> cardProgress,
                          Integer availableCount,
                          Integer masteredCount) { }
