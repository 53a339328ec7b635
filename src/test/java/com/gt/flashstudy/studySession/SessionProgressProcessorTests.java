package com.gt.flashstudy.studySession;

import com.gt.flashstudy.achievement.AchievementEvaluator;
import com.gt.flashstudy.achievement.SessionMetrics;
import com.gt.flashstudy.deck.DeckCardDao;
import com.gt.flashstudy.exception.NotFoundException;
import com.gt.flashstudy.exception.SessionAlreadyCompletedException;
import com.gt.flashstudy.exception.SessionClosedException;
import com.gt.flashstudy.exception.UserAccessException;
import com.gt.flashstudy.exception.ValidationException;
import com.gt.flashstudy.model.AnswerOutcome;
import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.CardStatus;
import com.gt.flashstudy.model.SessionStatus;
import com.gt.flashstudy.model.StudySession;
import com.gt.flashstudy.progression.ActivityDelta;
import com.gt.flashstudy.progression.CompletionDelta;
import com.gt.flashstudy.progression.LevelChange;
import com.gt.flashstudy.progression.ProgressionLedger;
import com.gt.flashstudy.progression.StreakResult;
import com.gt.flashstudy.scheduler.CardProgressDao;
import com.gt.flashstudy.scheduler.SpacedRepetitionScheduler;
import com.gt.flashstudy.studySession.model.AutosaveResult;
import com.gt.flashstudy.studySession.model.CardOutcome;
import com.gt.flashstudy.studySession.model.CompletionResult;
import com.gt.flashstudy.studySession.model.SessionOutcome;
import com.gt.flashstudy.studySession.model.SessionUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.gt.flashstudy.util.TestUtils.*;
import static org.assertj.core.api.Fail.fail;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class SessionProgressProcessorTests {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);
    private static final List<String> CARD_IDS = List.of("c1", "c2", "c3", "c4", "c5", "c6");

    @Mock private StudySessionDao studySessionDao;
    @Mock private DeckCardDao deckCardDao;
    @Mock private CardProgressDao cardProgressDao;
    @Mock private ProgressionLedger progressionLedger;
    @Mock private AchievementEvaluator achievementEvaluator;
    @Mock private PlatformTransactionManager transactionManager;

    private SessionProgressProcessor sessionProgressProcessor;

    @BeforeEach
    public void setup() {
        sessionProgressProcessor = new SessionProgressProcessor(
                studySessionDao,
                deckCardDao,
                cardProgressDao,
                new SpacedRepetitionScheduler(1.3, 21, 6, 4, 2),
                progressionLedger,
                achievementEvaluator,
                new SessionLocator(studySessionDao),
                new TransactionTemplate(transactionManager),
                Clock.fixed(NOW, ZoneOffset.UTC),
                2.5);

        when(progressionLedger.applyActivity(eq(TEST_LEARNER_ID), any(), any()))
                .thenReturn(new LevelChange(1, progression(1, 20, 100, 20)));
        when(progressionLedger.loadProgression(TEST_LEARNER_ID)).thenReturn(progression(1, 20, 100, 20));
        when(progressionLedger.refreshStreak(TEST_LEARNER_ID, TODAY)).thenReturn(new StreakResult(3, 5, null, false));
        when(deckCardDao.loadCards(anyCollection())).thenReturn(standardCards(6));
        when(cardProgressDao.loadCardProgress(eq(TEST_LEARNER_ID), anyCollection())).thenReturn(List.of());
    }

    @Test
    public void testAutosaveCreditsOnlyDifference() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Active, Map.of("c1", AnswerOutcome.Correct), 10, 20));

        AutosaveResult result = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(3, Map.of("c2", AnswerOutcome.Correct, "c3", AnswerOutcome.Incorrect), 1, 25, 50));

        verify(progressionLedger).applyActivity(TEST_LEARNER_ID, TODAY, new ActivityDelta(2, 1, 15, 30));

        ArgumentCaptor<StudySession> sessionCaptor = ArgumentCaptor.forClass(StudySession.class);
        verify(studySessionDao).saveSessionProgress(sessionCaptor.capture());
        StudySession saved = sessionCaptor.getValue();
        assertEquals(3, saved.currentCardIndex());
        assertEquals(3, saved.answers().size());
        assertEquals(25, saved.sessionXp());
        assertEquals(50, saved.durationSeconds());
        assertEquals(NOW, saved.lastActivityAt());

        assertSame(saved, result.session());
        assertEquals(1, result.learner().level());
        assertFalse(result.leveledUp());
        assertTrue(result.newAchievements().isEmpty());
        verify(transactionManager, times(2)).commit(any());
    }

    @Test
    public void testRepeatedAutosaveIsIdempotent() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));
        SessionUpdate update = new SessionUpdate(2, Map.of("c1", AnswerOutcome.Correct, "c2", AnswerOutcome.Correct), 2, 20, 40);

        AutosaveResult first = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID, update);
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(first.session());
        sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID, update);

        verify(progressionLedger).applyActivity(TEST_LEARNER_ID, TODAY, new ActivityDelta(2, 2, 20, 40));
        verify(progressionLedger).applyActivity(TEST_LEARNER_ID, TODAY, new ActivityDelta(0, 0, 0, 0));
    }

    @Test
    public void testLateAutosaveKeepsDurationBaseline() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Active, Map.of(), 0, 90));

        AutosaveResult result = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(null, null, null, null, 60));

        assertEquals(90, result.session().durationSeconds());
        verify(progressionLedger).applyActivity(TEST_LEARNER_ID, TODAY, new ActivityDelta(0, 0, 0, 0));
        verifyNoInteractions(achievementEvaluator);
    }

    @Test
    public void testSkippedCardAnsweredLaterIsCreditedOnce() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));

        AutosaveResult skipped = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, Map.of("c1", AnswerOutcome.Skipped), 0, 0, 10));
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(skipped.session());

        AutosaveResult answered = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, Map.of("c1", AnswerOutcome.Correct), 1, 0, 10));
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(answered.session());

        sessionProgressProcessor.completeSession(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionOutcome(null, 1, 0, 5, 10, List.of(new CardOutcome("c1", true))));

        ArgumentCaptor<ActivityDelta> deltaCaptor = ArgumentCaptor.forClass(ActivityDelta.class);
        verify(progressionLedger, times(2)).applyActivity(eq(TEST_LEARNER_ID), eq(TODAY), deltaCaptor.capture());
        assertEquals(new ActivityDelta(0, 0, 0, 10), deltaCaptor.getAllValues().get(0));
        assertEquals(new ActivityDelta(1, 1, 0, 0), deltaCaptor.getAllValues().get(1));

        ArgumentCaptor<CompletionDelta> completionCaptor = ArgumentCaptor.forClass(CompletionDelta.class);
        verify(progressionLedger).recordCompletion(eq(TEST_LEARNER_ID), eq(TODAY), completionCaptor.capture());
        assertEquals(0, completionCaptor.getValue().answers());
        assertEquals(0, completionCaptor.getValue().correctAnswers());
    }

    @Test
    public void testUnchangedAnswersSkipAchievementCheck() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Active, Map.of("c1", AnswerOutcome.Correct, "c2", AnswerOutcome.Skipped), 10, 20));

        sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(2, Map.of("c1", AnswerOutcome.Correct, "c2", AnswerOutcome.Skipped), 1, 10, 30));

        verify(progressionLedger).applyActivity(TEST_LEARNER_ID, TODAY, new ActivityDelta(0, 0, 0, 10));
        verifyNoInteractions(achievementEvaluator);
        verify(transactionManager).commit(any());
    }

    @Test
    public void testAutosaveSpendsXp() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Active, Map.of(), 50, 30));

        sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID, new SessionUpdate(null, null, null, 20, 30));

        verify(progressionLedger).applyActivity(TEST_LEARNER_ID, TODAY, new ActivityDelta(0, 0, -30, 0));
    }

    @Test
    public void testAutosaveOfAnotherLearnersSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session("learner-2", null, CARD_IDS,
                SessionStatus.Active, Map.of(), 0, 0));

        try {
            sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID, new SessionUpdate(1, null, null, null, 10));
            fail("Expected UserAccessException");
        } catch (UserAccessException ex) {
            // expected
        }

        verify(studySessionDao, never()).saveSessionProgress(any());
        verify(progressionLedger, never()).applyActivity(anyString(), any(), any());
        verify(transactionManager).rollback(any());
    }

    @Test
    public void testAutosaveOfMissingSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(null);

        assertThrows(NotFoundException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, null, null, null, 10)));
    }

    @Test
    public void testAutosaveOfClosedSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Abandoned, Map.of(), 0, 0));

        assertThrows(SessionClosedException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, null, null, null, 10)));

        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Completed, Map.of(), 0, 0));

        assertThrows(SessionClosedException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, null, null, null, 10)));

        verify(studySessionDao, never()).saveSessionProgress(any());
    }

    @Test
    public void testAutosaveRejectsInvalidUpdates() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));

        assertThrows(ValidationException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(null, Map.of("other-card", AnswerOutcome.Correct), null, null, null)));
        assertThrows(ValidationException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(7, null, null, null, null)));
        assertThrows(ValidationException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(null, null, null, -1, null)));
        assertThrows(ValidationException.class, () -> sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID, null));

        verify(studySessionDao, never()).saveSessionProgress(any());
    }

    @Test
    public void testAutosaveReportsNewAchievements() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));
        when(achievementEvaluator.evaluate(eq(TEST_LEARNER_ID), any())).thenReturn(List.of("a3"));
        when(progressionLedger.loadProgression(TEST_LEARNER_ID)).thenReturn(progression(2, 5, 120, 105));

        AutosaveResult result = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, Map.of("c1", AnswerOutcome.Correct), 1, 10, 5));

        assertEquals(List.of("a3"), result.newAchievements());
        assertTrue(result.leveledUp());
        assertEquals(2, result.learner().level());

        ArgumentCaptor<SessionMetrics> metricsCaptor = ArgumentCaptor.forClass(SessionMetrics.class);
        verify(achievementEvaluator).evaluate(eq(TEST_LEARNER_ID), metricsCaptor.capture());
        assertEquals(1, metricsCaptor.getValue().correctCount());
        assertEquals(5, metricsCaptor.getValue().durationSeconds());
        assertEquals(12, metricsCaptor.getValue().completedAtHour());
    }

    @Test
    public void testAutosaveSurvivesAchievementFailure() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));
        when(achievementEvaluator.evaluate(eq(TEST_LEARNER_ID), any())).thenThrow(new IllegalStateException("boom"));

        AutosaveResult result = sessionProgressProcessor.autosave(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionUpdate(1, Map.of("c1", AnswerOutcome.Correct), 1, 10, 5));

        assertTrue(result.newAchievements().isEmpty());
        assertEquals(10, result.session().sessionXp());
        verify(studySessionDao).saveSessionProgress(any());
        verify(transactionManager).commit(any());
        verify(transactionManager).rollback(any());
    }

    @Test
    public void testCompleteFreshSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));

        CompletionResult result = sessionProgressProcessor.completeSession(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionOutcome(null, 6, 0, 0, 120, allCorrect()));

        assertEquals(SessionStatus.Completed, result.session().status());
        assertEquals(100, result.session().score());
        assertEquals(6, result.cardsLearned());
        assertEquals(0, result.cardsMastered());
        assertEquals(3, result.newStreak());
        assertEquals(NOW, result.session().completedAt());

        verify(studySessionDao).saveSessionCompletion(result.session());
        verify(progressionLedger).recordCompletion(TEST_LEARNER_ID, TODAY, new CompletionDelta(6, 6, 6, 0, 120));
        verify(progressionLedger, never()).applyActivity(anyString(), any(), any());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<CardProgress>> progressCaptor = ArgumentCaptor.forClass(List.class);
        verify(cardProgressDao).saveCardProgressBatch(progressCaptor.capture());
        List<CardProgress> savedProgress = progressCaptor.getValue();
        assertEquals(6, savedProgress.size());
        for (CardProgress cardProgress : savedProgress) {
            assertEquals(1, cardProgress.repetitions());
            assertEquals(1, cardProgress.interval());
            assertEquals(CardStatus.Learning, cardProgress.status());
            assertEquals(TODAY.plusDays(1), cardProgress.nextReviewDate());
            assertEquals(1, cardProgress.timesCorrect());
        }
    }

    @Test
    public void testCompleteAfterAutosavesCreditsOnlyRemainder() {
        Map<String, AnswerOutcome> answers = new LinkedHashMap<>();
        for (String cardId : CARD_IDS) {
            answers.put(cardId, AnswerOutcome.Correct);
        }
        StudySession autosaved = session(TEST_LEARNER_ID, null, CARD_IDS, SessionStatus.Active, answers, 60, 110);
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(autosaved);
        when(progressionLedger.loadProgression(TEST_LEARNER_ID)).thenReturn(progression(2, 0, 120, 100));

        CompletionResult result = sessionProgressProcessor.completeSession(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionOutcome(null, 6, 0, 0, 120, allCorrect()));

        verify(progressionLedger).recordCompletion(TEST_LEARNER_ID, TODAY, new CompletionDelta(0, 0, 6, 0, 10));
        verify(progressionLedger, never()).applyActivity(anyString(), any(), any());
        assertEquals(60, result.xpEarned());
        assertTrue(result.leveledUp());
        assertEquals(1, result.oldLevel());
        assertEquals(2, result.newLevel());
        assertEquals(120, result.session().durationSeconds());
    }

    @Test
    public void testCompleteTracksMasteryChanges() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(List.of("c1", "c2")));
        when(deckCardDao.loadCards(anyCollection())).thenReturn(standardCards(2));
        when(cardProgressDao.loadCardProgress(eq(TEST_LEARNER_ID), anyCollection())).thenReturn(List.of(
                new CardProgress(TEST_LEARNER_ID, "c1", CardStatus.Learning, 2.5, 95, 5, TODAY, 5, 5, 0, null),
                new CardProgress(TEST_LEARNER_ID, "c2", CardStatus.Mastered, 2.5, 238, 6, TODAY, 6, 6, 0, null)));

        CompletionResult result = sessionProgressProcessor.completeSession(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionOutcome(null, 1, 1, 0, 30, List.of(new CardOutcome("c1", true), new CardOutcome("c2", false))));

        assertEquals(0, result.cardsLearned());
        assertEquals(1, result.cardsMastered());
        assertEquals(50, result.session().score());
        verify(progressionLedger).recordCompletion(TEST_LEARNER_ID, TODAY, new CompletionDelta(2, 1, 0, 0, 30));
    }

    @Test
    public void testCompleteSkipsDeletedCards() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(List.of("c1", "c2")));
        when(deckCardDao.loadCards(anyCollection())).thenReturn(standardCards(1));

        CompletionResult result = sessionProgressProcessor.completeSession(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionOutcome(100, 2, 0, 0, 30, List.of(new CardOutcome("c1", true), new CardOutcome("c2", true))));

        assertEquals(1, result.cardsLearned());
        verify(cardProgressDao).saveCardProgressBatch(argThat(progress -> progress.size() == 1 && progress.get(0).cardId().equals("c1")));
    }

    @Test
    public void testCompleteRollsBackWhenAchievementsFail() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));
        when(achievementEvaluator.evaluate(eq(TEST_LEARNER_ID), any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID, TEST_SESSION_ID,
                new SessionOutcome(null, 6, 0, 0, 120, allCorrect())));

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    public void testCompleteTwice() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Completed, Map.of(), 0, 0));

        assertThrows(SessionAlreadyCompletedException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID,
                TEST_SESSION_ID, new SessionOutcome(null, 6, 0, 0, 120, allCorrect())));

        verify(studySessionDao, never()).saveSessionCompletion(any());
        verify(progressionLedger, never()).recordCompletion(anyString(), any(), any());
    }

    @Test
    public void testCompleteAbandonedSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session(TEST_LEARNER_ID, null, CARD_IDS,
                SessionStatus.Abandoned, Map.of(), 0, 0));

        assertThrows(SessionClosedException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID,
                TEST_SESSION_ID, new SessionOutcome(null, 6, 0, 0, 120, allCorrect())));
    }

    @Test
    public void testCompleteOtherLearnersSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(session("learner-2", null, CARD_IDS,
                SessionStatus.Active, Map.of(), 0, 0));

        assertThrows(NotFoundException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID,
                TEST_SESSION_ID, new SessionOutcome(null, 6, 0, 0, 120, allCorrect())));
    }

    @Test
    public void testCompleteRejectsInvalidOutcome() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));

        assertThrows(ValidationException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID,
                TEST_SESSION_ID, new SessionOutcome(120, 6, 0, 0, 120, allCorrect())));
        assertThrows(ValidationException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID,
                TEST_SESSION_ID, new SessionOutcome(null, -1, 0, 0, 120, allCorrect())));
        assertThrows(ValidationException.class, () -> sessionProgressProcessor.completeSession(TEST_LEARNER_ID,
                TEST_SESSION_ID, new SessionOutcome(null, 1, 0, 0, 120, List.of(new CardOutcome("other-card", true)))));
    }

    @Test
    public void testGuestAutosaveAndComplete() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(guestSession(CARD_IDS));

        AutosaveResult autosaveResult = sessionProgressProcessor.autosaveGuest(TEST_GUEST_TOKEN, TEST_SESSION_ID,
                new SessionUpdate(1, Map.of("c1", AnswerOutcome.Correct), 1, 10, 15));

        assertNull(autosaveResult.learner());
        assertEquals(10, autosaveResult.session().sessionXp());

        CompletionResult completionResult = sessionProgressProcessor.completeGuestSession(TEST_GUEST_TOKEN.toUpperCase(),
                TEST_SESSION_ID, new SessionOutcome(null, 3, 3, 0, 60, allCorrect()));

        assertEquals(50, completionResult.session().score());
        assertNull(completionResult.oldLevel());
        assertTrue(completionResult.newAchievements().isEmpty());

        verifyNoInteractions(progressionLedger, achievementEvaluator, cardProgressDao);
    }

    @Test
    public void testGuestAutosaveWithWrongToken() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(guestSession(CARD_IDS));

        assertThrows(NotFoundException.class, () -> sessionProgressProcessor.autosaveGuest(
                "9c1d2e3f-4a5b-4c6d-9e7f-8a9b0c1d2e3f", TEST_SESSION_ID, new SessionUpdate(1, null, null, null, 10)));
        assertThrows(ValidationException.class, () -> sessionProgressProcessor.autosaveGuest(
                "not-a-token", TEST_SESSION_ID, new SessionUpdate(1, null, null, null, 10)));

        verify(studySessionDao, never()).saveSessionProgress(any());
    }

    @Test
    public void testGuestCannotUseLearnerSession() {
        when(studySessionDao.loadSessionForUpdate(TEST_SESSION_ID)).thenReturn(learnerSession(CARD_IDS));

        assertThrows(NotFoundException.class, () -> sessionProgressProcessor.completeGuestSession(TEST_GUEST_TOKEN,
                TEST_SESSION_ID, new SessionOutcome(null, 6, 0, 0, 120, allCorrect())));
    }

    private static List<CardOutcome> allCorrect() {
        return CARD_IDS.stream().map(cardId -> new CardOutcome(cardId, true)).toList();
    }
}
