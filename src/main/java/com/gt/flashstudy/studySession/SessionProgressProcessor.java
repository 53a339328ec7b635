package com.gt.flashstudy.studySession;

import com.gt.flashstudy.achievement.AchievementEvaluator;
import com.gt.flashstudy.achievement.SessionMetrics;
import com.gt.flashstudy.deck.DeckCardDao;
import com.gt.flashstudy.exception.SessionAlreadyCompletedException;
import com.gt.flashstudy.exception.SessionClosedException;
import com.gt.flashstudy.exception.ValidationException;
import com.gt.flashstudy.model.AnswerOutcome;
import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.CardStatus;
import com.gt.flashstudy.model.LearnerProgression;
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
import com.gt.flashstudy.studySession.model.ProgressionSnapshot;
import com.gt.flashstudy.studySession.model.SessionOutcome;
import com.gt.flashstudy.studySession.model.SessionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies autosaves and completions to study sessions.
 * <p>
 * An autosave stores the client's absolute session state and credits the learner only with the difference to the
 * previously stored state, all in one transaction holding the session row lock. Completion credits whatever the
 * autosaves did not, schedules every answered card and refreshes the streak in a single transaction. XP is credited
 * by autosaves only.
 */
@Component
public class SessionProgressProcessor {

    private static final Logger log = LoggerFactory.getLogger(SessionProgressProcessor.class);

    private final StudySessionDao studySessionDao;
    private final DeckCardDao deckCardDao;
    private final CardProgressDao cardProgressDao;
    private final SpacedRepetitionScheduler spacedRepetitionScheduler;
    private final ProgressionLedger progressionLedger;
    private final AchievementEvaluator achievementEvaluator;
    private final SessionLocator sessionLocator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final double initialEaseFactor;

    @Autowired
    public SessionProgressProcessor(StudySessionDao studySessionDao,
                                    DeckCardDao deckCardDao,
                                    CardProgressDao cardProgressDao,
                                    SpacedRepetitionScheduler spacedRepetitionScheduler,
                                    ProgressionLedger progressionLedger,
                                    AchievementEvaluator achievementEvaluator,
                                    SessionLocator sessionLocator,
                                    TransactionTemplate transactionTemplate,
                                    Clock clock,
                                    @Value("${flashstudy.scheduler.initialEaseFactor:2.5}") double initialEaseFactor) {
        this.studySessionDao = studySessionDao;
        this.deckCardDao = deckCardDao;
        this.cardProgressDao = cardProgressDao;
        this.spacedRepetitionScheduler = spacedRepetitionScheduler;
        this.progressionLedger = progressionLedger;
        this.achievementEvaluator = achievementEvaluator;
        this.sessionLocator = sessionLocator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.initialEaseFactor = initialEaseFactor;
    }

    public AutosaveResult autosave(String learnerId, String sessionId, SessionUpdate update) {
        SavedProgress savedProgress = transactionTemplate.execute(status -> {
            StudySession stored = sessionLocator.findSessionForAutosave(learnerId, sessionId);
            StudySession updated = mergeUpdate(stored, update);

            ActivityDelta delta = SessionDeltas.between(stored, updated);
            LevelChange levelChange = progressionLedger.applyActivity(learnerId, LocalDate.now(clock), delta);
            studySessionDao.saveSessionProgress(updated);

            return new SavedProgress(
                    new AutosaveResult(updated, ProgressionSnapshot.of(levelChange.progression()), levelChange.leveledUp(), List.of()),
                    delta);
        });

        AutosaveResult savedResult = savedProgress.result();
        if (savedProgress.delta().answers() <= 0) {
            return savedResult;
        }

        List<String> newAchievements = evaluateAchievementsBestEffort(learnerId, sessionMetrics(savedResult.session()));
        if (newAchievements.isEmpty()) {
            return savedResult;
        }

        // Achievement rewards may have moved the learner's XP since the autosave committed
        LearnerProgression progression = progressionLedger.loadProgression(learnerId);
        return new AutosaveResult(savedResult.session(), ProgressionSnapshot.of(progression),
                savedResult.leveledUp() || progression.level() > savedResult.learner().level(), newAchievements);
    }

    public AutosaveResult autosaveGuest(String guestToken, String sessionId, SessionUpdate update) {
        return transactionTemplate.execute(status -> {
            StudySession stored = sessionLocator.findGuestSession(guestToken, sessionId, true);
            StudySession updated = mergeUpdate(stored, update);
            studySessionDao.saveSessionProgress(updated);

            return new AutosaveResult(updated, null, false, List.of());
        });
    }

    public CompletionResult completeSession(String learnerId, String sessionId, SessionOutcome outcome) {
        return transactionTemplate.execute(status -> {
            StudySession stored = sessionLocator.findOwnedSession(learnerId, sessionId, true);
            requireCompletable(stored);
            validateOutcome(stored, outcome);

            Instant now = clock.instant();
            LocalDate today = LocalDate.now(clock);

            StudySession completed = finalizeSession(stored, outcome, now);
            studySessionDao.saveSessionCompletion(completed);

            CardProgressTally tally = recordCardProgress(learnerId, stored, outcome.cardProgressUpdates(), today, now);

            progressionLedger.recordCompletion(learnerId, today, new CompletionDelta(
                    SessionDeltas.remainingAnswers(stored, outcome.correctCount(), outcome.incorrectCount()),
                    SessionDeltas.remainingCorrectAnswers(stored, outcome.correctCount()),
                    tally.cardsLearned(),
                    tally.cardsMastered() - tally.cardsLostMastery(),
                    SessionDeltas.remainingTime(stored, outcome.durationSeconds())));

            StreakResult streakResult = progressionLedger.refreshStreak(learnerId, today);
            List<String> newAchievements = achievementEvaluator.evaluate(learnerId, completionMetrics(completed, now));
            LearnerProgression progression = progressionLedger.loadProgression(learnerId);

            int oldLevel = stored.startingLevel() == null ? progression.level() : stored.startingLevel();
            log.info("Completed study session {} for learner {}: score {}, {} cards learned, {} cards mastered", completed.id(),
                    learnerId, completed.score(), tally.cardsLearned(), tally.cardsMastered());

            return new CompletionResult(
                    completed,
                    completed.sessionXp(),
                    progression.level() > oldLevel,
                    oldLevel,
                    progression.level(),
                    newAchievements,
                    streakResult.currentStreak(),
                    tally.cardsLearned(),
                    tally.cardsMastered());
        });
    }

    public CompletionResult completeGuestSession(String guestToken, String sessionId, SessionOutcome outcome) {
        return transactionTemplate.execute(status -> {
            StudySession stored = sessionLocator.findGuestSession(guestToken, sessionId, true);
            requireCompletable(stored);
            validateOutcome(stored, outcome);

            StudySession completed = finalizeSession(stored, outcome, clock.instant());
            studySessionDao.saveSessionCompletion(completed);

            log.info("Completed guest study session {}: score {}", completed.id(), completed.score());
            return CompletionResult.forGuest(completed);
        });
    }

    private StudySession mergeUpdate(StudySession stored, SessionUpdate update) {
        if (stored.status() != SessionStatus.Active) {
            throw new SessionClosedException("Study session " + stored.id() + " is " + stored.status().getCode() + " and can no longer be saved");
        }
        validateUpdate(stored, update);

        Map<String, AnswerOutcome> answers = new LinkedHashMap<>(stored.answers());
        if (update.answers() != null) {
            answers.putAll(update.answers());
        }

        return stored.withProgress(
                update.currentCardIndex() == null ? stored.currentCardIndex() : update.currentCardIndex(),
                answers,
                update.streak() == null ? stored.streak() : update.streak(),
                update.sessionXp() == null ? stored.sessionXp() : update.sessionXp(),
                // a late autosave must not move the duration baseline backwards
                update.durationSeconds() == null ? stored.durationSeconds() : Math.max(stored.durationSeconds(), update.durationSeconds()),
                clock.instant());
    }

    private static void validateUpdate(StudySession stored, SessionUpdate update) {
        if (update == null) {
            throw new ValidationException("An autosave needs a body");
        }
        if (update.currentCardIndex() != null && (update.currentCardIndex() < 0 || update.currentCardIndex() > stored.totalCards())) {
            throw new ValidationException("Card index " + update.currentCardIndex() + " is outside the session");
        }
        if (update.streak() != null && update.streak() < 0) {
            throw new ValidationException("Streak cannot be negative");
        }
        if (update.sessionXp() != null && update.sessionXp() < 0) {
            throw new ValidationException("Session XP cannot be negative");
        }
        if (update.durationSeconds() != null && update.durationSeconds() < 0) {
            throw new ValidationException("Duration cannot be negative");
        }
        if (update.answers() != null) {
            Set<String> sessionCardIds = new HashSet<>(stored.selectedCardIds());
            for (Map.Entry<String, AnswerOutcome> answer : update.answers().entrySet()) {
                if (!sessionCardIds.contains(answer.getKey())) {
                    throw new ValidationException("Card " + answer.getKey() + " is not part of study session " + stored.id());
                }
                if (answer.getValue() == null) {
                    throw new ValidationException("Answer for card " + answer.getKey() + " is missing an outcome");
                }
            }
        }
    }

    private static void requireCompletable(StudySession stored) {
        if (stored.status() == SessionStatus.Completed) {
            throw new SessionAlreadyCompletedException("Study session " + stored.id() + " is already completed");
        }
        if (stored.status() != SessionStatus.Active) {
            throw new SessionClosedException("Study session " + stored.id() + " is " + stored.status().getCode() + " and cannot be completed");
        }
    }

    private static void validateOutcome(StudySession stored, SessionOutcome outcome) {
        if (outcome == null) {
            throw new ValidationException("A completion needs a body");
        }
        if (outcome.correctCount() < 0 || outcome.incorrectCount() < 0 || outcome.skippedCount() < 0 || outcome.durationSeconds() < 0) {
            throw new ValidationException("Completion counts and duration cannot be negative");
        }
        if (outcome.score() != null && (outcome.score() < 0 || outcome.score() > 100)) {
            throw new ValidationException("Score must be between 0 and 100");
        }
        if (outcome.cardProgressUpdates() != null) {
            Set<String> sessionCardIds = new HashSet<>(stored.selectedCardIds());
            for (CardOutcome cardOutcome : outcome.cardProgressUpdates()) {
                if (cardOutcome == null || !sessionCardIds.contains(cardOutcome.cardId())) {
                    throw new ValidationException("Card progress update for a card outside study session " + stored.id());
                }
            }
        }
    }

    private static StudySession finalizeSession(StudySession stored, SessionOutcome outcome, Instant completedAt) {
        int score = outcome.score() == null ? SessionDeltas.scoreOf(outcome.correctCount(), stored.totalCards()) : outcome.score();

        return stored.withCompletion(
                Math.max(stored.durationSeconds(), outcome.durationSeconds()),
                score,
                outcome.correctCount(),
                outcome.incorrectCount(),
                outcome.skippedCount(),
                completedAt);
    }

    private CardProgressTally recordCardProgress(String learnerId, StudySession session, List<CardOutcome> cardOutcomes,
                                                 LocalDate today, Instant answeredAt) {
        if (cardOutcomes == null || cardOutcomes.isEmpty()) {
            return new CardProgressTally(0, 0, 0);
        }

        Set<String> cardIds = cardOutcomes.stream().map(CardOutcome::cardId).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, Card> cardsById = deckCardDao.loadCards(cardIds).stream().collect(Collectors.toMap(Card::id, Function.identity()));
        Map<String, CardProgress> progressByCardId = cardProgressDao.loadCardProgress(learnerId, cardIds).stream()
                .collect(Collectors.toMap(CardProgress::cardId, Function.identity()));

        int cardsLearned = 0;
        int cardsMastered = 0;
        int cardsLostMastery = 0;
        for (CardOutcome cardOutcome : cardOutcomes) {
            Card card = cardsById.get(cardOutcome.cardId());
            if (card == null) {
                log.warn("Skipping progress for card {} of study session {}, the card no longer exists", cardOutcome.cardId(), session.id());
                continue;
            }

            CardProgress prior = progressByCardId.get(card.id());
            if (cardOutcome.wasCorrect() && (prior == null || prior.timesCorrect() == 0)) {
                cardsLearned++;
            }
            if (prior == null) {
                prior = CardProgress.notStarted(learnerId, card.id(), initialEaseFactor);
            }

            CardProgress updated = spacedRepetitionScheduler.applyAnswer(prior, card.type(), cardOutcome.wasCorrect(), today, answeredAt);
            if (prior.status() != CardStatus.Mastered && updated.status() == CardStatus.Mastered) {
                cardsMastered++;
            } else if (prior.status() == CardStatus.Mastered && updated.status() != CardStatus.Mastered) {
                cardsLostMastery++;
            }

            // a card answered twice in one session builds on its first update
            progressByCardId.put(card.id(), updated);
        }

        List<CardProgress> changedProgress = new ArrayList<>();
        for (String cardId : cardIds) {
            if (cardsById.containsKey(cardId)) {
                changedProgress.add(progressByCardId.get(cardId));
            }
        }
        cardProgressDao.saveCardProgressBatch(changedProgress);

        return new CardProgressTally(cardsLearned, cardsMastered, cardsLostMastery);
    }

    private List<String> evaluateAchievementsBestEffort(String learnerId, SessionMetrics sessionMetrics) {
        try {
            List<String> newAchievements = transactionTemplate.execute(status -> achievementEvaluator.evaluate(learnerId, sessionMetrics));
            return newAchievements == null ? List.of() : newAchievements;
        } catch (RuntimeException ex) {
            log.warn("Achievement check after autosave failed for learner {}", learnerId, ex);
            return List.of();
        }
    }

    private SessionMetrics sessionMetrics(StudySession session) {
        int correctCount = session.countAnswers(AnswerOutcome.Correct);

        return new SessionMetrics(
                correctCount,
                session.durationSeconds(),
                session.totalCards(),
                ZonedDateTime.now(clock).getHour(),
                SessionDeltas.scoreOf(correctCount, session.totalCards()),
                session.sessionXp());
    }

    private SessionMetrics completionMetrics(StudySession completed, Instant completedAt) {
        return new SessionMetrics(
                completed.correctCount(),
                completed.durationSeconds(),
                completed.totalCards(),
                completedAt.atZone(clock.getZone()).getHour(),
                completed.score(),
                completed.sessionXp());
    }

    private record CardProgressTally(int cardsLearned, int cardsMastered, int cardsLostMastery) { }

    private record SavedProgress(AutosaveResult result, ActivityDelta delta) { }
}
