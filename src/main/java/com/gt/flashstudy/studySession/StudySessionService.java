package com.gt.flashstudy.studySession;

import com.gt.flashstudy.deck.DeckCardDao;
import com.gt.flashstudy.exception.NotFoundException;
import com.gt.flashstudy.exception.SessionAlreadyCompletedException;
import com.gt.flashstudy.exception.ValidationException;
import com.gt.flashstudy.model.Card;
import com.gt.flashstudy.model.CardProgress;
import com.gt.flashstudy.model.SelectionMethod;
import com.gt.flashstudy.model.SessionStatus;
import com.gt.flashstudy.model.StudySession;
import com.gt.flashstudy.progression.ProgressionLedger;
import com.gt.flashstudy.scheduler.CardProgressDao;
import com.gt.flashstudy.selection.AvailableCardCount;
import com.gt.flashstudy.selection.CardInterleaver;
import com.gt.flashstudy.selection.CardSelectionPolicy;
import com.gt.flashstudy.selection.SelectionOptions;
import com.gt.flashstudy.selection.SelectionResult;
import com.gt.flashstudy.studySession.model.NewSessionRequest;
import com.gt.flashstudy.studySession.model.SessionView;
import com.gt.flashstudy.util.GuestTokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Creates, resumes, lists and abandons study sessions. Autosave and completion live in {@link SessionProgressProcessor}.
 */
@Component
public class StudySessionService {

    private static final Logger log = LoggerFactory.getLogger(StudySessionService.class);

    private final StudySessionDao studySessionDao;
    private final DeckCardDao deckCardDao;
    private final CardProgressDao cardProgressDao;
    private final CardSelectionPolicy cardSelectionPolicy;
    private final CardInterleaver cardInterleaver;
    private final ProgressionLedger progressionLedger;
    private final SessionLocator sessionLocator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int defaultListLimit;
    private final int maxListLimit;

    @Autowired
    public StudySessionService(StudySessionDao studySessionDao,
                               DeckCardDao deckCardDao,
                               CardProgressDao cardProgressDao,
                               CardSelectionPolicy cardSelectionPolicy,
                               CardInterleaver cardInterleaver,
                               ProgressionLedger progressionLedger,
                               SessionLocator sessionLocator,
                               TransactionTemplate transactionTemplate,
                               Clock clock,
                               @Value("${flashstudy.session.defaultListLimit:20}") int defaultListLimit,
                               @Value("${flashstudy.session.maxListLimit:100}") int maxListLimit) {
        this.studySessionDao = studySessionDao;
        this.deckCardDao = deckCardDao;
        this.cardProgressDao = cardProgressDao;
        this.cardSelectionPolicy = cardSelectionPolicy;
        this.cardInterleaver = cardInterleaver;
        this.progressionLedger = progressionLedger;
        this.sessionLocator = sessionLocator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.defaultListLimit = defaultListLimit;
        this.maxListLimit = maxListLimit;
    }

    public SessionView createSession(String learnerId, NewSessionRequest request) {
        validateNewSessionRequest(request);
        List<Card> deckCards = loadDeckCards(request.deckId());

        Map<String, CardProgress> cardProgress = loadCardProgress(learnerId, deckCards);
        Set<String> activeSessionCardIds = request.shouldExcludeActiveSessionCards()
                ? studySessionDao.loadActiveSessionCardIds(learnerId)
                : Set.of();

        SelectionResult selectionResult = cardSelectionPolicy.select(
                request.deckId(),
                deckCards,
                cardProgress,
                request.selectionMethod(),
                new SelectionOptions(request.cardCount(), request.selectedCardIds(), request.shouldExcludeMastered(), activeSessionCardIds),
                LocalDate.now(clock));

        int startingLevel = progressionLedger.loadProgression(learnerId).level();
        return saveNewSession(learnerId, null, request, selectionResult, cardProgress, startingLevel);
    }

    public SessionView createGuestSession(String guestToken, NewSessionRequest request) {
        GuestTokenUtil.requireValidGuestToken(guestToken);
        validateNewSessionRequest(request);
        List<Card> deckCards = loadDeckCards(request.deckId());

        SelectionResult selectionResult = cardSelectionPolicy.select(
                request.deckId(),
                deckCards,
                Map.of(),
                request.selectionMethod(),
                SelectionOptions.forGuest(request.cardCount(), request.selectedCardIds()),
                LocalDate.now(clock));

        return saveNewSession(null, guestToken, request, selectionResult, Map.of(), null);
    }

    public SessionView getSession(String learnerId, String sessionId) {
        StudySession studySession = sessionLocator.findOwnedSession(learnerId, sessionId, false);
        List<Card> cards = loadSessionCards(studySession);

        return new SessionView(studySession, cards, loadCardProgress(learnerId, cards), null, null);
    }

    public SessionView getGuestSession(String guestToken, String sessionId) {
        StudySession studySession = sessionLocator.findGuestSession(guestToken, sessionId, false);

        return new SessionView(studySession, loadSessionCards(studySession), Map.of(), null, null);
    }

    public List<StudySession> listSessions(String learnerId, String statusCode, String deckId, Integer limit, Integer offset) {
        SessionStatus status = null;
        if (statusCode != null && !statusCode.isBlank()) {
            try {
                status = SessionStatus.fromCode(statusCode);
            } catch (IllegalArgumentException ex) {
                throw new ValidationException(ex.getMessage());
            }
        }
        if (offset != null && offset < 0) {
            throw new ValidationException("Offset cannot be negative");
        }

        int pageSize = limit == null || limit <= 0 ? defaultListLimit : Math.min(limit, maxListLimit);
        return studySessionDao.loadLearnerSessions(learnerId, status, deckId == null || deckId.isBlank() ? null : deckId,
                pageSize, offset == null ? 0 : offset);
    }

    public AvailableCardCount getAvailableCardCount(String learnerId, String deckId, boolean excludeMastered, boolean excludeActiveSessionCards) {
        if (deckId == null || deckId.isBlank()) {
            throw new ValidationException("A deck id is required");
        }
        if (!deckCardDao.deckExists(deckId)) {
            throw new NotFoundException("Deck " + deckId + " not found");
        }

        List<Card> deckCards = deckCardDao.loadActiveDeckCards(deckId);
        Set<String> activeSessionCardIds = excludeActiveSessionCards ? studySessionDao.loadActiveSessionCardIds(learnerId) : Set.of();

        return cardSelectionPolicy.countAvailable(deckCards, loadCardProgress(learnerId, deckCards), excludeMastered, activeSessionCardIds);
    }

    public StudySession abandonSession(String learnerId, String sessionId) {
        return transactionTemplate.execute(status ->
                abandon(sessionLocator.findOwnedSession(learnerId, sessionId, true)));
    }

    public StudySession abandonGuestSession(String guestToken, String sessionId) {
        return transactionTemplate.execute(status ->
                abandon(sessionLocator.findGuestSession(guestToken, sessionId, true)));
    }

    private StudySession abandon(StudySession studySession) {
        if (studySession.status() == SessionStatus.Abandoned) {
            return studySession;
        }
        if (studySession.status() == SessionStatus.Completed) {
            throw new SessionAlreadyCompletedException("Study session " + studySession.id() + " is already completed");
        }

        StudySession abandoned = studySession.withAbandonment(clock.instant());
        studySessionDao.saveSessionAbandonment(abandoned);

        log.info("Abandoned study session {} at card {} of {}", abandoned.id(), abandoned.currentCardIndex(), abandoned.totalCards());
        return abandoned;
    }

    private SessionView saveNewSession(String learnerId,
                                       String guestToken,
                                       NewSessionRequest request,
                                       SelectionResult selectionResult,
                                       Map<String, CardProgress> cardProgress,
                                       Integer startingLevel) {
        List<Card> orderedCards = cardInterleaver.interleave(selectionResult.selectedCards());
        List<String> selectedCardIds = orderedCards.stream().map(Card::id).toList();
        Instant now = clock.instant();

        StudySession studySession = new StudySession(
                UUID.randomUUID().toString(),
                learnerId,
                guestToken,
                request.deckId(),
                sessionTitle(request.title(), request.selectionMethod(), selectedCardIds.size()),
                request.selectionMethod(),
                selectedCardIds,
                selectedCardIds.size(),
                0,
                new LinkedHashMap<>(),
                0,
                0,
                SessionStatus.Active,
                now,
                null,
                now,
                0,
                null,
                null,
                null,
                null,
                startingLevel);

        studySessionDao.createSession(studySession);
        log.info("Created {} {} study session {} with {} cards from deck {}", studySession.isGuest() ? "guest" : "learner",
                request.selectionMethod().getCode(), studySession.id(), selectedCardIds.size(), request.deckId());

        Map<String, CardProgress> selectedCardProgress = new LinkedHashMap<>();
        for (String cardId : selectedCardIds) {
            if (cardProgress.containsKey(cardId)) {
                selectedCardProgress.put(cardId, cardProgress.get(cardId));
            }
        }

        return new SessionView(studySession, orderedCards, selectedCardProgress, selectionResult.availableCount(), selectionResult.masteredCount());
    }

    private static String sessionTitle(String requestedTitle, SelectionMethod selectionMethod, int cardCount) {
        if (requestedTitle != null && !requestedTitle.isBlank()) {
            return requestedTitle.trim();
        }

        String methodCode = selectionMethod.getCode();
        return Character.toUpperCase(methodCode.charAt(0)) + methodCode.substring(1) + " - " + cardCount + " cards";
    }

    private void validateNewSessionRequest(NewSessionRequest request) {
        if (request == null || request.deckId() == null || request.deckId().isBlank()) {
            throw new ValidationException("A deck id is required");
        }
        if (request.selectionMethod() == null) {
            throw new ValidationException("A selection method is required");
        }
    }

    private List<Card> loadDeckCards(String deckId) {
        if (!deckCardDao.deckExists(deckId)) {
            throw new NotFoundException("Deck " + deckId + " not found");
        }
        return deckCardDao.loadActiveDeckCards(deckId);
    }

    // Working set order is the stored order, whatever order the store returns the cards in
    private List<Card> loadSessionCards(StudySession studySession) {
        Map<String, Card> cardsById = deckCardDao.loadCards(studySession.selectedCardIds()).stream()
                .collect(Collectors.toMap(Card::id, Function.identity()));

        List<Card> cards = new ArrayList<>(studySession.selectedCardIds().size());
        for (String cardId : studySession.selectedCardIds()) {
            Card card = cardsById.get(cardId);
            if (card == null) {
                log.warn("Card {} of study session {} no longer exists", cardId, studySession.id());
            } else {
                cards.add(card);
            }
        }
        return cards;
    }

    private Map<String, CardProgress> loadCardProgress(String learnerId, List<Card> cards) {
        List<String> cardIds = cards.stream().map(Card::id).toList();
        return cardProgressDao.loadCardProgress(learnerId, cardIds).stream()
                .collect(Collectors.toMap(CardProgress::cardId, Function.identity()));
    }
}
