package com.gt.flashstudy.studySession;

import com.gt.flashstudy.model.AnswerOutcome;
import com.gt.flashstudy.model.Learner;
import com.gt.flashstudy.model.SelectionMethod;
import com.gt.flashstudy.model.StudySession;
import com.gt.flashstudy.selection.AvailableCardCount;
import com.gt.flashstudy.studySession.model.AutosaveResult;
import com.gt.flashstudy.studySession.model.CompletionResult;
import com.gt.flashstudy.studySession.model.NewSessionRequest;
import com.gt.flashstudy.studySession.model.SessionOutcome;
import com.gt.flashstudy.studySession.model.SessionUpdate;
import com.gt.flashstudy.studySession.model.SessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/rest/studySessions")
public class StudySessionController {

    private static final Logger log = LoggerFactory.getLogger(StudySessionController.class);

    private final StudySessionService studySessionService;
    private final SessionProgressProcessor sessionProgressProcessor;

    public StudySessionController(StudySessionService studySessionService,
                                  SessionProgressProcessor sessionProgressProcessor) {
        this.studySessionService = studySessionService;
        this.sessionProgressProcessor = sessionProgressProcessor;
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView createSession(@RequestBody NewSessionRequest request,
                                     @AuthenticationPrincipal Learner learner) {
        return studySessionService.createSession(learner.getLearnerId(), request);
    }

    @GetMapping(produces = "application/json")
    public List<StudySession> listSessions(@RequestParam(value = "status", required = false) String status,
                                           @RequestParam(value = "deckId", required = false) String deckId,
                                           @RequestParam(value = "limit", required = false) Integer limit,
                                           @RequestParam(value = "offset", required = false) Integer offset,
                                           @AuthenticationPrincipal Learner learner) {
        return studySessionService.listSessions(learner.getLearnerId(), status, deckId, limit, offset);
    }

    @GetMapping(value = "/availableCount", produces = "application/json")
    public AvailableCardCount getAvailableCardCount(@RequestParam(value = "deckId") String deckId,
                                                    @RequestParam(value = "excludeMastered", defaultValue = "true") boolean excludeMastered,
                                                    @RequestParam(value = "excludeActiveSessionCards", defaultValue = "false") boolean excludeActiveSessionCards,
                                                    @AuthenticationPrincipal Learner learner) {
        return studySessionService.getAvailableCardCount(learner.getLearnerId(), deckId, excludeMastered, excludeActiveSessionCards);
    }

    @GetMapping(value = "/{sessionId}", produces = "application/json")
    public SessionView getSession(@PathVariable("sessionId") String sessionId,
                                  @AuthenticationPrincipal Learner learner) {
        return studySessionService.getSession(learner.getLearnerId(), sessionId);
    }

    @PutMapping(value = "/{sessionId}", consumes = "application/json", produces = "application/json")
    public AutosaveResult autosaveSession(@PathVariable("sessionId") String sessionId,
                                          @RequestBody SessionUpdate update,
                                          @AuthenticationPrincipal Learner learner) {
        return sessionProgressProcessor.autosave(learner.getLearnerId(), sessionId, update);
    }

    @PostMapping(value = "/{sessionId}/complete", consumes = "application/json", produces = "application/json")
    public CompletionResult completeSession(@PathVariable("sessionId") String sessionId,
                                            @RequestBody SessionOutcome outcome,
                                            @AuthenticationPrincipal Learner learner) {
        return sessionProgressProcessor.completeSession(learner.getLearnerId(), sessionId, outcome);
    }

    @DeleteMapping(value = "/{sessionId}", produces = "application/json")
    public StudySession abandonSession(@PathVariable("sessionId") String sessionId,
                                       @AuthenticationPrincipal Learner learner) {
        return studySessionService.abandonSession(learner.getLearnerId(), sessionId);
    }

    @PostMapping(value = "/guest", consumes = "application/json", produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView createGuestSession(@RequestBody GuestNewSessionRequest request) {
        return studySessionService.createGuestSession(request.guestToken(), new NewSessionRequest(
                request.deckId(), request.selectionMethod(), request.cardCount(), request.selectedCardIds(), false, false, request.title()));
    }

    @GetMapping(value = "/guest/{sessionId}", produces = "application/json")
    public SessionView getGuestSession(@PathVariable("sessionId") String sessionId,
                                       @RequestParam(value = "guestToken") String guestToken) {
        return studySessionService.getGuestSession(guestToken, sessionId);
    }

    @PutMapping(value = "/guest/{sessionId}", consumes = "application/json", produces = "application/json")
    public AutosaveResult autosaveGuestSession(@PathVariable("sessionId") String sessionId,
                                               @RequestBody GuestSessionUpdate request) {
        return sessionProgressProcessor.autosaveGuest(request.guestToken(), sessionId, new SessionUpdate(
                request.currentCardIndex(), request.answers(), request.streak(), request.sessionXp(), request.durationSeconds()));
    }

    @PostMapping(value = "/guest/{sessionId}/complete", consumes = "application/json", produces = "application/json")
    public CompletionResult completeGuestSession(@PathVariable("sessionId") String sessionId,
                                                 @RequestBody GuestSessionOutcome request) {
        return sessionProgressProcessor.completeGuestSession(request.guestToken(), sessionId, new SessionOutcome(
                request.score(), request.correctCount(), request.incorrectCount(), request.skippedCount(), request.durationSeconds(), List.of()));
    }

    @DeleteMapping(value = "/guest/{sessionId}", produces = "application/json")
    public StudySession abandonGuestSession(@PathVariable("sessionId") String sessionId,
                                            @RequestParam(value = "guestToken") String guestToken) {
        return studySessionService.abandonGuestSession(guestToken, sessionId);
    }

    private record GuestNewSessionRequest(String guestToken, String deckId, SelectionMethod selectionMethod, Integer cardCount,
                                          List<String> selectedCardIds, String title) { }
    private record GuestSessionUpdate(String guestToken, Integer currentCardIndex, Map<String, AnswerOutcome> answers, Integer streak,
                                      Integer sessionXp, Integer durationSeconds) { }
    private record GuestSessionOutcome(String guestToken, Integer score, int correctCount, int incorrectCount, int skippedCount,
                                       int durationSeconds) { }
}
