package app.sage.core.review.controller;

import app.sage.core.review.controller.dto.ChoiceAnswerRequest;
import app.sage.core.review.controller.dto.NextCardResponse;
import app.sage.core.review.controller.dto.RateCardRequest;
import app.sage.core.review.controller.dto.RatingResponse;
import app.sage.core.review.controller.dto.SessionResponse;
import app.sage.core.review.controller.dto.StartSessionRequest;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.session.ChoiceAnswerOutcome;
import app.sage.core.review.session.RatingOutcome;
import app.sage.core.review.session.SessionProgress;
import app.sage.core.review.session.SessionSummary;
import app.sage.core.review.session.StudySessionManager;
import app.sage.core.security.CurrentLearnerProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/study")
public class StudySessionController {

    private final CurrentLearnerProvider currentLearnerProvider;
    private final StudySessionManager sessionManager;

    public StudySessionController(CurrentLearnerProvider currentLearnerProvider, StudySessionManager sessionManager) {
        this.currentLearnerProvider = currentLearnerProvider;
        this.sessionManager = sessionManager;
    }

    // POST /study/decks/{deckId}/sessions?limit=20
    @PostMapping("/decks/{deckId}/sessions")
    public SessionResponse startDeckSession(@AuthenticationPrincipal Jwt jwt,
                                            @PathVariable UUID deckId,
                                            @RequestParam(required = false) Integer limit) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        SessionSummary summary = sessionManager.startDeckSession(learnerId, deckId, limit);
        return snapshot(learnerId, summary);
    }

    @PostMapping("/sessions")
    public SessionResponse startSession(@AuthenticationPrincipal Jwt jwt,
                                        @RequestBody StartSessionRequest req) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        if (req == null || req.deckId() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "deckId is required");
        }
        SessionSummary summary = sessionManager.startSessionForCards(learnerId, req.deckId(), req.cardIds());
        return snapshot(learnerId, summary);
    }

    @GetMapping("/session")
    public SessionResponse current(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        SessionSummary summary = sessionManager.getSession(learnerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No active session"));
        return snapshot(learnerId, summary);
    }

    @PostMapping("/session/choice")
    public ChoiceAnswerOutcome answerChoice(@AuthenticationPrincipal Jwt jwt,
                                            @RequestBody ChoiceAnswerRequest req) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        ChoiceAnswerOutcome outcome = sessionManager.submitChoiceAnswer(learnerId, req == null ? null : req.option());
        if (!outcome.accepted()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, outcome.reason());
        }
        return outcome;
    }

    @PostMapping("/session/rating")
    public ResponseEntity<RatingResponse> rate(@AuthenticationPrincipal Jwt jwt,
                                               @RequestBody RateCardRequest req) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        Rating rating;
        try {
            rating = Rating.fromString(req == null ? null : req.rating());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
        long reviewTimeMs = req.reviewTimeMs() == null ? 0L : req.reviewTimeMs();

        RatingOutcome outcome = sessionManager.rateCard(learnerId, rating, reviewTimeMs);
        RatingResponse body = RatingResponse.of(outcome, sessionManager.getProgress(learnerId));
        HttpStatus status = switch (outcome.status()) {
            case ACCEPTED -> HttpStatus.OK;
            case REFUSED -> HttpStatus.CONFLICT;
            case REJECTED -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(body);
    }

    @PostMapping("/session/next")
    public NextCardResponse next(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        if (sessionManager.getSession(learnerId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No active session");
        }
        boolean hasMore = sessionManager.nextCard(learnerId);
        return new NextCardResponse(
                hasMore,
                sessionManager.getStatus(learnerId),
                sessionManager.getCurrentCard(learnerId).orElse(null),
                sessionManager.getProgress(learnerId)
        );
    }

    @DeleteMapping("/session")
    public SessionSummary end(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        return sessionManager.endSession(learnerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No active session"));
    }

    @GetMapping("/session/progress")
    public SessionProgress progress(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        return sessionManager.getProgress(learnerId);
    }

    private SessionResponse snapshot(UUID learnerId, SessionSummary summary) {
        return new SessionResponse(
                summary,
                sessionManager.getCurrentCard(learnerId).orElse(null),
                sessionManager.getProgress(learnerId)
        );
    }
}
