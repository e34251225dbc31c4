package app.sage.core.review.controller;

import app.sage.core.review.domain.DeckStats;
import app.sage.core.review.domain.LearnerStats;
import app.sage.core.review.domain.StudyHistory;
import app.sage.core.review.service.StudyStatsService;
import app.sage.core.security.CurrentLearnerProvider;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/study")
public class StudyStatsController {

    private final CurrentLearnerProvider currentLearnerProvider;
    private final StudyStatsService statsService;

    public StudyStatsController(CurrentLearnerProvider currentLearnerProvider, StudyStatsService statsService) {
        this.currentLearnerProvider = currentLearnerProvider;
        this.statsService = statsService;
    }

    @GetMapping("/stats")
    public LearnerStats learnerStats(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        return statsService.learnerStats(learnerId);
    }

    @GetMapping("/stats/decks/{deckId}")
    public DeckStats deckStats(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID deckId) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        return statsService.deckStats(learnerId, deckId);
    }

    @GetMapping("/history")
    public StudyHistory history(@AuthenticationPrincipal Jwt jwt,
                                @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        try {
            return statsService.history(learnerId, from, to);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
    }
}
