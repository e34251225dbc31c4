package app.sage.core.review.controller;

import app.sage.core.review.controller.dto.PreferencesDto;
import app.sage.core.review.service.LearnerPreferencesService;
import app.sage.core.review.service.LearnerPreferencesService.LearnerPreferences;
import app.sage.core.security.CurrentLearnerProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/study/preferences")
public class LearnerPreferencesController {

    private final CurrentLearnerProvider currentLearnerProvider;
    private final LearnerPreferencesService preferencesService;

    public LearnerPreferencesController(CurrentLearnerProvider currentLearnerProvider,
                                        LearnerPreferencesService preferencesService) {
        this.currentLearnerProvider = currentLearnerProvider;
        this.preferencesService = preferencesService;
    }

    @GetMapping
    public PreferencesDto get(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        return toDto(preferencesService.get(learnerId));
    }

    @PutMapping
    public PreferencesDto update(@AuthenticationPrincipal Jwt jwt, @RequestBody PreferencesDto req) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        try {
            return toDto(preferencesService.update(
                    learnerId,
                    req.schedulerOverrides(),
                    req.newCardsPerDay(),
                    req.dailyGoal(),
                    req.timeZone()
            ));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
    }

    private static PreferencesDto toDto(LearnerPreferences prefs) {
        return new PreferencesDto(
                prefs.schedulerOverrides(),
                prefs.newCardsPerDay(),
                prefs.dailyGoal(),
                prefs.timeZone().getId()
        );
    }
}
