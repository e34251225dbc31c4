package app.sage.core.sync.controller;

import app.sage.core.security.CurrentLearnerProvider;
import app.sage.core.sync.service.ReviewReconciler;
import app.sage.core.sync.service.SyncReport;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/study")
public class SyncController {

    private final CurrentLearnerProvider currentLearnerProvider;
    private final ReviewReconciler reconciler;

    public SyncController(CurrentLearnerProvider currentLearnerProvider, ReviewReconciler reconciler) {
        this.currentLearnerProvider = currentLearnerProvider;
        this.reconciler = reconciler;
    }

    // POST /study/sync retries the caller's pending reviews
    @PostMapping("/sync")
    public SyncReport sync(@AuthenticationPrincipal Jwt jwt) {
        UUID learnerId = currentLearnerProvider.getLearnerId(jwt);
        return reconciler.syncNow(learnerId);
    }
}
