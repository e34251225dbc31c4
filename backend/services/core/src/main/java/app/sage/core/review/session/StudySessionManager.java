package app.sage.core.review.session;

import app.sage.core.config.StudyProps;
import app.sage.core.review.algorithm.ReviewScheduler;
import app.sage.core.review.algorithm.SchedulerSettings;
import app.sage.core.review.api.CardCatalogPort;
import app.sage.core.review.api.PendingReview;
import app.sage.core.review.api.ReviewReconciledEvent;
import app.sage.core.review.api.ReviewRecordedEvent;
import app.sage.core.review.domain.IntervalPreview;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.domain.StudyCard;
import app.sage.core.review.service.LearnerPreferencesService;
import app.sage.core.review.service.LearnerPreferencesService.LearnerPreferences;
import app.sage.core.review.service.ReviewLogService;
import app.sage.core.review.service.SchedulingStateStore;
import app.sage.core.review.service.StudySessionLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of active study sessions, one per learner.
 *
 * <p>A rating is applied to the session, written to the store as optimistic and logged before the
 * {@link ReviewRecordedEvent} that triggers remote reconciliation is published. Local persistence
 * failures are logged and never fail the rating.
 */
@Service
public class StudySessionManager {

    private static final Logger log = LoggerFactory.getLogger(StudySessionManager.class);

    private final ConcurrentMap<UUID, StudySession> sessions = new ConcurrentHashMap<>();

    private final ReviewScheduler scheduler;
    private final SchedulingStateStore store;
    private final ReviewLogService reviewLog;
    private final StudySessionLogService sessionLog;
    private final LearnerPreferencesService preferences;
    private final CardCatalogPort cardCatalog;
    private final ApplicationEventPublisher eventPublisher;
    private final StudyProps studyProps;
    private final Clock clock;

    public StudySessionManager(ReviewScheduler scheduler,
                               SchedulingStateStore store,
                               ReviewLogService reviewLog,
                               StudySessionLogService sessionLog,
                               LearnerPreferencesService preferences,
                               CardCatalogPort cardCatalog,
                               ApplicationEventPublisher eventPublisher,
                               StudyProps studyProps,
                               Clock clock) {
        this.scheduler = scheduler;
        this.store = store;
        this.reviewLog = reviewLog;
        this.sessionLog = sessionLog;
        this.preferences = preferences;
        this.cardCatalog = cardCatalog;
        this.eventPublisher = eventPublisher;
        this.studyProps = studyProps;
        this.clock = clock;
    }

    /**
     * Starts a session over {@code cards}, replacing any session the learner already has.
     * Cards keep their latest stored state; cards without one start as new.
     */
    public SessionSummary startSession(UUID learnerId, UUID deckId, List<StudyCard> cards) {
        Objects.requireNonNull(learnerId, "learnerId");
        Objects.requireNonNull(deckId, "deckId");

        Map<UUID, StudyCard> unique = new LinkedHashMap<>();
        if (cards != null) {
            for (StudyCard card : cards) {
                unique.putIfAbsent(card.id(), card);
            }
        }

        Instant now = clock.instant();
        SchedulerSettings settings = preferences.settingsFor(learnerId);
        Map<UUID, SchedulingState> stored = store.loadAll(learnerId, unique.keySet());

        List<SessionEntry> entries = new ArrayList<>(unique.size());
        for (StudyCard card : unique.values()) {
            SchedulingState state = stored.get(card.id());
            if (state == null) {
                state = scheduler.initialState(now);
            }
            Map<Rating, IntervalPreview> previews = scheduler.preview(state, now, settings);
            entries.add(new SessionEntry(card, state, previews));
        }

        StudySession session = new StudySession(UUID.randomUUID(), learnerId, deckId, now, settings, entries);
        StudySession previous = sessions.put(learnerId, session);
        if (previous != null) {
            recordEnd(previous, now);
        }
        log.info("Study session started sessionId={} learnerId={} deckId={} cards={}",
                session.id(), learnerId, deckId, entries.size());
        return session.summary();
    }

    /**
     * Starts a session over the deck's due cards (earliest due first) topped up with new cards in
     * deck order, within the learner's remaining new-card quota for today.
     */
    public SessionSummary startDeckSession(UUID learnerId, UUID deckId, Integer limit) {
        int size = limit == null || limit <= 0
                ? studyProps.sessionSizeOrDefault()
                : Math.min(limit, studyProps.maxSessionSizeOrDefault());
        Instant now = clock.instant();
        LearnerPreferences prefs = preferences.get(learnerId);

        List<UUID> ids = new ArrayList<>(store.findDueCardIds(learnerId, deckId, now, PageRequest.of(0, size)));
        int remaining = size - ids.size();
        long quota = prefs.newCardsPerDay()
                - reviewLog.countNewCardsIntroducedSince(learnerId, startOfDay(now, prefs.timeZone()));
        int newLimit = (int) Math.min(remaining, Math.max(0, quota));
        if (newLimit > 0) {
            ids.addAll(cardCatalog.findUnstartedCardIds(deckId, store.findStartedCardIds(learnerId, deckId), newLimit));
        }
        log.debug("Deck session selection learnerId={} deckId={} size={} selected={} newQuota={}",
                learnerId, deckId, size, ids.size(), quota);
        return startSession(learnerId, deckId, cardCatalog.findCards(ids));
    }

    /**
     * Starts a session over explicitly chosen cards. Ids that are unknown or belong to another
     * deck are dropped.
     */
    public SessionSummary startSessionForCards(UUID learnerId, UUID deckId, List<UUID> cardIds) {
        List<UUID> ids = cardIds == null ? List.of() : cardIds.stream().filter(Objects::nonNull).distinct().toList();
        List<StudyCard> cards = new ArrayList<>(ids.size());
        for (StudyCard card : cardCatalog.findCards(ids)) {
            if (deckId.equals(card.deckId())) {
                cards.add(card);
            } else {
                log.warn("Card outside session deck dropped learnerId={} deckId={} cardId={}", learnerId, deckId, card.id());
            }
        }
        return startSession(learnerId, deckId, cards);
    }

    public Optional<SessionSummary> getSession(UUID learnerId) {
        StudySession session = sessions.get(learnerId);
        return session == null ? Optional.empty() : Optional.of(session.summary());
    }

    public SessionStatus getStatus(UUID learnerId) {
        StudySession session = sessions.get(learnerId);
        return session == null ? SessionStatus.NOT_STARTED : session.status();
    }

    public Optional<CurrentCard> getCurrentCard(UUID learnerId) {
        StudySession session = sessions.get(learnerId);
        return session == null ? Optional.empty() : session.currentCard();
    }

    public ChoiceAnswerOutcome submitChoiceAnswer(UUID learnerId, String selectedOption) {
        StudySession session = sessions.get(learnerId);
        if (session == null) {
            return ChoiceAnswerOutcome.rejected("No active session");
        }
        return session.answerChoice(selectedOption);
    }

    public RatingOutcome rateCard(UUID learnerId, Rating rating, long reviewTimeMs) {
        StudySession session = sessions.get(learnerId);
        if (session == null) {
            return RatingOutcome.rejected("No active session");
        }
        if (reviewTimeMs < 0) {
            return RatingOutcome.rejected("reviewTimeMs must be non-negative");
        }

        Instant now = clock.instant();
        RatingOutcome outcome = session.rate(rating, now, scheduler);
        if (!outcome.isAccepted()) {
            log.debug("Rating not applied learnerId={} status={} reason={}", learnerId, outcome.status(), outcome.reason());
            return outcome;
        }

        PendingReview pending = persistLocally(session, outcome, reviewTimeMs, now);
        eventPublisher.publishEvent(new ReviewRecordedEvent(pending));
        return outcome;
    }

    public boolean nextCard(UUID learnerId) {
        StudySession session = sessions.get(learnerId);
        return session != null && session.next();
    }

    /**
     * Ends and discards the learner's session. Reconciliations already dispatched keep running.
     */
    public Optional<SessionSummary> endSession(UUID learnerId) {
        StudySession session = sessions.remove(learnerId);
        if (session == null) {
            return Optional.empty();
        }
        SessionSummary summary = session.summary();
        recordEnd(session, clock.instant());
        return Optional.of(summary);
    }

    public SessionProgress getProgress(UUID learnerId) {
        StudySession session = sessions.get(learnerId);
        return session == null ? SessionProgress.NONE : session.progress();
    }

    @EventListener
    public void onReviewReconciled(ReviewReconciledEvent event) {
        StudySession session = sessions.get(event.learnerId());
        if (session != null) {
            session.post(event);
        }
    }

    private PendingReview persistLocally(StudySession session, RatingOutcome outcome, long reviewTimeMs, Instant now) {
        UUID learnerId = session.learnerId();
        try {
            store.applyOptimistic(learnerId, session.deckId(), outcome.cardId(), scheduler.algorithmId(), outcome.nextState());
        } catch (RuntimeException ex) {
            log.error("Failed to store optimistic state learnerId={} cardId={}", learnerId, outcome.cardId(), ex);
        }
        try {
            return reviewLog.record(learnerId, session.deckId(), outcome.cardId(), scheduler.algorithmId(),
                    outcome.rating(), outcome.previousState(), outcome.nextState(), reviewTimeMs, now);
        } catch (RuntimeException ex) {
            log.error("Failed to log review learnerId={} cardId={}", learnerId, outcome.cardId(), ex);
            return new PendingReview(null, learnerId, outcome.cardId(), outcome.rating(), reviewTimeMs, now, 0);
        }
    }

    private void recordEnd(StudySession session, Instant endedAt) {
        SessionSummary summary = session.summary();
        try {
            sessionLog.record(summary, endedAt);
        } catch (RuntimeException ex) {
            log.error("Failed to record session end sessionId={} learnerId={}", summary.sessionId(), summary.learnerId(), ex);
        }
        log.info("Study session ended sessionId={} learnerId={} status={} reviewed={} correct={}",
                summary.sessionId(), summary.learnerId(), summary.status(), summary.reviewed(), summary.correct());
    }

    private static Instant startOfDay(Instant now, ZoneId zone) {
        return LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
    }
}
