package app.sage.core.review.session;

import app.sage.core.review.algorithm.ReviewScheduler;
import app.sage.core.review.algorithm.SchedulerSettings;
import app.sage.core.review.api.ReviewReconciledEvent;
import app.sage.core.review.domain.CardKind;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.ScheduleResult;
import app.sage.core.review.domain.StudyCard;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory study session of one learner: a single ordered pass over a set of cards.
 *
 * <p>All state changes happen under the session monitor. Reconciliation results arrive from other
 * threads through {@link #post(ReviewReconciledEvent)} and are applied at the start of the next
 * session operation, and only to the card that is still current.
 */
public class StudySession {

    static final String RESTRICTED_REASON =
            "For incorrect answers, please choose Again or Hard to help reinforce this card";
    private static final Set<Rating> ALL_RATINGS = Collections.unmodifiableSet(EnumSet.allOf(Rating.class));
    private static final Set<Rating> RESTRICTED_RATINGS =
            Collections.unmodifiableSet(EnumSet.of(Rating.AGAIN, Rating.HARD));

    private final UUID id;
    private final UUID learnerId;
    private final UUID deckId;
    private final Instant startedAt;
    private final SchedulerSettings settings;
    private final List<SessionEntry> entries;
    private final Queue<ReviewReconciledEvent> inbox = new ConcurrentLinkedQueue<>();

    private int currentIndex;
    private int reviewedCount;
    private int correctCount;
    private SessionStatus status;

    StudySession(UUID id,
                 UUID learnerId,
                 UUID deckId,
                 Instant startedAt,
                 SchedulerSettings settings,
                 List<SessionEntry> entries) {
        this.id = id;
        this.learnerId = learnerId;
        this.deckId = deckId;
        this.startedAt = startedAt;
        this.settings = settings;
        this.entries = List.copyOf(entries);
        this.currentIndex = 0;
        this.status = this.entries.isEmpty() ? SessionStatus.COMPLETE : SessionStatus.IN_PROGRESS;
    }

    public UUID id() {
        return id;
    }

    public UUID learnerId() {
        return learnerId;
    }

    public UUID deckId() {
        return deckId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    SchedulerSettings settings() {
        return settings;
    }

    public synchronized SessionStatus status() {
        return status;
    }

    /**
     * Queues a reconciliation result. Safe to call from any thread.
     */
    public void post(ReviewReconciledEvent event) {
        inbox.add(event);
    }

    public synchronized Optional<CurrentCard> currentCard() {
        drainInbox();
        if (status != SessionStatus.IN_PROGRESS) {
            return Optional.empty();
        }
        SessionEntry entry = entries.get(currentIndex);
        return Optional.of(new CurrentCard(
                id,
                currentIndex,
                entry.card(),
                entry.state(),
                entry.previews(),
                allowedRatings(entry),
                entry.choiceCorrect(),
                entry.rating()
        ));
    }

    public synchronized ChoiceAnswerOutcome answerChoice(String selectedOption) {
        drainInbox();
        if (status != SessionStatus.IN_PROGRESS) {
            return ChoiceAnswerOutcome.rejected("Session is complete");
        }
        SessionEntry entry = entries.get(currentIndex);
        StudyCard card = entry.card();
        if (card.kind() != CardKind.CHOICE) {
            return ChoiceAnswerOutcome.rejected("Current card is not a choice card");
        }
        if (entry.choiceCorrect() != null) {
            return ChoiceAnswerOutcome.rejected("Current card has already been answered");
        }
        if (entry.isRated()) {
            return ChoiceAnswerOutcome.rejected("Current card has already been rated");
        }
        if (selectedOption == null || selectedOption.isBlank()) {
            return ChoiceAnswerOutcome.rejected("Selected option is required");
        }
        String selected = selectedOption.trim();
        boolean known = card.options().stream().anyMatch(o -> o.trim().equalsIgnoreCase(selected));
        if (!known) {
            return ChoiceAnswerOutcome.rejected("Unknown option: " + selected);
        }
        boolean correct = card.answer() != null && selected.equalsIgnoreCase(card.answer().trim());
        entry.answerChoice(correct);
        return ChoiceAnswerOutcome.answered(card.id(), correct, card.answer(), allowedRatings(entry));
    }

    /**
     * Applies a rating to the current card. The committed state is the candidate that was
     * previewed for {@code rating}.
     */
    public synchronized RatingOutcome rate(Rating rating, Instant now, ReviewScheduler scheduler) {
        drainInbox();
        if (rating == null) {
            return RatingOutcome.rejected("Rating is required");
        }
        if (status != SessionStatus.IN_PROGRESS) {
            return RatingOutcome.rejected("Session is complete");
        }
        SessionEntry entry = entries.get(currentIndex);
        UUID cardId = entry.card().id();
        if (entry.isRated()) {
            return RatingOutcome.rejected("Current card has already been rated");
        }
        if (!allowedRatings(entry).contains(rating)) {
            return RatingOutcome.refused(cardId, rating, RESTRICTED_REASON);
        }

        ScheduleResult result = scheduler.computeUpdate(entry.state(), rating, now, settings);
        RatingOutcome outcome = RatingOutcome.accepted(cardId, rating, entry.state(), result.nextState());
        entry.state(result.nextState());
        entry.rated(rating);
        reviewedCount++;
        if (rating.isCorrect()) {
            correctCount++;
        }
        return outcome;
    }

    /**
     * Moves past the current card.
     *
     * @return whether a card remains to be shown
     */
    public synchronized boolean next() {
        drainInbox();
        if (status != SessionStatus.IN_PROGRESS) {
            return false;
        }
        currentIndex++;
        if (currentIndex >= entries.size()) {
            currentIndex = entries.size();
            status = SessionStatus.COMPLETE;
            return false;
        }
        return true;
    }

    public synchronized SessionProgress progress() {
        drainInbox();
        return SessionProgress.of(currentIndex, entries.size());
    }

    public synchronized SessionSummary summary() {
        drainInbox();
        return new SessionSummary(id, learnerId, deckId, status, entries.size(), reviewedCount, correctCount, startedAt);
    }

    synchronized int currentIndex() {
        return currentIndex;
    }

    private void drainInbox() {
        ReviewReconciledEvent event;
        while ((event = inbox.poll()) != null) {
            applyReconciled(event);
        }
    }

    private void applyReconciled(ReviewReconciledEvent event) {
        if (status != SessionStatus.IN_PROGRESS) {
            return;
        }
        SessionEntry entry = entries.get(currentIndex);
        if (!entry.card().id().equals(event.cardId())) {
            return;
        }
        Instant lastReview = entry.state().lastReview();
        if (lastReview == null || !lastReview.equals(event.reviewedAt())) {
            return;
        }
        entry.state(entry.state().withAuthoritative(event.state()));
    }

    private static Set<Rating> allowedRatings(SessionEntry entry) {
        return entry.isRestricted() ? RESTRICTED_RATINGS : ALL_RATINGS;
    }
}
