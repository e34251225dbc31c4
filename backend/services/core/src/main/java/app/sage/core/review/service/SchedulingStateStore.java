package app.sage.core.review.service;

import app.sage.core.review.domain.AuthoritativeState;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.domain.SyncStatus;
import app.sage.core.review.entity.CardStateEntity;
import app.sage.core.review.repository.CardStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * One scheduling record per (card, learner).
 *
 * <p>Records carry a {@link SyncStatus}. An authoritative result replaces the optimistic one written
 * for the same review, and neither kind of write replaces a record that belongs to a later review.
 */
@Service
public class SchedulingStateStore {

    private static final Logger log = LoggerFactory.getLogger(SchedulingStateStore.class);

    private final CardStateRepository repository;
    private final Clock clock;

    public SchedulingStateStore(CardStateRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Map<UUID, SchedulingState> loadAll(UUID learnerId, Collection<UUID> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return Map.of();
        }
        Instant now = clock.instant();
        Map<UUID, SchedulingState> out = new HashMap<>();
        for (CardStateEntity entity : repository.findByLearnerIdAndCardIdIn(learnerId, cardIds)) {
            out.put(entity.getCardId(), toDomain(entity, now));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<SchedulingState> loadDeckStates(UUID learnerId, UUID deckId) {
        Instant now = clock.instant();
        return repository.findByLearnerIdAndDeckId(learnerId, deckId).stream()
                .map(entity -> toDomain(entity, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SchedulingState> loadLearnerStates(UUID learnerId) {
        Instant now = clock.instant();
        return repository.findByLearnerId(learnerId).stream()
                .map(entity -> toDomain(entity, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<UUID> findDueCardIds(UUID learnerId, UUID deckId, Instant now, Pageable pageable) {
        return repository.findDueCardIds(learnerId, deckId, now, CardPhase.NEW.wireName(), pageable);
    }

    @Transactional(readOnly = true)
    public List<UUID> findStartedCardIds(UUID learnerId, UUID deckId) {
        return repository.findStartedCardIds(learnerId, deckId, CardPhase.NEW.wireName());
    }

    /**
     * Writes a locally computed state. Skipped when the stored record is a confirmed result
     * for a later review.
     */
    @Transactional
    public boolean applyOptimistic(UUID learnerId, UUID deckId, UUID cardId, String algorithmId, SchedulingState state) {
        Optional<CardStateEntity> existing = repository.findByIdForUpdate(cardId, learnerId);
        if (existing.isPresent()) {
            CardStateEntity entity = existing.get();
            if (entity.getSyncStatus() == SyncStatus.CONFIRMED && isAfter(entity.getLastReviewAt(), state.lastReview())) {
                log.debug("Optimistic write skipped cardId={} learnerId={} storedLastReview={}",
                        cardId, learnerId, entity.getLastReviewAt());
                return false;
            }
            write(entity, state, algorithmId, SyncStatus.OPTIMISTIC);
            repository.save(entity);
            return true;
        }

        CardStateEntity created = new CardStateEntity();
        created.setCardId(cardId);
        created.setLearnerId(learnerId);
        created.setDeckId(deckId);
        write(created, state, algorithmId, SyncStatus.OPTIMISTIC);
        try {
            repository.saveAndFlush(created);
        } catch (DataIntegrityViolationException ex) {
            CardStateEntity raced = repository.findByIdForUpdate(cardId, learnerId).orElseThrow(() -> ex);
            write(raced, state, algorithmId, SyncStatus.OPTIMISTIC);
            repository.save(raced);
        }
        return true;
    }

    /**
     * Overlays the remote scheduler's answer for the review made at {@code reviewedAt}.
     *
     * @return the merged state, or empty when there is no record or it belongs to a later review
     */
    @Transactional
    public Optional<SchedulingState> applyAuthoritative(UUID learnerId, UUID cardId, AuthoritativeState remote, Instant reviewedAt) {
        Optional<CardStateEntity> existing = repository.findByIdForUpdate(cardId, learnerId);
        if (existing.isEmpty()) {
            log.warn("Authoritative result without local state cardId={} learnerId={}", cardId, learnerId);
            return Optional.empty();
        }
        CardStateEntity entity = existing.get();
        if (isAfter(entity.getLastReviewAt(), reviewedAt)) {
            log.debug("Stale authoritative result ignored cardId={} learnerId={} reviewedAt={} storedLastReview={}",
                    cardId, learnerId, reviewedAt, entity.getLastReviewAt());
            return Optional.empty();
        }
        SchedulingState merged = toDomain(entity, clock.instant()).withAuthoritative(remote);
        write(entity, merged, entity.getAlgorithmId(), SyncStatus.CONFIRMED);
        repository.save(entity);
        return Optional.of(merged);
    }

    private void write(CardStateEntity entity, SchedulingState state, String algorithmId, SyncStatus status) {
        entity.setAlgorithmId(algorithmId);
        entity.setStability(state.stability());
        entity.setDifficulty(state.difficulty());
        entity.setElapsedDays(state.elapsedDays());
        entity.setScheduledDays(state.scheduledDays());
        entity.setReps(Math.max(entity.getReps(), state.reps()));
        entity.setLapses(Math.max(entity.getLapses(), state.lapses()));
        entity.setPhase(state.phase().wireName());
        entity.setLearningStep(state.learningStep());
        entity.setDueAt(state.due());
        entity.setLastReviewAt(state.lastReview());
        entity.setSyncStatus(status);
        entity.setUpdatedAt(clock.instant());
    }

    /**
     * Maps a stored record back to the domain. Unreadable records fall back to a NEW state that
     * keeps the stored counters.
     */
    SchedulingState toDomain(CardStateEntity entity, Instant now) {
        CardPhase phase = CardPhase.fromWire(entity.getPhase());
        boolean corrupt = phase == null
                || entity.getDueAt() == null
                || !Double.isFinite(entity.getStability()) || entity.getStability() <= 0
                || !Double.isFinite(entity.getDifficulty()) || entity.getDifficulty() <= 0;
        if (corrupt) {
            log.warn("Corrupt scheduling state, falling back to new cardId={} learnerId={} phase={}",
                    entity.getCardId(), entity.getLearnerId(), entity.getPhase());
            SchedulingState fresh = SchedulingState.newCard(now);
            return new SchedulingState(fresh.stability(), fresh.difficulty(), 0.0, 0.0,
                    Math.max(0, entity.getReps()), Math.max(0, entity.getLapses()),
                    CardPhase.NEW, 0, now, null);
        }
        Instant due = entity.getDueAt();
        if (entity.getLastReviewAt() != null && due.isBefore(entity.getLastReviewAt())) {
            due = entity.getLastReviewAt();
        }
        return new SchedulingState(
                entity.getStability(),
                entity.getDifficulty(),
                entity.getElapsedDays(),
                entity.getScheduledDays(),
                entity.getReps(),
                entity.getLapses(),
                phase,
                Math.max(0, entity.getLearningStep()),
                due,
                entity.getLastReviewAt()
        );
    }

    private static boolean isAfter(Instant stored, Instant incoming) {
        return stored != null && incoming != null && stored.isAfter(incoming);
    }
}
