package app.sage.core.review.service;

import app.sage.core.review.domain.AuthoritativeState;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.SchedulingState;
import app.sage.core.review.domain.SyncStatus;
import app.sage.core.review.entity.CardStateEntity;
import app.sage.core.review.repository.CardStateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulingStateStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    CardStateRepository repository;

    SchedulingStateStore store;

    final UUID learnerId = UUID.randomUUID();
    final UUID deckId = UUID.randomUUID();
    final UUID cardId = UUID.randomUUID();

    @BeforeEach
    void setup() {
        store = new SchedulingStateStore(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void loadAll_corruptRecordFallsBackToNewKeepingCounters() {
        CardStateEntity corrupt = entity(SyncStatus.OPTIMISTIC, NOW.minus(Duration.ofDays(1)));
        corrupt.setPhase("graduated");
        corrupt.setReps(9);
        corrupt.setLapses(2);
        CardStateEntity nanStability = entity(SyncStatus.CONFIRMED, NOW.minus(Duration.ofDays(1)));
        UUID otherCard = UUID.randomUUID();
        nanStability.setCardId(otherCard);
        nanStability.setStability(Double.NaN);
        when(repository.findByLearnerIdAndCardIdIn(learnerId, List.of(cardId, otherCard)))
                .thenReturn(List.of(corrupt, nanStability));

        Map<UUID, SchedulingState> states = store.loadAll(learnerId, List.of(cardId, otherCard));

        SchedulingState state = states.get(cardId);
        assertThat(state.phase()).isEqualTo(CardPhase.NEW);
        assertThat(state.reps()).isEqualTo(9);
        assertThat(state.lapses()).isEqualTo(2);
        assertThat(state.due()).isEqualTo(NOW);
        assertThat(state.lastReview()).isNull();
        assertThat(states.get(otherCard).phase()).isEqualTo(CardPhase.NEW);
    }

    @Test
    void loadAll_emptyInputSkipsRepository() {
        assertThat(store.loadAll(learnerId, List.of())).isEmpty();
        verifyNoInteractions(repository);
    }

    @Test
    void loadAll_mapsStoredRecord() {
        Instant lastReview = NOW.minus(Duration.ofDays(2));
        CardStateEntity entity = entity(SyncStatus.CONFIRMED, lastReview);
        when(repository.findByLearnerIdAndCardIdIn(learnerId, List.of(cardId))).thenReturn(List.of(entity));

        SchedulingState state = store.loadAll(learnerId, List.of(cardId)).get(cardId);

        assertThat(state.phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(state.stability()).isEqualTo(4.0);
        assertThat(state.lastReview()).isEqualTo(lastReview);
        assertThat(state.due()).isEqualTo(lastReview.plus(Duration.ofDays(4)));
    }

    @Test
    void applyOptimistic_createsRecord() {
        when(repository.findByIdForUpdate(cardId, learnerId)).thenReturn(Optional.empty());
        SchedulingState state = reviewed(NOW, 3.0);

        boolean written = store.applyOptimistic(learnerId, deckId, cardId, "fsrs", state);

        assertThat(written).isTrue();
        ArgumentCaptor<CardStateEntity> captor = ArgumentCaptor.forClass(CardStateEntity.class);
        verify(repository).saveAndFlush(captor.capture());
        CardStateEntity saved = captor.getValue();
        assertThat(saved.getDeckId()).isEqualTo(deckId);
        assertThat(saved.getPhase()).isEqualTo("review");
        assertThat(saved.getSyncStatus()).isEqualTo(SyncStatus.OPTIMISTIC);
        assertThat(saved.getAlgorithmId()).isEqualTo("fsrs");
        assertThat(saved.getLastReviewAt()).isEqualTo(NOW);
    }

    @Test
    void applyOptimistic_concurrentCreateFallsBackToUpdate() {
        CardStateEntity raced = entity(SyncStatus.OPTIMISTIC, NOW.minusSeconds(5));
        when(repository.findByIdForUpdate(cardId, learnerId))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(raced));
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        boolean written = store.applyOptimistic(learnerId, deckId, cardId, "fsrs", reviewed(NOW, 3.0));

        assertThat(written).isTrue();
        verify(repository).save(raced);
        assertThat(raced.getLastReviewAt()).isEqualTo(NOW);
    }

    @Test
    void applyOptimistic_doesNotOverwriteConfirmedLaterReview() {
        Instant later = NOW.plus(Duration.ofMinutes(5));
        CardStateEntity confirmed = entity(SyncStatus.CONFIRMED, later);
        when(repository.findByIdForUpdate(cardId, learnerId)).thenReturn(Optional.of(confirmed));

        boolean written = store.applyOptimistic(learnerId, deckId, cardId, "fsrs", reviewed(NOW, 3.0));

        assertThat(written).isFalse();
        assertThat(confirmed.getLastReviewAt()).isEqualTo(later);
        verify(repository, never()).save(any());
    }

    @Test
    void applyOptimistic_keepsHighestCounters() {
        CardStateEntity existing = entity(SyncStatus.CONFIRMED, NOW.minus(Duration.ofDays(4)));
        existing.setReps(12);
        existing.setLapses(3);
        when(repository.findByIdForUpdate(cardId, learnerId)).thenReturn(Optional.of(existing));

        store.applyOptimistic(learnerId, deckId, cardId, "fsrs", reviewed(NOW, 8.0));

        assertThat(existing.getReps()).isEqualTo(12);
        assertThat(existing.getLapses()).isEqualTo(3);
        assertThat(existing.getStability()).isEqualTo(8.0);
        assertThat(existing.getSyncStatus()).isEqualTo(SyncStatus.OPTIMISTIC);
    }

    @Test
    void applyAuthoritative_replacesOptimisticState() {
        CardStateEntity optimistic = entity(SyncStatus.OPTIMISTIC, NOW);
        when(repository.findByIdForUpdate(cardId, learnerId)).thenReturn(Optional.of(optimistic));
        Instant remoteDue = NOW.plus(Duration.ofDays(5));

        Optional<SchedulingState> merged = store.applyAuthoritative(learnerId, cardId,
                new AuthoritativeState(5.5, null, CardPhase.REVIEW, remoteDue), NOW);

        assertThat(merged).isPresent();
        assertThat(merged.get().stability()).isEqualTo(5.5);
        assertThat(merged.get().difficulty()).isEqualTo(5.0);
        assertThat(merged.get().scheduledDays()).isEqualTo(5.0);
        assertThat(optimistic.getSyncStatus()).isEqualTo(SyncStatus.CONFIRMED);
        assertThat(optimistic.getDueAt()).isEqualTo(remoteDue);
        verify(repository).save(optimistic);
    }

    @Test
    void applyAuthoritative_ignoresResultForOlderReview() {
        CardStateEntity newer = entity(SyncStatus.OPTIMISTIC, NOW);
        when(repository.findByIdForUpdate(cardId, learnerId)).thenReturn(Optional.of(newer));

        Optional<SchedulingState> merged = store.applyAuthoritative(learnerId, cardId,
                new AuthoritativeState(9.0, 1.0, CardPhase.REVIEW, NOW.plus(Duration.ofDays(30))),
                NOW.minus(Duration.ofMinutes(10)));

        assertThat(merged).isEmpty();
        assertThat(newer.getSyncStatus()).isEqualTo(SyncStatus.OPTIMISTIC);
        assertThat(newer.getStability()).isEqualTo(4.0);
        verify(repository, never()).save(any());
    }

    @Test
    void applyAuthoritative_withoutRecordIsIgnored() {
        when(repository.findByIdForUpdate(cardId, learnerId)).thenReturn(Optional.empty());

        assertThat(store.applyAuthoritative(learnerId, cardId,
                new AuthoritativeState(1.0, 1.0, CardPhase.LEARNING, NOW), NOW)).isEmpty();
    }

    private CardStateEntity entity(SyncStatus status, Instant lastReview) {
        CardStateEntity entity = new CardStateEntity();
        entity.setCardId(cardId);
        entity.setLearnerId(learnerId);
        entity.setDeckId(deckId);
        entity.setAlgorithmId("fsrs");
        entity.setStability(4.0);
        entity.setDifficulty(5.0);
        entity.setElapsedDays(1.0);
        entity.setScheduledDays(4.0);
        entity.setReps(2);
        entity.setLapses(0);
        entity.setPhase("review");
        entity.setLearningStep(0);
        entity.setDueAt(lastReview.plus(Duration.ofDays(4)));
        entity.setLastReviewAt(lastReview);
        entity.setSyncStatus(status);
        entity.setUpdatedAt(lastReview);
        return entity;
    }

    private static SchedulingState reviewed(Instant at, double stability) {
        return new SchedulingState(stability, 5.0, 0.0, stability, 1, 0, CardPhase.REVIEW, 0,
                at.plus(Duration.ofDays(Math.round(stability))), at);
    }
}
