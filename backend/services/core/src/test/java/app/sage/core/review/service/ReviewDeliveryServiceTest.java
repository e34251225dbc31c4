package app.sage.core.review.service;

import app.sage.core.review.api.PendingReview;
import app.sage.core.review.domain.AuthoritativeState;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.Rating;
import app.sage.core.review.domain.SchedulingState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewDeliveryServiceTest {

    private static final Instant REVIEWED_AT = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    SchedulingStateStore store;

    @Mock
    ReviewLogService reviewLog;

    @InjectMocks
    ReviewDeliveryService service;

    final PendingReview review = new PendingReview(5L, UUID.randomUUID(), UUID.randomUUID(), Rating.GOOD, 900, REVIEWED_AT, 1);
    final AuthoritativeState remote = new AuthoritativeState(3.0, 5.0, CardPhase.REVIEW, REVIEWED_AT.plus(Duration.ofDays(3)));

    @Test
    void confirm_appliesRemoteStateAndMarksLogSynced() {
        SchedulingState merged = new SchedulingState(3.0, 5.0, 0.0, 3.0, 1, 0, CardPhase.REVIEW, 0,
                REVIEWED_AT.plus(Duration.ofDays(3)), REVIEWED_AT);
        when(store.applyAuthoritative(review.learnerId(), review.cardId(), remote, REVIEWED_AT)).thenReturn(Optional.of(merged));

        assertThat(service.confirm(review, remote)).isTrue();
        verify(reviewLog).markSynced(5L);
    }

    @Test
    void confirm_supersededResultStillMarksLogSynced() {
        when(store.applyAuthoritative(review.learnerId(), review.cardId(), remote, REVIEWED_AT)).thenReturn(Optional.empty());

        assertThat(service.confirm(review, remote)).isFalse();
        verify(reviewLog).markSynced(5L);
    }

    @Test
    void recordFailure_countsAttemptOnTheLog() {
        when(reviewLog.markFailed(5L, "timeout")).thenReturn(2);

        assertThat(service.recordFailure(review, "timeout")).isEqualTo(2);
        verifyNoInteractions(store);
    }
}
