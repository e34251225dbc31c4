package app.sage.core.sync.service;

import app.sage.core.review.api.PendingReview;
import app.sage.core.review.api.ReviewDeliveryPort;
import app.sage.core.review.api.ReviewReconciledEvent;
import app.sage.core.review.api.ReviewRecordedEvent;
import app.sage.core.review.domain.AuthoritativeState;
import app.sage.core.sync.client.RemoteSchedulerClient;
import app.sage.core.sync.config.RemoteSchedulerProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers logged reviews to the remote scheduler and writes its answers back to the store.
 *
 * <p>New reviews are submitted asynchronously as soon as they are recorded. Reviews that could not
 * be delivered stay pending and are retried by a scheduled job or on demand.
 */
@Service
public class ReviewReconciler {

    private static final Logger log = LoggerFactory.getLogger(ReviewReconciler.class);

    private final RemoteSchedulerClient client;
    private final ReviewDeliveryPort delivery;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor executor;
    private final RemoteSchedulerProps props;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public ReviewReconciler(RemoteSchedulerClient client,
                            ReviewDeliveryPort delivery,
                            ApplicationEventPublisher eventPublisher,
                            @Qualifier("reconciliationExecutor") Executor executor,
                            RemoteSchedulerProps props) {
        this.client = client;
        this.delivery = delivery;
        this.eventPublisher = eventPublisher;
        this.executor = executor;
        this.props = props;
    }

    @EventListener
    public void onReviewRecorded(ReviewRecordedEvent event) {
        submit(event.review());
    }

    public CompletableFuture<Boolean> submit(PendingReview review) {
        if (!props.enabled()) {
            return CompletableFuture.completedFuture(false);
        }
        try {
            return CompletableFuture.supplyAsync(() -> reconcile(review), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Reconciliation rejected by executor reviewLogId={} cardId={}", review.reviewLogId(), review.cardId());
            return CompletableFuture.completedFuture(false);
        }
    }

    @Scheduled(fixedDelayString = "${app.remote-scheduler.retry-interval-ms:60000}",
            initialDelayString = "${app.remote-scheduler.retry-initial-delay-ms:30000}")
    public void retryPending() {
        if (!props.enabled()) {
            return;
        }
        List<PendingReview> pending = delivery.findRetryable(props.maxAttemptsOrDefault(), props.batchSizeOrDefault());
        if (pending.isEmpty()) {
            return;
        }
        SyncReport report = reconcileAll(pending);
        log.info("Pending reviews retried attempted={} synced={} failed={}",
                report.attempted(), report.synced(), report.failed());
    }

    /**
     * Retries every pending review of one learner now, regardless of previous attempts.
     */
    public SyncReport syncNow(UUID learnerId) {
        if (!props.enabled()) {
            return new SyncReport(0, 0, 0);
        }
        return reconcileAll(delivery.findPending(learnerId, props.batchSizeOrDefault()));
    }

    private SyncReport reconcileAll(List<PendingReview> pending) {
        int synced = 0;
        int failed = 0;
        int attempted = 0;
        for (PendingReview review : pending) {
            if (review.reviewLogId() != null && inFlight.contains(review.reviewLogId())) {
                continue;
            }
            attempted++;
            if (reconcile(review)) {
                synced++;
            } else {
                failed++;
            }
        }
        return new SyncReport(attempted, synced, failed);
    }

    boolean reconcile(PendingReview review) {
        Long logId = review.reviewLogId();
        if (logId != null && !inFlight.add(logId)) {
            return false;
        }
        try {
            AuthoritativeState remote = client.submitReview(review);
            if (!delivery.confirm(review, remote)) {
                log.debug("Remote result superseded by a later review reviewLogId={} cardId={}", logId, review.cardId());
            }
            eventPublisher.publishEvent(new ReviewReconciledEvent(
                    review.learnerId(), review.cardId(), review.reviewedAt(), remote));
            return true;
        } catch (RuntimeException ex) {
            recordFailure(review, ex);
            return false;
        } finally {
            if (logId != null) {
                inFlight.remove(logId);
            }
        }
    }

    private void recordFailure(PendingReview review, RuntimeException failure) {
        int attempts;
        try {
            attempts = delivery.recordFailure(review, failure.getMessage());
        } catch (RuntimeException ex) {
            log.error("Failed to record sync failure reviewLogId={}", review.reviewLogId(), ex);
            return;
        }
        if (attempts >= props.maxAttemptsOrDefault()) {
            log.error("Review left for manual sync reviewLogId={} cardId={} learnerId={} attempts={} error={}",
                    review.reviewLogId(), review.cardId(), review.learnerId(), attempts, failure.getMessage());
        } else {
            log.warn("Review reconciliation failed reviewLogId={} cardId={} attempts={} error={}",
                    review.reviewLogId(), review.cardId(), attempts, failure.getMessage());
        }
    }
}
