package app.sage.core.sync.client;

import app.sage.core.review.api.PendingReview;
import app.sage.core.review.domain.AuthoritativeState;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.sync.config.RemoteSchedulerProps;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class RemoteSchedulerClient {

    private final RestClient restClient;
    private final RemoteSchedulerProps props;

    public RemoteSchedulerClient(RestClient remoteSchedulerRestClient, RemoteSchedulerProps props) {
        this.restClient = remoteSchedulerRestClient;
        this.props = props;
    }

    /**
     * Submits one review and returns the authoritative next state.
     *
     * @throws RemoteSchedulerException on any transport, HTTP or payload failure
     */
    public AuthoritativeState submitReview(PendingReview review) {
        ReviewSubmissionRequest payload = new ReviewSubmissionRequest(
                review.cardId(),
                review.rating().code(),
                Math.max(0, review.reviewTimeMs()),
                review.reviewedAt()
        );

        RemoteReviewResponse response;
        try {
            RestClient.RequestBodySpec request = restClient.post()
                    .uri("/study/review")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload);
            if (props.internalToken() != null && !props.internalToken().isBlank()) {
                request.header(HttpHeaders.AUTHORIZATION, "Bearer " + props.internalToken());
            }
            response = request.retrieve().body(RemoteReviewResponse.class);
        } catch (RestClientException ex) {
            throw new RemoteSchedulerException("Remote scheduler call failed: " + ex.getMessage(), ex);
        }

        if (response == null) {
            throw new RemoteSchedulerException("Remote scheduler response is empty");
        }
        if (!Boolean.TRUE.equals(response.success())) {
            String error = response.error() == null ? "unknown error" : response.error();
            throw new RemoteSchedulerException("Remote scheduler rejected review: " + error);
        }
        if (response.data() == null || response.data().nextState() == null) {
            throw new RemoteSchedulerException("Remote scheduler response has no next state");
        }

        RemoteReviewResponse.NextState next = response.data().nextState();
        return new AuthoritativeState(
                next.stability(),
                next.difficulty(),
                CardPhase.fromWire(next.phase()),
                next.due()
        );
    }
}
