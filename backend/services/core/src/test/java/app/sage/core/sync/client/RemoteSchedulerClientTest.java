package app.sage.core.sync.client;

import app.sage.core.review.api.PendingReview;
import app.sage.core.review.domain.AuthoritativeState;
import app.sage.core.review.domain.CardPhase;
import app.sage.core.review.domain.Rating;
import app.sage.core.sync.config.RemoteSchedulerProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteSchedulerClientTest {

    private static final Instant REVIEWED_AT = Instant.parse("2025-03-10T12:00:00Z");

    MockRestServiceServer server;
    RemoteSchedulerClient client;

    @BeforeEach
    void setup() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://scheduler.test");
        server = MockRestServiceServer.bindTo(builder).build();
        RemoteSchedulerProps props = new RemoteSchedulerProps(true, "http://scheduler.test", "internal-token",
                null, null, null, null, null, null);
        client = new RemoteSchedulerClient(builder.build(), props);
    }

    @Test
    void submitReview_returnsAuthoritativeState() {
        UUID cardId = UUID.randomUUID();
        server.expect(requestTo("http://scheduler.test/study/review"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer internal-token"))
                .andExpect(jsonPath("$.cardId").value(cardId.toString()))
                .andExpect(jsonPath("$.rating").value(3))
                .andExpect(jsonPath("$.reviewTimeMs").value(1500))
                .andRespond(withSuccess("""
                        {"success":true,"data":{"nextState":{"stability":3.2,"difficulty":5.1,
                        "state":"review","due":"2025-03-13T12:00:00Z","reps":1}}}
                        """, MediaType.APPLICATION_JSON));

        AuthoritativeState state = client.submitReview(
                new PendingReview(1L, UUID.randomUUID(), cardId, Rating.GOOD, 1500, REVIEWED_AT, 0));

        assertThat(state.stability()).isEqualTo(3.2);
        assertThat(state.difficulty()).isEqualTo(5.1);
        assertThat(state.phase()).isEqualTo(CardPhase.REVIEW);
        assertThat(state.due()).isEqualTo(Instant.parse("2025-03-13T12:00:00Z"));
        server.verify();
    }

    @Test
    void submitReview_unsuccessfulResponseThrows() {
        server.expect(requestTo("http://scheduler.test/study/review"))
                .andRespond(withSuccess("{\"success\":false,\"error\":\"card not found\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.submitReview(
                new PendingReview(2L, UUID.randomUUID(), UUID.randomUUID(), Rating.AGAIN, 0, REVIEWED_AT, 0)))
                .isInstanceOf(RemoteSchedulerException.class)
                .hasMessageContaining("card not found");
    }

    @Test
    void submitReview_serverErrorThrows() {
        server.expect(requestTo("http://scheduler.test/study/review"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.submitReview(
                new PendingReview(3L, UUID.randomUUID(), UUID.randomUUID(), Rating.HARD, 10, REVIEWED_AT, 0)))
                .isInstanceOf(RemoteSchedulerException.class);
    }

    @Test
    void submitReview_missingNextStateThrows() {
        server.expect(requestTo("http://scheduler.test/study/review"))
                .andRespond(withSuccess("{\"success\":true,\"data\":{}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.submitReview(
                new PendingReview(4L, UUID.randomUUID(), UUID.randomUUID(), Rating.EASY, 10, REVIEWED_AT, 0)))
                .isInstanceOf(RemoteSchedulerException.class)
                .hasMessageContaining("no next state");
    }
}
