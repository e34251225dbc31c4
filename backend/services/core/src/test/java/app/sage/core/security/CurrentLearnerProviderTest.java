package app.sage.core.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CurrentLearnerProviderTest {

    private final CurrentLearnerProvider provider = new CurrentLearnerProvider();

    @Test
    void prefersLearnerClaimOverSubject() {
        UUID learnerId = UUID.randomUUID();
        Jwt jwt = token().claim("user_id", learnerId.toString()).subject("someone@example.com").build();

        assertThat(provider.getLearnerId(jwt)).isEqualTo(learnerId);
    }

    @Test
    void fallsBackToUuidSubject() {
        UUID learnerId = UUID.randomUUID();
        Jwt jwt = token().subject(learnerId.toString()).build();

        assertThat(provider.getLearnerId(jwt)).isEqualTo(learnerId);
    }

    @Test
    void rejectsTokenWithoutUsableId() {
        Jwt jwt = token().subject("someone@example.com").build();

        assertThatThrownBy(() -> provider.getLearnerId(jwt))
                .isInstanceOf(InvalidBearerTokenException.class);
    }

    private static Jwt.Builder token() {
        return Jwt.withTokenValue("token").header("alg", "none");
    }
}
