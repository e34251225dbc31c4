package app.sage.core.security;

import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves the learner a request acts for from its access token: the {@code user_id} claim, or the
 * subject when the issuer puts the id there.
 */
@Component
public class CurrentLearnerProvider {

    static final String LEARNER_CLAIM = "user_id";

    public UUID getLearnerId(Jwt jwt) {
        if (jwt == null) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated principal");
        }
        String raw = jwt.getClaimAsString(LEARNER_CLAIM);
        if (raw == null || raw.isBlank()) {
            raw = jwt.getSubject();
        }
        if (raw == null || raw.isBlank()) {
            throw new InvalidBearerTokenException("Token carries no learner id");
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidBearerTokenException("Learner id is not a UUID: " + raw);
        }
    }
}
