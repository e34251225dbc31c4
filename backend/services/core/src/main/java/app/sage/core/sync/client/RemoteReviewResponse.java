package app.sage.core.sync.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteReviewResponse(
        Boolean success,
        Data data,
        String error
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(NextState nextState) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NextState(
            Double stability,
            Double difficulty,
            @JsonAlias("state") String phase,
            Instant due
    ) {
    }
}
