package app.sage.core.review.algorithm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerSettingsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void defaults_matchDocumentedPolicy() {
        SchedulerSettings s = SchedulerSettings.defaults();

        assertThat(s.requestRetention()).isEqualTo(0.9);
        assertThat(s.maximumIntervalDays()).isEqualTo(365.0);
        assertThat(s.graduatingIntervalDays()).isEqualTo(1.0);
        assertThat(s.easyIntervalDays()).isEqualTo(4.0);
        assertThat(s.minimumIntervalMinutes()).isEqualTo(1);
        assertThat(s.learningStepsMinutes()).containsExactly(1, 10);
        assertThat(s.relearningStepsMinutes()).containsExactly(10);
        assertThat(s.masteryStabilityDays()).isEqualTo(21.0);
        assertThat(s.weights()).hasSize(SchedulerSettings.WEIGHT_COUNT);
    }

    @Test
    void from_clampsOutOfRangeValues() {
        ObjectNode cfg = MAPPER.createObjectNode();
        cfg.put("requestRetention", 1.5);
        cfg.put("maximumIntervalDays", 100);
        cfg.put("graduatingIntervalDays", 0);
        cfg.put("easyIntervalDays", 500);
        cfg.put("minimumIntervalMinutes", -4);

        SchedulerSettings s = SchedulerSettings.from(cfg);

        assertThat(s.requestRetention()).isEqualTo(0.99);
        assertThat(s.maximumIntervalDays()).isEqualTo(100.0);
        assertThat(s.graduatingIntervalDays()).isEqualTo(1.0);
        assertThat(s.easyIntervalDays()).isEqualTo(100.0);
        assertThat(s.minimumIntervalMinutes()).isEqualTo(1);
    }

    @Test
    void from_ignoresNonNumericFieldsAndInvalidSteps() {
        ObjectNode cfg = MAPPER.createObjectNode();
        cfg.put("requestRetention", "high");
        cfg.putArray("learningStepsMinutes").add(5).add(-1).add("x").add(30);
        cfg.putNull("relearningStepsMinutes");

        SchedulerSettings s = SchedulerSettings.from(cfg);

        assertThat(s.requestRetention()).isEqualTo(0.9);
        assertThat(s.learningStepsMinutes()).containsExactly(5, 30);
        assertThat(s.relearningStepsMinutes()).containsExactly(10);
    }

    @Test
    void from_overridesIndividualWeights() {
        ObjectNode cfg = MAPPER.createObjectNode();
        cfg.putArray("weights").add(0.5).addNull().add(3.0);

        SchedulerSettings s = SchedulerSettings.from(cfg);
        SchedulerSettings d = SchedulerSettings.defaults();

        assertThat(s.w(0)).isEqualTo(0.5);
        assertThat(s.w(1)).isEqualTo(d.w(1));
        assertThat(s.w(2)).isEqualTo(3.0);
        assertThat(s.w(20)).isEqualTo(d.w(20));
    }
}
