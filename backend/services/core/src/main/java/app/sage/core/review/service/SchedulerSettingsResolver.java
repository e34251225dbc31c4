package app.sage.core.review.service;

import app.sage.core.config.SchedulerProps;
import app.sage.core.review.algorithm.SchedulerSettings;
import app.sage.core.review.util.ConfigOverlay;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Effective scheduler settings of a learner: the application defaults with the learner's overrides laid over them.
 */
@Component
public class SchedulerSettingsResolver {

    private final JsonNode defaults;
    private final ConfigOverlay overlay;

    public SchedulerSettingsResolver(SchedulerProps props, ObjectMapper objectMapper, ConfigOverlay overlay) {
        this.overlay = overlay;
        ObjectNode node = props == null ? objectMapper.createObjectNode() : objectMapper.valueToTree(props);
        List<String> unset = new ArrayList<>();
        node.fields().forEachRemaining(e -> {
            if (e.getValue().isNull()) unset.add(e.getKey());
        });
        node.remove(unset);
        this.defaults = node;
    }

    public JsonNode defaultsJson() {
        return defaults.deepCopy();
    }

    public SchedulerSettings resolve(JsonNode overrides) {
        return SchedulerSettings.from(overlay.apply(defaults, overrides));
    }
}
