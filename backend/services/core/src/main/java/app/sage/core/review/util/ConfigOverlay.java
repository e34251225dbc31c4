package app.sage.core.review.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Lays a learner's settings overrides over the application defaults.
 *
 * <p>Objects are overlaid key by key. An explicit {@code null} in the overrides drops the key, so the
 * setting falls back to its built-in default. Arrays and scalars replace the default as a whole.
 */
@Component
public class ConfigOverlay {

    public ObjectNode apply(JsonNode defaults, JsonNode overrides) {
        ObjectNode out = defaults != null && defaults.isObject()
                ? ((ObjectNode) defaults).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        if (overrides == null || !overrides.isObject()) {
            return out;
        }
        overlay(out, (ObjectNode) overrides);
        return out;
    }

    private static void overlay(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> it = overrides.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            JsonNode value = e.getValue();
            if (value == null || value.isNull()) {
                target.remove(key);
            } else if (value.isObject() && target.path(key).isObject()) {
                overlay((ObjectNode) target.get(key), (ObjectNode) value);
            } else {
                target.set(key, value.deepCopy());
            }
        }
    }
}
