package io.spiderq.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.spiderq.model.WorkerEvent;
import io.spiderq.model.WorkerEventType;
import io.spiderq.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses one worker output frame into a {@link WorkerEvent}.
 */
public final class WorkerEvents {
    private static final Logger log = LoggerFactory.getLogger(WorkerEvents.class);
    private static final List<String> COUNTER_FIELDS = List.of("current", "total", "count");

    private WorkerEvents() {
    }

    /**
     * @return the event, or empty when the frame is not a JSON object with a known {@code type}
     */
    public static Optional<WorkerEvent> parse(String frame) {
        JsonNode node;
        try {
            node = Jsons.readTree(frame);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping non-JSON worker output: {}", abbreviate(frame));
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("Dropping worker output that is not a JSON object: {}", abbreviate(frame));
            return Optional.empty();
        }
        Optional<WorkerEventType> type = WorkerEventType.fromWire(text(node, "type"));
        if (type.isEmpty()) {
            log.warn("Dropping worker output with unknown type '{}'", text(node, "type"));
            return Optional.empty();
        }
        for (String field : COUNTER_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isNumber() && !(value.isIntegralNumber() && value.canConvertToInt())) {
                log.warn("Dropping worker output with out-of-range {}: {}", field, abbreviate(frame));
                return Optional.empty();
            }
        }
        return Optional.of(new WorkerEvent(
                type.get(),
                text(node, "level"),
                text(node, "message"),
                integer(node, "current"),
                integer(node, "total"),
                text(node, "title"),
                integer(node, "count"),
                files(node),
                text(node, "code"),
                bool(node, "valid"),
                node.hasNonNull("userInfo") ? node.get("userInfo") : null,
                bool(node, "api_success"),
                text(node, "api_message"),
                null,
                null,
                node
        ));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.asInt();
    }

    private static Boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            return null;
        }
        return value.asBoolean();
    }

    private static List<String> files(JsonNode node) {
        JsonNode value = node.get("files");
        if (value == null || !value.isArray()) {
            return null;
        }
        List<String> out = new ArrayList<>();
        value.forEach(f -> out.add(f.asText()));
        return out;
    }

    static String abbreviate(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
