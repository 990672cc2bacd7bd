package io.spiderq.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.spiderq.util.Jsons;

import java.util.Iterator;
import java.util.Map;

/**
 * What to run: a job kind ({@code notes}, {@code user}, {@code search}, ...), its parameters and the
 * execution config (credential, save options, output paths, proxy).
 */
public record JobDescription(
        String taskType,
        JsonNode params,
        JsonNode config
) {
    public static final String CREDENTIAL_FIELD = "cookie";

    public JobDescription {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType cannot be empty");
        }
        taskType = taskType.trim();
        if (params == null || params.isNull() || params.isMissingNode()) {
            params = Jsons.mapper().createObjectNode();
        }
        if (config == null || config.isNull() || config.isMissingNode()) {
            config = Jsons.mapper().createObjectNode();
        }
        if (!config.isObject()) {
            throw new IllegalArgumentException("config must be a JSON object");
        }
    }

    public static JobDescription fromJson(String raw) {
        JsonNode node = Jsons.readTree(raw);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Job description must be a JSON object");
        }
        return new JobDescription(node.path("taskType").asText(null), node.get("params"), node.get("config"));
    }

    /**
     * The credential from the config, or null when there is none.
     */
    public String credential() {
        JsonNode value = config.get(CREDENTIAL_FIELD);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Config recorded on the task row. The credential is never persisted with task history.
     */
    public ObjectNode configSnapshot() {
        ObjectNode copy = ((ObjectNode) config).deepCopy();
        copy.remove(CREDENTIAL_FIELD);
        return copy;
    }

    /**
     * The single argument handed to the worker: config fields flattened next to kind and params.
     */
    public ObjectNode workerArgument() {
        ObjectNode out = Jsons.mapper().createObjectNode();
        out.put("taskType", taskType);
        out.set("params", params);
        Iterator<Map.Entry<String, JsonNode>> fields = config.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!"taskType".equals(field.getKey()) && !"params".equals(field.getKey())) {
                out.set(field.getKey(), field.getValue());
            }
        }
        return out;
    }
}
