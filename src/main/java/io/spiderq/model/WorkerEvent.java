package io.spiderq.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One record observed from a worker run. Typed fields cover what the engine acts on; {@code body}
 * keeps the full frame so listeners see everything the worker sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerEvent(
        WorkerEventType type,
        String level,
        String message,
        Integer current,
        Integer total,
        String title,
        Integer count,
        List<String> files,
        String code,
        Boolean valid,
        JsonNode userInfo,
        Boolean apiSuccess,
        String apiMessage,
        Integer exitCode,
        TaskStatus taskStatus,
        @JsonIgnore JsonNode body
) {
    public static final String CODE_STDERR = "STDERR";
    public static final String CODE_PROCESS_EXIT = "PROCESS_EXIT";
    public static final String ACCOUNT_ANOMALY_MESSAGE = "账号异常，请重新登录";
    private static final List<String> ACCOUNT_ANOMALY_MARKERS = List.of("账号异常", "检测到账号异常", "code=-1");

    public static WorkerEvent error(String message, String code) {
        return new WorkerEvent(WorkerEventType.ERROR, "ERROR", message, null, null, null, null, null, code,
                null, null, null, null, null, null, null);
    }

    public static WorkerEvent log(String level, String message) {
        return new WorkerEvent(WorkerEventType.LOG, level, message, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    public static WorkerEvent exit(int exitCode, TaskStatus taskStatus, String message) {
        return new WorkerEvent(WorkerEventType.EXIT, null, message, null, null, null, null, null, null,
                null, null, null, null, exitCode, taskStatus, null);
    }

    public boolean isTerminal() {
        return type == WorkerEventType.EXIT;
    }

    /**
     * A {@code done} frame whose upstream API call failed or whose API message flags the account.
     */
    @JsonIgnore
    public boolean isAccountAnomaly() {
        if (type != WorkerEventType.DONE) {
            return false;
        }
        if (Boolean.FALSE.equals(apiSuccess)) {
            return true;
        }
        return apiMessage != null && ACCOUNT_ANOMALY_MARKERS.stream().anyMatch(apiMessage::contains);
    }
}
