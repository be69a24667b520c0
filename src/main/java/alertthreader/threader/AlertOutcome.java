package alertthreader.threader;

import alertthreader.threader.message.AlertMessage;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 单条告警的处理结果
 */
@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertOutcome {
    @JsonProperty("group_key")
    private final String groupKey;
    @JsonProperty("thread_id")
    private final String threadId;
    private final String status;
    private final String alertname;
    private final String severity;
    private final boolean ok;
    private final String error;

    static AlertOutcome delivered(String groupKey, String threadId, AlertMessage message) {
        return AlertOutcome.builder()
                .groupKey(groupKey)
                .threadId(threadId)
                .status(message.getStatus().value())
                .alertname(message.getAlertName())
                .severity(message.getSeverity())
                .ok(true)
                .build();
    }

    static AlertOutcome failed(String groupKey, AlertEvent event, String error) {
        return AlertOutcome.builder()
                .groupKey(groupKey)
                .status(event.getStatus().value())
                .alertname(event.label("alertname"))
                .severity(event.label("severity"))
                .ok(false)
                .error(error)
                .build();
    }
}
