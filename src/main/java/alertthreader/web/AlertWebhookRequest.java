package alertthreader.web;

import alertthreader.threader.AlertEvent;
import alertthreader.threader.AlertStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Alertmanager webhook 请求体
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertWebhookRequest {
    /*
     *  "firing" 或 "resolved"
     * */
    private String status;
    private String receiver;
    private String groupKey;
    private List<Alert> alerts;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Alert {
        // 为空时使用批次状态
        private String status;
        private Map<String, String> labels;
        private Map<String, String> annotations;
        private String startsAt;
        private String endsAt;
    }

    /**
     * 转换为告警事件, 状态无法识别时抛出InvalidAlertBatchException
     */
    List<AlertEvent> toEvents(AlertStatus batchStatus) {
        if (alerts == null || alerts.isEmpty()) {
            return Collections.emptyList();
        }
        List<AlertEvent> events = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            if (alert == null) {
                throw new InvalidAlertBatchException("Alert entry must not be null");
            }
            events.add(AlertEvent.builder()
                    .labels(alert.getLabels())
                    .annotations(alert.getAnnotations())
                    .status(alert.getStatus() == null ? batchStatus : parseStatus(alert.getStatus()))
                    .startsAt(alert.getStartsAt())
                    .endsAt(alert.getEndsAt())
                    .build());
        }
        return events;
    }

    static AlertStatus parseStatus(String raw) {
        try {
            return AlertStatus.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidAlertBatchException(e.getMessage(), e);
        }
    }
}
