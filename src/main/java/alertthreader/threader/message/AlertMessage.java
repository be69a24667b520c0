package alertthreader.threader.message;

import alertthreader.threader.AlertEvent;
import alertthreader.threader.AlertStatus;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * 告警消息内容 - 与展示格式无关的结构化数据
 */
@Getter
@Builder
public class AlertMessage {
    private final String alertName;
    private final String severity;
    private final String summary;
    private final String description;
    private final String runbookUrl;
    private final String service;
    private final String cluster;
    private final String instance;
    private final String job;
    private final String startsAt;
    private final String endsAt;
    private final AlertStatus status;
    private final String environment;

    public static AlertMessage from(AlertEvent event, String environment) {
        String alertName = StringUtils.defaultIfEmpty(event.label("alertname"), "Unknown");
        return AlertMessage.builder()
                .alertName(alertName)
                .severity(StringUtils.defaultIfEmpty(event.label("severity"), "info"))
                .summary(StringUtils.defaultIfEmpty(event.annotation("summary"), alertName))
                .description(event.annotation("description"))
                .runbookUrl(event.annotation("runbook_url"))
                .service(event.label("service"))
                .cluster(event.label("cluster"))
                .instance(event.label("instance"))
                .job(event.label("job"))
                .startsAt(event.getStartsAt())
                .endsAt(event.getEndsAt())
                .status(event.getStatus())
                .environment(environment)
                .build();
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }
}
