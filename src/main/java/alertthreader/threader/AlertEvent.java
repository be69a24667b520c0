package alertthreader.threader;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单条告警事件 - 创建后不可变
 */
@Getter
@ToString
public class AlertEvent {
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final AlertStatus status;
    private final String startsAt;   // RFC 3339, 原样保留
    private final String endsAt;

    @Builder
    public AlertEvent(Map<String, String> labels,
                      Map<String, String> annotations,
                      AlertStatus status,
                      String startsAt,
                      String endsAt) {
        this.labels = copyOf(labels);
        this.annotations = copyOf(annotations);
        this.status = status != null ? status : AlertStatus.FIRING;
        this.startsAt = startsAt;
        this.endsAt = endsAt;
    }

    public String label(String name) {
        return labels.get(name);
    }

    public String annotation(String name) {
        return annotations.get(name);
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
