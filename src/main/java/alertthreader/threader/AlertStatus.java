package alertthreader.threader;

import java.util.Locale;

/**
 * 告警生命周期状态
 */
public enum AlertStatus {
    FIRING("firing"),
    RESOLVED("resolved");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 解析Alertmanager传入的状态值, 无法识别时抛出IllegalArgumentException
     */
    public static AlertStatus parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Alert status is missing");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AlertStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unsupported alert status: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
