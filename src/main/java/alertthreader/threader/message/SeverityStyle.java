package alertthreader.threader.message;

import java.util.Locale;

/**
 * 告警级别对应的颜色和表情
 */
public enum SeverityStyle {
    CRITICAL("#E01E5A", "🚨"),
    WARNING("#ECB22E", "⚠️"),
    INFO("#2EB67D", "ℹ️"),
    ERROR("#E01E5A", "❌"),
    SUCCESS("#2EB67D", "✅"),
    DEBUG("#36C5F0", "🐛");

    static final String DEFAULT_COLOR = "#2EB67D";
    static final String DEFAULT_EMOJI = "📢";

    private final String color;
    private final String emoji;

    SeverityStyle(String color, String emoji) {
        this.color = color;
        this.emoji = emoji;
    }

    public static String colorOf(String severity) {
        SeverityStyle style = find(severity);
        return style != null ? style.color : DEFAULT_COLOR;
    }

    public static String emojiOf(String severity) {
        SeverityStyle style = find(severity);
        return style != null ? style.emoji : DEFAULT_EMOJI;
    }

    private static SeverityStyle find(String severity) {
        if (severity == null) {
            return null;
        }
        String name = severity.trim().toUpperCase(Locale.ROOT);
        for (SeverityStyle style : values()) {
            if (style.name().equals(name)) {
                return style;
            }
        }
        return null;
    }
}
