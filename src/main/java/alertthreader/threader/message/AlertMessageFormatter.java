package alertthreader.threader.message;

import org.apache.commons.lang3.StringUtils;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Slack消息格式化
 */
public class AlertMessageFormatter {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    public ChatMessage format(AlertMessage message) {
        return new ChatMessage(
                formatText(message),
                buildBlocks(message),
                buildAttachments(message)
        );
    }

    /**
     * 通知和不支持Block Kit的客户端使用的纯文本
     */
    String formatText(AlertMessage message) {
        if (message.isResolved()) {
            return String.format("[%s] ✅ RESOLVED: %s", message.getEnvironment(), message.getSummary());
        }
        return String.format("[%s] %s: %s",
                message.getEnvironment(), upper(message.getSeverity()), message.getSummary());
    }

    List<Map<String, Object>> buildBlocks(AlertMessage message) {
        List<Map<String, Object>> blocks = new ArrayList<>();

        String headerText = message.isResolved()
                ? "✅ RESOLVED — " + message.getSummary()
                : SeverityStyle.emojiOf(message.getSeverity()) + " " + message.getSummary();
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("type", "header");
        header.put("text", textObject("plain_text", headerText, true));
        blocks.add(header);

        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(markdown(String.format("*Severity:*\n`%s`", upper(message.getSeverity()))));
        fields.add(markdown(String.format("*Environment:*\n`%s`", message.getEnvironment())));
        fields.add(markdown(String.format("*Service:*\n`%s`",
                StringUtils.defaultIfEmpty(message.getService(), "unknown"))));
        fields.add(markdown(String.format("*Cluster:*\n`%s`",
                StringUtils.defaultIfEmpty(message.getCluster(), "default"))));
        if (StringUtils.isNotEmpty(message.getInstance())) {
            fields.add(markdown(String.format("*Instance:*\n`%s`", message.getInstance())));
        }
        Map<String, Object> fieldSection = new LinkedHashMap<>();
        fieldSection.put("type", "section");
        fieldSection.put("fields", fields);
        blocks.add(fieldSection);

        if (StringUtils.isNotEmpty(message.getDescription())) {
            blocks.add(section("*Description:*\n" + message.getDescription()));
        }
        if (StringUtils.isNotEmpty(message.getRunbookUrl())) {
            blocks.add(section(String.format("*Runbook:* <%s|View Runbook>", message.getRunbookUrl())));
        }

        List<String> timeInfo = new ArrayList<>();
        if (StringUtils.isNotEmpty(message.getStartsAt())) {
            timeInfo.add("Started: " + formatTimestamp(message.getStartsAt()));
        }
        if (message.isResolved() && StringUtils.isNotEmpty(message.getEndsAt())) {
            timeInfo.add("Resolved: " + formatTimestamp(message.getEndsAt()));
        }
        if (!timeInfo.isEmpty()) {
            blocks.add(context(String.join(" | ", timeInfo)));
        }

        blocks.add(context(String.format("`env=%s` | `alertname=%s`",
                message.getEnvironment(), message.getAlertName())));
        return blocks;
    }

    List<Map<String, Object>> buildAttachments(AlertMessage message) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", SeverityStyle.colorOf(message.getSeverity()));
        attachment.put("fallback", String.format("[%s] %s", message.getEnvironment(), message.getAlertName()));

        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(shortField("Severity", upper(message.getSeverity())));
        fields.add(shortField("Environment", message.getEnvironment()));
        addIfPresent(fields, "Service", message.getService());
        addIfPresent(fields, "Cluster", message.getCluster());
        addIfPresent(fields, "Instance", message.getInstance());
        addIfPresent(fields, "Job", message.getJob());
        attachment.put("fields", fields);

        if (StringUtils.isNotEmpty(message.getDescription())) {
            attachment.put("text", message.getDescription());
        }
        OffsetDateTime startedAt = parseTimestamp(message.getStartsAt());
        if (startedAt != null) {
            attachment.put("ts", startedAt.toEpochSecond());
        }

        List<Map<String, Object>> attachments = new ArrayList<>();
        attachments.add(attachment);
        return attachments;
    }

    /**
     * RFC 3339 转为 "yyyy-MM-dd HH:mm:ss UTC", 无法解析时原样返回
     */
    static String formatTimestamp(String timestamp) {
        if (StringUtils.isEmpty(timestamp)) {
            return "";
        }
        OffsetDateTime parsed = parseTimestamp(timestamp);
        if (parsed == null) {
            return timestamp;
        }
        return parsed.withOffsetSameInstant(ZoneOffset.UTC).format(DISPLAY_FORMAT);
    }

    private static OffsetDateTime parseTimestamp(String timestamp) {
        if (StringUtils.isEmpty(timestamp)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(timestamp, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String upper(String value) {
        return value == null ? "" : value.toUpperCase(Locale.ROOT);
    }

    private static Map<String, Object> textObject(String type, String text, boolean emoji) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("type", type);
        object.put("text", text);
        if (emoji) {
            object.put("emoji", true);
        }
        return object;
    }

    private static Map<String, Object> markdown(String text) {
        return textObject("mrkdwn", text, false);
    }

    private static Map<String, Object> section(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "section");
        block.put("text", markdown(text));
        return block;
    }

    private static Map<String, Object> context(String text) {
        List<Map<String, Object>> elements = new ArrayList<>();
        elements.add(markdown(text));
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "context");
        block.put("elements", elements);
        return block;
    }

    private static Map<String, Object> shortField(String title, String value) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
        return field;
    }

    private static void addIfPresent(List<Map<String, Object>> fields, String title, String value) {
        if (StringUtils.isNotEmpty(value)) {
            fields.add(shortField(title, value));
        }
    }
}
