package alertthreader.threader;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 线程分组键生成 - 相同分组字段的告警落到同一个Slack线程
 *
 * <p>键的格式固定为 {@code alertname|severity|service|cluster|environment},
 * 字段顺序不能改变, 否则已持久化的线程映射全部失效.
 */
public final class GroupKeyDeriver {

    public static final String DELIMITER = "|";

    /**
     * 参与分组的标签及其缺省值, 按拼接顺序排列
     */
    static final List<Field> KEY_FIELDS = List.of(
            new Field("alertname", "unknown"),
            new Field("severity", "info"),
            new Field("service", "unknown"),
            new Field("cluster", "default")
    );

    private GroupKeyDeriver() {
    }

    public static String deriveKey(Map<String, String> labels, String environment) {
        Map<String, String> source = labels != null ? labels : Collections.emptyMap();
        StringJoiner joiner = new StringJoiner(DELIMITER);
        for (Field field : KEY_FIELDS) {
            joiner.add(field.valueIn(source));
        }
        joiner.add(StringUtils.defaultString(environment));
        return joiner.toString();
    }

    static final class Field {
        private final String label;
        private final String defaultValue;

        Field(String label, String defaultValue) {
            this.label = label;
            this.defaultValue = defaultValue;
        }

        String valueIn(Map<String, String> labels) {
            return StringUtils.defaultIfEmpty(labels.get(label), defaultValue);
        }
    }
}
