package alertthreader.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 运行配置, 每一项都可以通过环境变量覆盖 (见 application.yml)
 */
@Getter
@Setter
@Component
public class ThreaderProperties {

    public static final String STORE_FILE = "file";
    public static final String STORE_REDIS = "redis";

    @Value("${threader.slack.bot-token}")
    private String slackBotToken;

    @Value("${threader.slack.channel}")
    private String slackChannel;

    @Value("${threader.slack.api-url}")
    private String slackApiUrl;

    @Value("${threader.environment}")
    private String environment;

    @Value("${threader.store.type}")
    private String storeType;

    @Value("${threader.store.file}")
    private String storeFile;

    @Value("${threader.store.redis-url}")
    private String redisUrl;

    @Value("${threader.store.redis-key-prefix}")
    private String redisKeyPrefix;

    @Value("${threader.store.redis-timeout-seconds:3}")
    private int redisTimeoutSeconds;

    @Value("${threader.worker.core-size:4}")
    private int workerCoreSize;

    @Value("${threader.worker.max-size:16}")
    private int workerMaxSize;

    @Value("${threader.worker.queue-capacity:1000}")
    private int workerQueueCapacity;

    /**
     * 校验必需配置, 缺失时应用不能启动
     */
    @PostConstruct
    public void validate() {
        validateRequired(slackBotToken, "SLACK_BOT_TOKEN is required");
        validateRequired(slackChannel, "SLACK_CHANNEL is required");
        validateRequired(environment, "ENVIRONMENT must not be empty");
        if (!STORE_FILE.equals(storeType) && !STORE_REDIS.equals(storeType)) {
            throw new IllegalArgumentException("THREAD_STORE must be 'file' or 'redis', got: " + storeType);
        }
        if (STORE_FILE.equals(storeType)) {
            validateRequired(storeFile, "THREAD_STORE_FILE is required for the file store");
        } else {
            validateRequired(redisUrl, "REDIS_URL is required for the redis store");
            validateRequired(redisKeyPrefix, "REDIS_KEY_PREFIX must not be empty");
        }
        if (redisTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("threader.store.redis-timeout-seconds must be positive");
        }
        if (workerCoreSize <= 0 || workerQueueCapacity <= 0) {
            throw new IllegalArgumentException("threader.worker.core-size and queue-capacity must be positive");
        }
        // 超过core-size的线程只在队列满后创建
        if (workerMaxSize < workerCoreSize) {
            throw new IllegalArgumentException("threader.worker.max-size must not be smaller than core-size");
        }
    }

    private void validateRequired(String value, String message) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(message);
        }
    }
}
