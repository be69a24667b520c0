package alertthreader.threader;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Redis后端 - 每条映射单独保存为 {prefix}:{GroupKey}, 不设置过期时间
 */
@Slf4j
public class RedisThreadStoreBackend implements ThreadStoreBackend {
    private static final long SCAN_BATCH_SIZE = 500;

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisThreadStoreBackend(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public String name() {
        return "redis";
    }

    /**
     * Redis只做连通性检查, 缓存在get时按需填充
     */
    @Override
    public Map<String, String> load() {
        try {
            String reply = ping();
            log.info("Redis connection initialized: {}", reply);
        } catch (RuntimeException e) {
            throw new ThreadStoreException("Redis is not reachable", e);
        }
        return Collections.emptyMap();
    }

    @Override
    public Optional<String> lookup(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key)));
        } catch (RuntimeException e) {
            throw new ThreadStoreException("Redis lookup failed: " + key, e);
        }
    }

    @Override
    public boolean writesSnapshot() {
        return false;
    }

    @Override
    public void write(Map<String, String> records) {
        for (Map.Entry<String, String> record : records.entrySet()) {
            try {
                redisTemplate.opsForValue().set(redisKey(record.getKey()), record.getValue());
                log.info("Saved thread to Redis: {} -> {}", record.getKey(), record.getValue());
            } catch (RuntimeException e) {
                throw new ThreadStoreException("Redis write failed: " + record.getKey(), e);
            }
        }
    }

    @Override
    public void clear() {
        ScanOptions options = ScanOptions.scanOptions()
                .match(keyPrefix + ":*")
                .count(SCAN_BATCH_SIZE)
                .build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            List<String> keys = new ArrayList<>();
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
            if (keys.isEmpty()) {
                return;
            }
            Long deleted = redisTemplate.delete(keys);
            log.info("Deleted {} thread keys from Redis", deleted);
        } catch (RuntimeException e) {
            throw new ThreadStoreException("Redis clear failed", e);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            return "PONG".equalsIgnoreCase(ping());
        } catch (RuntimeException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Map<String, String> serverInfo() {
        try {
            Properties info = redisTemplate.execute(
                    (RedisCallback<Properties>) connection -> connection.serverCommands().info("server"));
            Map<String, String> result = new TreeMap<>();
            if (info != null) {
                info.stringPropertyNames().forEach(name -> result.put(name, info.getProperty(name)));
            }
            return result;
        } catch (RuntimeException e) {
            throw new ThreadStoreException("Redis INFO failed", e);
        }
    }

    @Override
    public void shutdown() {
        RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
        if (connectionFactory instanceof DisposableBean) {
            try {
                ((DisposableBean) connectionFactory).destroy();
            } catch (Exception e) {
                log.error("Failed to close Redis connection factory", e);
            }
        }
    }

    String redisKey(String key) {
        return keyPrefix + ":" + key;
    }

    private String ping() {
        return redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
    }
}
