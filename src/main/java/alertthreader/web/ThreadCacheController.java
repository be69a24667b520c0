package alertthreader.web;

import alertthreader.config.ThreaderProperties;
import alertthreader.threader.ThreadStore;
import alertthreader.threader.ThreadStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运维接口: 缓存快照, 清空缓存, 健康检查, 统计
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ThreadCacheController {

    private final Instant startedAt = Instant.now();

    private final ThreadStore threadStore;
    private final ThreaderProperties properties;

    @GetMapping("/cache")
    public Map<String, Object> getCache() {
        Map<String, String> threads = threadStore.snapshot();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("cached_threads", threads.size());
        response.put("threads", threads);
        response.put("thread_store", threadStore.backendName());
        return response;
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        threadStore.clear();
        log.info("Thread cache cleared by operator request");
        return Collections.singletonMap("message", "Thread cache cleared");
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = new HealthStatus();
        health.setEnvironment(properties.getEnvironment());
        health.setChannel(properties.getSlackChannel());
        health.setThreadStore(threadStore.backendName());
        health.setCachedThreads(threadStore.size());

        boolean reachable = threadStore.isBackendReachable();
        if (ThreaderProperties.STORE_REDIS.equals(threadStore.backendName())) {
            health.setRedisStatus(reachable ? "connected" : "unreachable");
        }
        health.setStatus(reachable ? "healthy" : "unhealthy");
        return ResponseEntity
                .status(reachable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cached_threads", threadStore.size());
        stats.put("thread_store", threadStore.backendName());
        stats.put("environment", properties.getEnvironment());
        stats.put("started_at", startedAt.toString());
        stats.put("uptime_seconds", Duration.between(startedAt, Instant.now()).getSeconds());

        if (ThreaderProperties.STORE_REDIS.equals(threadStore.backendName())) {
            try {
                stats.put("redis", threadStore.backendInfo());
            } catch (ThreadStoreException e) {
                log.warn("Failed to read Redis server info: {}", e.getMessage());
                stats.put("redis_error", e.getMessage());
            }
        }
        return stats;
    }
}
