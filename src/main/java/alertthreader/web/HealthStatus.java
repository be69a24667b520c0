package alertthreader.web;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

/**
 * 健康检查状态类
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthStatus {
    private String status;  // healthy, unhealthy
    private String environment;
    private String channel;
    @JsonProperty("thread_store")
    private String threadStore;
    @JsonProperty("cached_threads")
    private int cachedThreads;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;
    @JsonProperty("redis_status")
    private String redisStatus;

    public HealthStatus() {
        this.timestamp = Instant.now();
    }
}
