package alertthreader.config;

import alertthreader.threader.ThreadStore;
import io.lettuce.core.RedisURI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreaderConfigurationTest {

    @TempDir
    Path tempDir;

    private final ThreaderConfiguration configuration = new ThreaderConfiguration();

    private ThreaderProperties properties() {
        var properties = new ThreaderProperties();
        properties.setSlackBotToken("xoxb-test");
        properties.setSlackChannel("#alerts");
        properties.setEnvironment("prod");
        properties.setStoreType(ThreaderProperties.STORE_FILE);
        properties.setStoreFile(tempDir.resolve("threads.json").toString());
        properties.setRedisTimeoutSeconds(3);
        properties.setWorkerCoreSize(2);
        properties.setWorkerMaxSize(4);
        properties.setWorkerQueueCapacity(10);
        return properties;
    }

    @Test
    void redis_client_uses_configured_timeout_for_commands_and_connect() {
        var uri = ThreaderConfiguration.parseRedisUrl("redis://localhost:6379/0");

        var clientConfig = ThreaderConfiguration.lettuceClientConfiguration(uri, Duration.ofSeconds(3));

        assertThat(clientConfig.getCommandTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(clientConfig.getClientOptions()).isPresent();
        assertThat(clientConfig.getClientOptions().get().getSocketOptions().getConnectTimeout())
                .isEqualTo(Duration.ofSeconds(3));
        assertThat(clientConfig.isUseSsl()).isFalse();
    }

    @Test
    void rediss_url_enables_tls() {
        var uri = ThreaderConfiguration.parseRedisUrl("rediss://cache.internal:6380/0");

        assertThat(ThreaderConfiguration.lettuceClientConfiguration(uri, Duration.ofSeconds(1)).isUseSsl()).isTrue();
    }

    @Test
    void redis_url_parts_are_applied_to_connection() {
        RedisURI uri = ThreaderConfiguration.parseRedisUrl("redis://:secret@cache.internal:6380/2");

        var standalone = ThreaderConfiguration.standaloneConfiguration(uri);

        assertThat(standalone.getHostName()).isEqualTo("cache.internal");
        assertThat(standalone.getPort()).isEqualTo(6380);
        assertThat(standalone.getDatabase()).isEqualTo(2);
        assertThat(standalone.getPassword().get()).containsExactly('s', 'e', 'c', 'r', 'e', 't');
    }

    @Test
    void malformed_redis_url_is_rejected() {
        assertThatThrownBy(() -> ThreaderConfiguration.parseRedisUrl("http://localhost:6379"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid REDIS_URL");
        assertThatThrownBy(() -> ThreaderConfiguration.parseRedisUrl("not a url"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid REDIS_URL");
    }

    @Test
    void redis_store_with_malformed_url_fails_startup() {
        var properties = properties();
        properties.setStoreType(ThreaderProperties.STORE_REDIS);
        properties.setRedisUrl("not a url");
        properties.setRedisKeyPrefix("threader:ts");

        assertThatThrownBy(() -> configuration.threadStore(properties))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void file_store_is_initialized_from_configured_path() {
        ThreadStore store = configuration.threadStore(properties());
        try {
            assertThat(store.backendName()).isEqualTo("file");
            assertThat(store.size()).isZero();
        } finally {
            store.shutdown();
        }
    }

    @Test
    void worker_pool_uses_configured_sizes() {
        var pool = (ThreadPoolExecutor) configuration.threaderWorkerPool(properties());
        try {
            assertThat(pool.getCorePoolSize()).isEqualTo(2);
            assertThat(pool.getMaximumPoolSize()).isEqualTo(4);
            assertThat(pool.getQueue().remainingCapacity()).isEqualTo(10);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void saturated_pool_runs_task_on_caller() {
        var pool = (ThreadPoolExecutor) configuration.threaderWorkerPool(properties());
        try {
            var ranOn = new AtomicReference<Thread>();

            ThreaderConfiguration.callerRunsUnlessShutdown()
                    .rejectedExecution(() -> ranOn.set(Thread.currentThread()), pool);

            assertThat(ranOn.get()).isSameAs(Thread.currentThread());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shut_down_pool_rejects_instead_of_dropping() {
        var pool = configuration.threaderWorkerPool(properties());
        pool.shutdown();

        assertThatThrownBy(() -> pool.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);
    }
}
