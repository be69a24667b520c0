package alertthreader.config;

import alertthreader.slack.SlackNotificationDispatcher;
import alertthreader.threader.FileThreadStoreBackend;
import alertthreader.threader.NotificationDispatcher;
import alertthreader.threader.RedisThreadStoreBackend;
import alertthreader.threader.ThreadRouter;
import alertthreader.threader.ThreadStore;
import alertthreader.threader.ThreadStoreBackend;
import alertthreader.threader.message.AlertMessageFormatter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class ThreaderConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ThreadStore threadStore(ThreaderProperties properties) {
        ThreadStoreBackend backend = ThreaderProperties.STORE_REDIS.equals(properties.getStoreType())
                ? createRedisBackend(properties)
                : new FileThreadStoreBackend(Paths.get(properties.getStoreFile()));

        ThreadStore threadStore = new ThreadStore(backend);
        try {
            threadStore.initialize();
        } catch (RuntimeException e) {
            log.error("Thread store initialization failed, refusing to start", e);
            backend.shutdown();
            throw e;
        }
        log.info("Store: {}, environment: {}, channel: {}",
                backend.name(), properties.getEnvironment(), properties.getSlackChannel());
        return threadStore;
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(ThreaderProperties properties) {
        return new SlackNotificationDispatcher(
                properties.getSlackApiUrl(),
                properties.getSlackBotToken(),
                properties.getSlackChannel()
        );
    }

    @Bean
    public AlertMessageFormatter alertMessageFormatter() {
        return new AlertMessageFormatter();
    }

    /**
     * 告警处理线程池, 关闭时等待已提交的发送任务完成
     *
     * <p>线程数先增长到core-size, 之后任务进入队列; 队列满后才继续创建线程直到max-size,
     * 再满时由提交线程自己执行.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService threaderWorkerPool(ThreaderProperties properties) {
        return new ThreadPoolExecutor(
                properties.getWorkerCoreSize(),
                properties.getWorkerMaxSize(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(properties.getWorkerQueueCapacity()),
                new ThreadFactoryBuilder()
                        .setNameFormat("threader-worker-%d")
                        .build(),
                callerRunsUnlessShutdown()
        );
    }

    /**
     * 与CallerRunsPolicy相同, 但线程池关闭后抛出异常而不是静默丢弃任务
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Worker pool is shut down");
            }
            task.run();
        };
    }

    @Bean
    public ThreadRouter threadRouter(ThreadStore threadStore,
                                     NotificationDispatcher notificationDispatcher,
                                     AlertMessageFormatter alertMessageFormatter,
                                     ExecutorService threaderWorkerPool,
                                     ThreaderProperties properties) {
        return new ThreadRouter(
                threadStore,
                notificationDispatcher,
                alertMessageFormatter,
                properties.getEnvironment(),
                threaderWorkerPool
        );
    }

    /**
     * 根据 REDIS_URL 创建连接, 所有命令都有超时限制
     */
    private RedisThreadStoreBackend createRedisBackend(ThreaderProperties properties) {
        RedisURI uri = parseRedisUrl(properties.getRedisUrl());
        Duration timeout = Duration.ofSeconds(properties.getRedisTimeoutSeconds());

        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(
                standaloneConfiguration(uri), lettuceClientConfiguration(uri, timeout));
        connectionFactory.afterPropertiesSet();

        StringRedisTemplate redisTemplate = new StringRedisTemplate(connectionFactory);
        return new RedisThreadStoreBackend(redisTemplate, properties.getRedisKeyPrefix());
    }

    static RedisURI parseRedisUrl(String redisUrl) {
        try {
            return RedisURI.create(redisUrl);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid REDIS_URL: " + redisUrl, e);
        }
    }

    static RedisStandaloneConfiguration standaloneConfiguration(RedisURI uri) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        standalone.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            standalone.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null) {
            standalone.setPassword(RedisPassword.of(uri.getPassword()));
        }
        return standalone;
    }

    /**
     * 命令超时和连接超时使用同一个值
     */
    static LettuceClientConfiguration lettuceClientConfiguration(RedisURI uri, Duration timeout) {
        LettuceClientConfiguration.LettuceClientConfigurationBuilder clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(timeout)
                .clientOptions(ClientOptions.builder()
                        .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                        .build());
        if (uri.isSsl()) {
            clientConfig.useSsl();
        }
        return clientConfig.build();
    }
}
