package alertthreader.threader;

import alertthreader.threader.message.AlertMessage;
import alertthreader.threader.message.AlertMessageFormatter;
import alertthreader.threader.message.ChatMessage;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;

/**
 * 告警线程路由 - 生成分组键, 查询线程, 发送新消息或回复, 记录新线程
 *
 * <p>同一批次的告警并行处理, 单条失败不影响其他告警. 同一分组键的
 * "查询-创建"过程持有分段锁, 并发的首次告警只会创建一个线程.
 */
@Slf4j
public class ThreadRouter {
    private static final int KEY_LOCK_STRIPES = 64;

    private final ThreadStore threadStore;
    private final NotificationDispatcher dispatcher;
    private final AlertMessageFormatter formatter;
    private final String environment;
    private final ExecutorService workerPool;
    private final Striped<Lock> keyLocks = Striped.lock(KEY_LOCK_STRIPES);

    public ThreadRouter(ThreadStore threadStore,
                        NotificationDispatcher dispatcher,
                        AlertMessageFormatter formatter,
                        String environment,
                        ExecutorService workerPool) {
        this.threadStore = threadStore;
        this.dispatcher = dispatcher;
        this.formatter = formatter;
        this.environment = environment;
        this.workerPool = workerPool;
    }

    /**
     * 处理一个批次, 按输入顺序返回每条告警的结果
     */
    public List<AlertOutcome> route(List<AlertEvent> events) {
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        if (workerPool.isShutdown()) {
            throw new IllegalStateException("Thread router is shutting down");
        }

        // 已提交的任务不会因为请求方断开而取消, 保证存储与实际发送一致
        List<CompletableFuture<AlertOutcome>> futures = new ArrayList<>(events.size());
        for (AlertEvent event : events) {
            futures.add(submit(event));
        }

        List<AlertOutcome> outcomes = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            outcomes.add(awaitOutcome(futures.get(i), events.get(i)));
        }
        return outcomes;
    }

    /**
     * 线程池拒绝任务时 (关闭中) 直接返回失败结果, 不留下永远不会完成的future
     */
    private CompletableFuture<AlertOutcome> submit(AlertEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> routeOne(event), workerPool);
        } catch (RejectedExecutionException e) {
            String key = GroupKeyDeriver.deriveKey(event.getLabels(), environment);
            log.error("Worker pool rejected alert {}: {}", key, e.getMessage());
            return CompletableFuture.completedFuture(
                    AlertOutcome.failed(key, event, "Worker pool rejected the alert"));
        }
    }

    AlertOutcome routeOne(AlertEvent event) {
        String key = GroupKeyDeriver.deriveKey(event.getLabels(), environment);
        Lock lock = keyLocks.get(key);
        lock.lock();
        try {
            return deliver(key, event);
        } catch (RuntimeException e) {
            log.error("Failed to process alert {}", key, e);
            return AlertOutcome.failed(key, event, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private AlertOutcome deliver(String key, AlertEvent event) {
        Optional<String> existing = threadStore.get(key);
        AlertMessage message = AlertMessage.from(event, environment);
        ChatMessage chatMessage = formatter.format(message);

        if (existing.isPresent()) {
            String threadId = existing.get();
            try {
                dispatcher.post(chatMessage, threadId);
            } catch (DispatchException e) {
                log.error("Failed to reply in thread {} for {}: {}", threadId, key, e.getMessage());
                return AlertOutcome.failed(key, event, e.getMessage());
            }
            log.info("Replied in thread: {} -> {}", key, threadId);
            return AlertOutcome.delivered(key, threadId, message);
        }

        String threadId;
        try {
            threadId = dispatcher.post(chatMessage, null);
            if (StringUtils.isBlank(threadId)) {
                throw new DispatchException("Dispatcher returned no thread id");
            }
        } catch (DispatchException e) {
            log.error("Failed to create thread for {}: {}", key, e.getMessage());
            return AlertOutcome.failed(key, event, e.getMessage());
        }

        record(key, threadId);
        log.info("Created new thread: {} -> {}", key, threadId);
        return AlertOutcome.delivered(key, threadId, message);
    }

    /**
     * 消息已经发出, 持久化失败只记录日志, 缓存中仍保留映射
     */
    private void record(String key, String threadId) {
        try {
            threadStore.set(key, threadId);
        } catch (ThreadStoreException e) {
            log.error("Failed to persist thread {} -> {}, kept in memory only", key, threadId, e);
        }
    }

    private AlertOutcome awaitOutcome(CompletableFuture<AlertOutcome> future, AlertEvent event) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AlertOutcome.failed(GroupKeyDeriver.deriveKey(event.getLabels(), environment),
                    event, "Interrupted while waiting for delivery");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Alert processing failed", cause);
            return AlertOutcome.failed(GroupKeyDeriver.deriveKey(event.getLabels(), environment),
                    event, cause.getMessage());
        }
    }
}
