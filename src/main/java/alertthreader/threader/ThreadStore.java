package alertthreader.threader;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 线程映射存储 - 进程内读缓存 + 一个持久化后端
 *
 * <p>缓存由一把读写锁保护. 快照型后端的写入和缓存更新在同一把写锁内完成,
 * 保证同一时刻只有一个临时文件在替换正式文件. 逐条写入的后端在缓存锁外执行网络调用.
 *
 * <p>后端访问另有一把读写锁: 查询和写入共享持有, clear独占持有. clear开始前
 * 正在进行的查询和写入全部完成, clear之后不会有旧映射回到缓存或后端.
 */
@Slf4j
public class ThreadStore {

    private final ThreadStoreBackend backend;
    private final Map<String, String> cache = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock backendLock = new ReentrantReadWriteLock();

    public ThreadStore(ThreadStoreBackend backend) {
        this.backend = backend;
    }

    /**
     * 启动加载, 后端不可用时抛出ThreadStoreException
     */
    public void initialize() {
        Map<String, String> loaded = backend.load();
        lock.writeLock().lock();
        try {
            cache.clear();
            cache.putAll(loaded);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Thread store ready: backend={}, cached_threads={}", backend.name(), loaded.size());
    }

    /**
     * 查询线程ID. 后端查询失败时按"不存在"处理, 由调用方新建线程
     */
    public Optional<String> get(String key) {
        String cached;
        lock.readLock().lock();
        try {
            cached = cache.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (cached != null) {
            return Optional.of(cached);
        }

        backendLock.readLock().lock();
        try {
            Optional<String> remote;
            try {
                remote = backend.lookup(key);
            } catch (ThreadStoreException e) {
                log.error("Thread lookup failed for {}, treating it as a new thread", key, e);
                return Optional.empty();
            }
            if (remote.isEmpty()) {
                return Optional.empty();
            }

            lock.writeLock().lock();
            try {
                return Optional.of(cache.computeIfAbsent(key, k -> remote.get()));
            } finally {
                lock.writeLock().unlock();
            }
        } finally {
            backendLock.readLock().unlock();
        }
    }

    /**
     * 保存线程ID. 缓存总是先更新; 持久化失败时抛出ThreadStoreException, 缓存保留新值
     */
    public void set(String key, String threadId) {
        Validate.notBlank(key, "key must not be blank");
        Validate.notBlank(threadId, "threadId must not be blank");

        backendLock.readLock().lock();
        try {
            lock.writeLock().lock();
            try {
                String existing = cache.get(key);
                if (existing != null && !existing.equals(threadId)) {
                    log.warn("Thread {} already mapped to {}, ignoring {}", key, existing, threadId);
                    return;
                }
                cache.put(key, threadId);
                if (backend.writesSnapshot()) {
                    backend.write(new HashMap<>(cache));
                    return;
                }
            } finally {
                lock.writeLock().unlock();
            }
            backend.write(Collections.singletonMap(key, threadId));
        } finally {
            backendLock.readLock().unlock();
        }
    }

    /**
     * 清空缓存和后端
     */
    public void clear() {
        backendLock.writeLock().lock();
        try {
            lock.writeLock().lock();
            try {
                int size = cache.size();
                cache.clear();
                backend.clear();
                log.info("Thread store cleared: {} cached threads dropped", size);
            } finally {
                lock.writeLock().unlock();
            }
        } finally {
            backendLock.writeLock().unlock();
        }
    }

    public Map<String, String> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(cache));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String backendName() {
        return backend.name();
    }

    public boolean isBackendReachable() {
        return backend.isReachable();
    }

    public Map<String, String> backendInfo() {
        return backend.serverInfo();
    }

    public void shutdown() {
        backend.shutdown();
    }
}
