package alertthreader.threader;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 线程映射持久化后端 - GroupKey -> ThreadID
 */
public interface ThreadStoreBackend {
    /**
     * 后端名称, 用于健康检查和日志
     */
    String name();

    /**
     * 启动时加载已有映射, 后端不可用且无法降级时抛出ThreadStoreException
     */
    Map<String, String> load();

    /**
     * 缓存未命中时的查询, 不支持逐条查询的后端返回空
     */
    Optional<String> lookup(String key);

    /**
     * 为true时每次写入都需要完整快照
     */
    boolean writesSnapshot();

    /**
     * 持久化映射. 快照型后端收到完整映射, 其余后端只收到本次变更的记录
     */
    void write(Map<String, String> records);

    /**
     * 删除全部已持久化的映射
     */
    void clear();

    /**
     * 检查后端是否可达
     */
    boolean isReachable();

    /**
     * 后端服务信息
     */
    default Map<String, String> serverInfo() {
        return Collections.emptyMap();
    }

    /**
     * 关闭后端
     */
    void shutdown();
}
