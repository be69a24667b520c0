package alertthreader.threader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 本地文件后端 - 整个映射保存为一个JSON对象, 先写临时文件再原子替换
 */
@Slf4j
public class FileThreadStoreBackend implements ThreadStoreBackend {
    static final String TEMP_SUFFIX = ".tmp";

    private final Path path;
    private final Path tempPath;
    private final ObjectMapper objectMapper;

    public FileThreadStoreBackend(Path path) {
        this.path = path.toAbsolutePath();
        this.tempPath = this.path.resolveSibling(this.path.getFileName() + TEMP_SUFFIX);
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String name() {
        return "file";
    }

    @Override
    public Map<String, String> load() {
        if (!Files.exists(path)) {
            log.info("Thread store file {} does not exist yet, starting with an empty cache", path);
            return Collections.emptyMap();
        }

        try {
            Map<String, String> threads = objectMapper.readValue(
                    path.toFile(),
                    new TypeReference<Map<String, String>>() {}
            );
            if (threads == null) {
                return Collections.emptyMap();
            }
            log.info("Loaded {} threads from {}", threads.size(), path);
            return threads;
        } catch (IOException e) {
            // 文件损坏不影响启动, 之后的第一次写入会覆盖它
            log.error("Failed to parse thread store file {}, starting with an empty cache", path, e);
            return Collections.emptyMap();
        }
    }

    @Override
    public Optional<String> lookup(String key) {
        return Optional.empty();
    }

    @Override
    public boolean writesSnapshot() {
        return true;
    }

    @Override
    public void write(Map<String, String> records) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            byte[] content = objectMapper.writeValueAsBytes(new TreeMap<>(records));
            try (FileChannel channel = FileChannel.open(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            moveIntoPlace();
            log.debug("Saved {} threads to {}", records.size(), path);
        } catch (IOException e) {
            throw new ThreadStoreException("Failed to save thread store file: " + path, e);
        }
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public void clear() {
        try {
            Files.deleteIfExists(tempPath);
            if (Files.deleteIfExists(path)) {
                log.info("Deleted thread store file {}", path);
            }
        } catch (IOException e) {
            throw new ThreadStoreException("Failed to delete thread store file: " + path, e);
        }
    }

    @Override
    public boolean isReachable() {
        return true;
    }

    @Override
    public void shutdown() {
        // 每次写入都已落盘
    }

    Path getPath() {
        return path;
    }
}
