package alertthreader.threader;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadStoreTest {

    @TempDir
    Path tempDir;

    private InMemoryBackend backend;
    private ThreadStore store;

    @BeforeEach
    void setUp() {
        backend = new InMemoryBackend();
        store = new ThreadStore(backend);
        store.initialize();
    }

    @Test
    void set_then_get_returns_thread_id() {
        store.set("DiskFull|critical|unknown|default|prod", "1700000000.000100");

        assertThat(store.get("DiskFull|critical|unknown|default|prod")).contains("1700000000.000100");
        assertThat(backend.remote).containsEntry("DiskFull|critical|unknown|default|prod", "1700000000.000100");
    }

    @Test
    void get_reads_through_backend_and_caches_found_value() {
        backend.remote.put("k", "111.222");

        assertThat(store.get("k")).contains("111.222");
        assertThat(store.get("k")).contains("111.222");
        assertThat(backend.lookups.get()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void get_of_unknown_key_is_empty_and_not_cached() {
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void get_treats_backend_failure_as_absent() {
        backend.remote.put("k", "111.222");
        backend.failLookups = true;

        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void failed_write_keeps_value_in_cache() {
        backend.failWrites = true;

        assertThatThrownBy(() -> store.set("k", "111.222"))
                .isInstanceOf(ThreadStoreException.class);
        assertThat(store.get("k")).contains("111.222");
        assertThat(backend.lookups.get()).isZero();
    }

    @Test
    void existing_thread_id_is_never_replaced() {
        store.set("k", "first");
        store.set("k", "second");

        assertThat(store.get("k")).contains("first");
        assertThat(backend.remote).containsEntry("k", "first");
        assertThat(backend.writes.get()).isEqualTo(1);
    }

    @Test
    void setting_same_thread_id_again_is_harmless() {
        store.set("k", "first");
        store.set("k", "first");

        assertThat(store.get("k")).contains("first");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void clear_removes_cache_and_backend_entries() {
        store.set("a", "1");
        store.set("b", "2");

        store.clear();

        assertThat(store.get("a")).isEmpty();
        assertThat(store.get("b")).isEmpty();
        assertThat(store.size()).isZero();
        assertThat(backend.remote).isEmpty();
    }

    @Test
    void snapshot_is_an_immutable_copy() {
        store.set("a", "1");

        var snapshot = store.snapshot();
        store.set("b", "2");

        assertThat(snapshot).containsOnlyKeys("a");
        assertThatThrownBy(() -> snapshot.put("c", "3"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void blank_values_are_rejected() {
        assertThatThrownBy(() -> store.set("k", " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void concurrent_writes_to_file_backend_are_all_persisted() throws Exception {
        var file = tempDir.resolve("threads.json");
        var fileStore = new ThreadStore(new FileThreadStoreBackend(file));
        fileStore.initialize();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int writer = 0; writer < 8; writer++) {
                int id = writer;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 25; i++) {
                        fileStore.set("key-" + id + "-" + i, "ts-" + id + "-" + i);
                        fileStore.get("key-" + id + "-" + i);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        var restarted = new ThreadStore(new FileThreadStoreBackend(file));
        restarted.initialize();
        assertThat(restarted.size()).isEqualTo(200);
        assertThat(restarted.get("key-7-24")).contains("ts-7-24");
    }

    @Test
    void clear_during_remote_lookup_does_not_restore_old_thread() throws Exception {
        var gated = new GatedBackend();
        gated.remote.put("k", "old-ts");
        var gatedStore = new ThreadStore(gated);
        gatedStore.initialize();

        var lookedUp = new AtomicReference<Optional<String>>();
        var reader = new Thread(() -> lookedUp.set(gatedStore.get("k")));
        reader.start();
        assertThat(gated.lookupEntered.await(5, TimeUnit.SECONDS)).isTrue();

        var clearer = new Thread(gatedStore::clear);
        clearer.start();
        awaitParkedOrDone(clearer);
        gated.release.countDown();
        reader.join(5000);
        clearer.join(5000);

        assertThat(lookedUp.get()).contains("old-ts");
        assertThat(gated.remote).isEmpty();
        assertThat(gatedStore.snapshot()).isEmpty();
        assertThat(gatedStore.get("k")).isEmpty();
    }

    @Test
    void clear_during_remote_write_removes_the_new_entry() throws Exception {
        var gated = new GatedBackend();
        var gatedStore = new ThreadStore(gated);
        gatedStore.initialize();

        var writer = new Thread(() -> gatedStore.set("k", "new-ts"));
        writer.start();
        assertThat(gated.writeEntered.await(5, TimeUnit.SECONDS)).isTrue();

        var clearer = new Thread(gatedStore::clear);
        clearer.start();
        awaitParkedOrDone(clearer);
        gated.release.countDown();
        writer.join(5000);
        clearer.join(5000);

        assertThat(gated.remote).isEmpty();
        assertThat(gatedStore.get("k")).isEmpty();
    }

    private static void awaitParkedOrDone(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.isAlive() && thread.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }

    /**
     * 查询和写入在release之前一直阻塞
     */
    static class GatedBackend extends InMemoryBackend {
        final CountDownLatch lookupEntered = new CountDownLatch(1);
        final CountDownLatch writeEntered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public Optional<String> lookup(String key) {
            lookupEntered.countDown();
            awaitRelease();
            return super.lookup(key);
        }

        @Override
        public void write(Map<String, String> records) {
            writeEntered.countDown();
            awaitRelease();
            super.write(records);
        }

        private void awaitRelease() {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
