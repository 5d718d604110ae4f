package org.filest.upload;

import org.filest.filesystem.SandboxedPath;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadSessionStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final UploadSessionStore store = new UploadSessionStore();

    @Test
    void get_returnsIndependentSnapshot() {
        store.create(session("u1", 3));

        UploadSession snapshot = store.get("u1").orElseThrow();
        snapshot.markReceived(0, T0);

        assertThat(store.get("u1").orElseThrow().isReceived(0)).isFalse();
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    void create_rejectsDuplicateId() {
        store.create(session("u1", 1));

        assertThatThrownBy(() -> store.create(session("u1", 1))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void mutate_appliesAtomicallyUnderConcurrency() throws Exception {
        int chunks = 512;
        store.create(session("u1", chunks));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < chunks; i++) {
                int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.mutate("u1", s -> s.markReceived(index, T0.plusSeconds(index)));
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        UploadSession result = store.get("u1").orElseThrow();
        assertThat(result.receivedCount()).isEqualTo(chunks);
        assertThat(result.missingChunks()).isEmpty();
    }

    @Test
    void mutate_onMissingSessionDoesNothing() {
        assertThat(store.mutate("none", s -> {
            throw new AssertionError("不应执行");
        })).isEmpty();
    }

    @Test
    void remove_thenRestore_keepsReceivedChunks() {
        store.create(session("u1", 3));
        store.mutate("u1", s -> s.markReceived(1, T0));

        UploadSession removed = store.remove("u1").orElseThrow();
        assertThat(store.contains("u1")).isFalse();
        assertThat(store.remove("u1")).isEmpty();

        assertThat(store.restore(removed)).isTrue();
        assertThat(store.restore(removed)).isFalse();
        assertThat(store.get("u1").orElseThrow().missingChunks()).containsExactly(0, 2);
    }

    @Test
    void removeExpired_usesLastActivity() {
        store.create(session("idle", 2));
        store.create(session("busy", 2));
        store.mutate("busy", s -> s.markReceived(0, T0.plus(Duration.ofMinutes(50))));

        List<UploadSession> expired = store.removeExpired(T0.plus(Duration.ofMinutes(61)), Duration.ofHours(1));

        assertThat(expired).extracting(UploadSession::uploadId).containsExactly("idle");
        assertThat(store.uploadIds()).containsExactly("busy");
    }

    @Test
    void removeAll_emptiesStore() {
        store.create(session("a", 1));
        store.create(session("b", 1));

        assertThat(store.removeAll()).hasSize(2);
        assertThat(store.size()).isZero();
    }

    private static UploadSession session(String id, int totalChunks) {
        Path root = Path.of("/srv/files");
        Path file = root.resolve("f.bin");
        return new UploadSession(id, "f.bin", totalChunks, 1, totalChunks,
                new SandboxedPath(root, file, file), Path.of("/tmp/scratch", id), T0);
    }
}
