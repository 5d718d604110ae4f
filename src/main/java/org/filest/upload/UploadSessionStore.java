package org.filest.upload;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 分片上传会话存储（内存版）。
 * <p>
 * 并发约定：
 * <ul>
 *   <li>只对单个 key 做原子的读-改-写（{@link ConcurrentHashMap#computeIfPresent}），不存在全局锁，
 *   互不相关的会话之间不会互相阻塞。</li>
 *   <li>{@link #get}/{@link #mutate}/{@link #remove} 返回的都是快照，不持有锁、也不是活对象。</li>
 *   <li>同一会话的 {@code mutate} 先于 {@code remove} 完成时，{@code remove} 返回的快照一定能看到这次修改。</li>
 * </ul>
 * <p>
 * 仅用于单实例/单进程场景；会话不持久化，进程重启后需要客户端重新 init。
 */
public class UploadSessionStore {

    private final ConcurrentHashMap<String, UploadSession> store = new ConcurrentHashMap<>();

    public void create(UploadSession session) {
        if (store.putIfAbsent(session.uploadId(), session) != null) {
            throw new IllegalStateException("uploadId 冲突：" + session.uploadId());
        }
    }

    public Optional<UploadSession> get(String uploadId) {
        if (uploadId == null || uploadId.isBlank()) {
            return Optional.empty();
        }
        // 快照在 key 锁内生成，避免读到 mutate 的中间状态
        UploadSession[] snapshot = new UploadSession[1];
        store.computeIfPresent(uploadId, (k, s) -> {
            snapshot[0] = s.copy();
            return s;
        });
        return Optional.ofNullable(snapshot[0]);
    }

    /**
     * 对单个会话做原子修改。会话不存在（或已被 remove）时不执行回调，返回 empty。
     */
    public Optional<UploadSession> mutate(String uploadId, Consumer<UploadSession> mutation) {
        if (uploadId == null || uploadId.isBlank()) {
            return Optional.empty();
        }
        UploadSession[] snapshot = new UploadSession[1];
        store.computeIfPresent(uploadId, (k, s) -> {
            mutation.accept(s);
            snapshot[0] = s.copy();
            return s;
        });
        return Optional.ofNullable(snapshot[0]);
    }

    public Optional<UploadSession> remove(String uploadId) {
        if (uploadId == null || uploadId.isBlank()) {
            return Optional.empty();
        }
        UploadSession removed = store.remove(uploadId);
        return removed == null ? Optional.empty() : Optional.of(removed.copy());
    }

    /**
     * 把之前 remove 掉的会话放回去（完成时发现缺分片的场景）。同 id 已被重新占用时放弃并返回 false。
     */
    public boolean restore(UploadSession session) {
        return store.putIfAbsent(session.uploadId(), session.copy()) == null;
    }

    /**
     * 移除所有空闲超过 ttl 的会话，返回被移除的会话快照。
     */
    public List<UploadSession> removeExpired(Instant now, Duration ttl) {
        List<UploadSession> expired = new ArrayList<>();
        for (String uploadId : store.keySet()) {
            store.computeIfPresent(uploadId, (k, s) -> {
                if (s.isExpired(now, ttl)) {
                    expired.add(s.copy());
                    return null;
                }
                return s;
            });
        }
        return expired;
    }

    public List<UploadSession> removeAll() {
        List<UploadSession> removed = new ArrayList<>();
        for (String uploadId : store.keySet()) {
            remove(uploadId).ifPresent(removed::add);
        }
        return removed;
    }

    public boolean contains(String uploadId) {
        return uploadId != null && store.containsKey(uploadId);
    }

    public Set<String> uploadIds() {
        return Set.copyOf(store.keySet());
    }

    public int size() {
        return store.size();
    }
}
