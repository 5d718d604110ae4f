package org.filest.upload;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * 后台定时回收过期的分片上传会话。随容器启动/停止。
 */
public class ChunkSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(ChunkSessionSweeper.class);

    private final ChunkedUploadService uploadService;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private ScheduledFuture<?> future;

    public ChunkSessionSweeper(ChunkedUploadService uploadService, TaskScheduler scheduler, Duration interval) {
        this.uploadService = uploadService;
        this.scheduler = scheduler;
        this.interval = interval;
    }

    public synchronized void start() {
        if (future == null) {
            future = scheduler.scheduleWithFixedDelay(this::sweep, Instant.now().plus(interval), interval);
        }
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    void sweep() {
        try {
            int reclaimed = uploadService.sweepExpired();
            if (reclaimed > 0) {
                log.info("本轮回收分片上传会话/暂存目录 {} 个", reclaimed);
            }
        } catch (RuntimeException e) {
            // 不让异常终止定时任务
            log.error("回收分片上传会话失败", e);
        }
    }
}
