package org.filest.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 文件传输服务的业务配置（{@code app.fs.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #root} 指定沙箱根目录，所有上传只允许落在该目录内。</li>
 *   <li>通过 {@link #scratchDir} / {@link #chunkSessionTtl} 控制分片上传的暂存目录与过期回收。</li>
 *   <li>通过 {@link #wsProgressInterval} 控制 WebSocket 上传的进度推送频率。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.fs")
public class FileServerProperties {

    /**
     * 沙箱根目录。启动时若不存在会自动创建，然后解析为真实路径（realPath）。
     */
    @NotBlank
    private String root = "./files";

    /**
     * HTTP Basic 认证用户名（单用户）。
     */
    @NotBlank
    private String username = "admin";

    /**
     * HTTP Basic 认证密码。
     */
    @NotBlank
    private String password = "admin123";

    /**
     * 是否允许解析链路上出现符号链接（symlink）。
     * <p>
     * 说明：即使允许，链接解析后的真实路径仍必须位于 {@link #root} 之内；设为 false 则任何链接都直接拒绝。
     */
    private boolean allowSymlink = true;

    /**
     * 目标文件已存在时是否覆盖。false 时三种上传方式都会在落盘阶段返回 ALREADY_EXISTS。
     */
    private boolean overwriteExisting = true;

    /**
     * 分片暂存目录的父目录；每个分片会话在其下拥有一个以 uploadId 命名的私有子目录。
     */
    @NotNull
    private Path scratchDir = Path.of(System.getProperty("java.io.tmpdir"), "filest-chunks");

    /**
     * 分片会话的空闲有效期；超过后由后台清理任务回收会话及其暂存目录。
     */
    @NotNull
    private Duration chunkSessionTtl = Duration.ofHours(1);

    /**
     * 后台清理任务的执行间隔。
     */
    @NotNull
    private Duration chunkSweepInterval = Duration.ofMinutes(5);

    /**
     * 单个分片会话允许声明的最大分片数（上限保护，避免超大 bitset）。
     */
    @Min(1)
    @Max(10_000_000)
    private int chunkMaxCount = 100_000;

    /**
     * WebSocket 上传的进度推送间隔：累计字节每跨过一个间隔推送一次。
     */
    @NotNull
    private DataSize wsProgressInterval = DataSize.ofMegabytes(2);

    /**
     * WebSocket 容器允许的单条二进制消息大小。
     */
    @NotNull
    private DataSize wsMaxFrameSize = DataSize.ofMegabytes(8);

    /**
     * 写文件时的缓冲区大小。
     */
    @NotNull
    private DataSize writeBufferSize = DataSize.ofMegabytes(1);

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public boolean isOverwriteExisting() {
        return overwriteExisting;
    }

    public void setOverwriteExisting(boolean overwriteExisting) {
        this.overwriteExisting = overwriteExisting;
    }

    public Path getScratchDir() {
        return scratchDir;
    }

    public void setScratchDir(Path scratchDir) {
        this.scratchDir = scratchDir;
    }

    public Duration getChunkSessionTtl() {
        return chunkSessionTtl;
    }

    public void setChunkSessionTtl(Duration chunkSessionTtl) {
        this.chunkSessionTtl = chunkSessionTtl;
    }

    public Duration getChunkSweepInterval() {
        return chunkSweepInterval;
    }

    public void setChunkSweepInterval(Duration chunkSweepInterval) {
        this.chunkSweepInterval = chunkSweepInterval;
    }

    public int getChunkMaxCount() {
        return chunkMaxCount;
    }

    public void setChunkMaxCount(int chunkMaxCount) {
        this.chunkMaxCount = chunkMaxCount;
    }

    public DataSize getWsProgressInterval() {
        return wsProgressInterval;
    }

    public void setWsProgressInterval(DataSize wsProgressInterval) {
        this.wsProgressInterval = wsProgressInterval;
    }

    public DataSize getWsMaxFrameSize() {
        return wsMaxFrameSize;
    }

    public void setWsMaxFrameSize(DataSize wsMaxFrameSize) {
        this.wsMaxFrameSize = wsMaxFrameSize;
    }

    public DataSize getWriteBufferSize() {
        return writeBufferSize;
    }

    public void setWriteBufferSize(DataSize writeBufferSize) {
        this.writeBufferSize = writeBufferSize;
    }
}
