package org.filest.ws;

import org.filest.filesystem.FileServerProperties;

/**
 * WebSocket 上传用到的配置项。
 *
 * @param progressInterval 进度推送间隔（字节）
 * @param bufferSize       写文件缓冲区大小
 * @param overwrite        目标文件已存在时是否覆盖
 */
public record StreamUploadSettings(long progressInterval, int bufferSize, boolean overwrite) {

    public StreamUploadSettings {
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("progressInterval 必须大于 0：" + progressInterval);
        }
    }

    public static StreamUploadSettings from(FileServerProperties properties) {
        return new StreamUploadSettings(
                properties.getWsProgressInterval().toBytes(),
                (int) Math.min(Integer.MAX_VALUE, properties.getWriteBufferSize().toBytes()),
                properties.isOverwriteExisting()
        );
    }
}
