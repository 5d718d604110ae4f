package org.filest.filesystem.dto;

import java.util.List;

/**
 * 一次性 multipart 上传（{@code POST /api/upload}）的返回结果。
 *
 * @param files 本次请求保存成功的文件
 */
public record UploadResult(
        List<UploadedFile> files
) {
}
