package org.filest.filesystem;

import java.util.List;

/**
 * 完成分片上传时仍有分片未收到。会话会被放回存储，客户端补传后可再次完成。
 */
public class MissingChunksException extends TransferException {

    private final List<Integer> missing;

    public MissingChunksException(List<Integer> missing) {
        super(ErrorCode.MISSING_CHUNKS, "分片未全部上传，缺少 " + missing.size() + " 个分片");
        this.missing = List.copyOf(missing);
    }

    public List<Integer> getMissing() {
        return missing;
    }
}
