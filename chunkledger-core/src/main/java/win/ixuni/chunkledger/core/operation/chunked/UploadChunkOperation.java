package win.ixuni.chunkledger.core.operation.chunked;

import lombok.Value;
import win.ixuni.chunkledger.core.model.UploadedChunk;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

/**
 * Upload one chunk of a chunked upload session
 */
@Value
public class UploadChunkOperation implements ObjectOperation<UploadedChunk> {

    String path;

    String uploadId;

    /**
     * 分片编号 (1-10000)
     */
    int partNumber;

    byte[] content;
}
