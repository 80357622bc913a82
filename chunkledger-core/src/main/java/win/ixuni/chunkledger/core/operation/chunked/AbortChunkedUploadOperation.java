package win.ixuni.chunkledger.core.operation.chunked;

import lombok.Value;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

/**
 * Abort a chunked upload session and discard its chunks
 */
@Value
public class AbortChunkedUploadOperation implements ObjectOperation<Void> {

    String path;

    String uploadId;
}
