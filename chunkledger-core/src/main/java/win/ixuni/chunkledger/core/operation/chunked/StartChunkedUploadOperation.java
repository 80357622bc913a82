package win.ixuni.chunkledger.core.operation.chunked;

import lombok.Builder;
import lombok.Value;
import win.ixuni.chunkledger.core.model.ChunkedUpload;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

/**
 * Open a chunked upload session
 */
@Value
@Builder
public class StartChunkedUploadOperation implements ObjectOperation<ChunkedUpload> {

    String path;

    String contentType;

    ObjectAcl acl;
}
