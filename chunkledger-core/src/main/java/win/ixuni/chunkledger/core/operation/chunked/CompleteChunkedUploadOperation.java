package win.ixuni.chunkledger.core.operation.chunked;

import lombok.Value;
import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

import java.util.List;

/**
 * Finalize a chunked upload
 * <p>
 * Parts must be in ascending part-number order.
 */
@Value
public class CompleteChunkedUploadOperation implements ObjectOperation<StoredObject> {

    String path;

    String uploadId;

    List<CompletedPart> parts;
}
