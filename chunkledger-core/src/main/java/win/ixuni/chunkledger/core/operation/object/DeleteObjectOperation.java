package win.ixuni.chunkledger.core.operation.object;

import lombok.Value;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

/**
 * Delete object operation (idempotent on missing objects)
 */
@Value
public class DeleteObjectOperation implements ObjectOperation<Void> {

    String path;
}
