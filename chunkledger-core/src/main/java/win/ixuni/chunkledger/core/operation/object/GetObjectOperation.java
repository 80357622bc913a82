package win.ixuni.chunkledger.core.operation.object;

import lombok.Value;
import win.ixuni.chunkledger.core.model.StoredObjectData;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

/**
 * Get object operation
 */
@Value
public class GetObjectOperation implements ObjectOperation<StoredObjectData> {

    String path;
}
