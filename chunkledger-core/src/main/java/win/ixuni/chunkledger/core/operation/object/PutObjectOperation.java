package win.ixuni.chunkledger.core.operation.object;

import lombok.Builder;
import lombok.Value;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.operation.ObjectOperation;

/**
 * Put a whole object in a single call
 */
@Value
@Builder
public class PutObjectOperation implements ObjectOperation<StoredObject> {

    String path;

    byte[] content;

    ObjectAcl acl;

    String contentType;
}
