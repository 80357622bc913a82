package win.ixuni.chunkledger.core.model;

import lombok.Value;

/**
 * A tracking record dropped because it was idle for too long
 */
@Value
public class ExpiredUpload {

    String key;

    String uploadId;
}
