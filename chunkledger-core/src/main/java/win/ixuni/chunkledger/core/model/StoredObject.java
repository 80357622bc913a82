package win.ixuni.chunkledger.core.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Metadata of an object held by an object store
 */
@Data
@Builder
public class StoredObject {

    /**
     * Object path inside the store
     */
    private String path;

    /**
     * 对象大小（字节）
     */
    private Long size;

    private String etag;

    private String contentType;

    private Instant lastModified;
}
