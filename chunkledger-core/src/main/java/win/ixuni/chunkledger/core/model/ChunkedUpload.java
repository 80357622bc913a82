package win.ixuni.chunkledger.core.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Chunked upload session opened on an object store
 */
@Data
@Builder
public class ChunkedUpload {

    /**
     * Session identifier issued by the object store
     */
    private String uploadId;

    /**
     * Destination object path
     */
    private String path;

    private String contentType;

    private Instant initiated;
}
