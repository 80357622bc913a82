package win.ixuni.chunkledger.core.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of pushing one chunk to an object store
 */
@Data
@Builder
public class UploadedChunk {

    /**
     * 分片编号 (1-10000)
     */
    private Integer partNumber;

    /**
     * Chunk size in bytes
     */
    private Long size;

    private String etag;

    private Instant lastModified;

    public CompletedPart toCompletedPart() {
        return CompletedPart.of(partNumber, etag);
    }
}
