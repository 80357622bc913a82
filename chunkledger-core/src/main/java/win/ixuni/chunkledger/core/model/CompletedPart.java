package win.ixuni.chunkledger.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * A received chunk as recorded by the tracker
 */
@Value
@Builder
public class CompletedPart {

    /**
     * Part number (1-based)
     */
    int partNumber;

    /**
     * Integrity tag returned by the object store for this chunk, passed back verbatim on completion
     */
    String etag;

    public static CompletedPart of(int partNumber, String etag) {
        return new CompletedPart(partNumber, etag);
    }
}
