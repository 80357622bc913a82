package win.ixuni.chunkledger.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Progress snapshot of a tracked upload
 * <p>
 * {@code completed} is always derived from the two counts; build instances with {@link #of}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UploadStatus {

    boolean completed;

    int totalParts;

    int completedPartsCount;

    public static UploadStatus of(int totalParts, int completedPartsCount) {
        return new UploadStatus(completedPartsCount == totalParts, totalParts, completedPartsCount);
    }
}
