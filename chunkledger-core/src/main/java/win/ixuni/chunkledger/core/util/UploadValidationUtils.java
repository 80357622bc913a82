package win.ixuni.chunkledger.core.util;

/**
 * Chunked upload argument validation
 * <p>
 * Each check returns an error message, or {@code null} when the argument is valid.
 */
public final class UploadValidationUtils {

    /**
     * Upper bound on parts per upload imposed by S3-compatible chunked upload protocols
     */
    public static final int MAX_PARTS = 10000;

    private UploadValidationUtils() {
    }

    public static String validateKey(String key) {
        if (key == null || key.isEmpty()) {
            return "Upload key cannot be empty";
        }
        return null;
    }

    public static String validateTotalParts(long totalParts) {
        if (totalParts <= 0 || totalParts > MAX_PARTS) {
            return "Total parts must be between 1 and " + MAX_PARTS + " (actual: " + totalParts + ")";
        }
        return null;
    }

    public static String validatePartNumber(int partNumber, int totalParts) {
        if (partNumber < 1 || partNumber > totalParts) {
            return "Part number must be between 1 and " + totalParts + " (actual: " + partNumber + ")";
        }
        return null;
    }

    public static String validateUploadId(String uploadId) {
        if (uploadId == null || uploadId.isEmpty()) {
            return "Upload id is missing or empty";
        }
        return null;
    }
}
