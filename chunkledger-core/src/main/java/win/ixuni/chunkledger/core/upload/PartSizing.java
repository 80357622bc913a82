package win.ixuni.chunkledger.core.upload;

import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Splitting of a payload into fixed-size parts
 */
public final class PartSizing {

    private PartSizing() {
    }

    /**
     * Number of parts needed to send {@code fileSize} bytes in chunks of {@code partSize} bytes.
     * The last part may be shorter.
     *
     * @throws InvalidUploadArgumentException on an empty payload, a non-positive part size,
     *                                        or more than {@value UploadValidationUtils#MAX_PARTS} parts
     */
    public static int partCount(long fileSize, long partSize) {
        if (partSize <= 0) {
            throw new InvalidUploadArgumentException("Part size must be positive (actual: " + partSize + ")");
        }
        if (fileSize <= 0) {
            throw new InvalidUploadArgumentException("File is empty");
        }

        long count = fileSize / partSize;
        if (fileSize % partSize != 0) {
            count++;
        }

        String error = UploadValidationUtils.validateTotalParts(count);
        if (error != null) {
            throw new InvalidUploadArgumentException(error + "; use a larger part size");
        }
        return (int) count;
    }

    /**
     * Part count for a file on disk
     */
    public static int partCount(Path file, long partSize) {
        try {
            return partCount(Files.size(file), partSize);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + file, e);
        }
    }

    /**
     * Bytes of the given 1-based part
     */
    public static byte[] slice(byte[] data, int partNumber, long partSize) {
        long from = (partNumber - 1) * partSize;
        if (partNumber < 1 || from >= data.length) {
            throw new InvalidUploadArgumentException("Part " + partNumber + " is outside the payload");
        }
        long to = Math.min(data.length, from + partSize);
        return Arrays.copyOfRange(data, (int) from, (int) to);
    }
}
