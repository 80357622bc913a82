package win.ixuni.chunkledger.core.upload;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PartSizingTest {

    private static final long MB = 1024 * 1024;

    @Test
    @DisplayName("Part count rounds up to cover the last short part")
    void partCountRoundsUp() {
        assertEquals(1, PartSizing.partCount(1, 5 * MB));
        assertEquals(1, PartSizing.partCount(5 * MB, 5 * MB));
        assertEquals(2, PartSizing.partCount(5 * MB + 1, 5 * MB));
        assertEquals(3, PartSizing.partCount(12 * MB, 5 * MB));
    }

    @Test
    @DisplayName("Exactly 10000 parts is accepted, 10001 is rejected")
    void partCountUpperBound() {
        assertEquals(10000, PartSizing.partCount(10000, 1));

        InvalidUploadArgumentException e = assertThrows(InvalidUploadArgumentException.class,
                () -> PartSizing.partCount(10001, 1));
        assertEquals("InvalidArgument", e.getErrorCode());
        assertEquals(400, e.getHttpStatus());
    }

    @Test
    @DisplayName("Empty payload and non-positive part size are rejected")
    void invalidInputs() {
        assertThrows(InvalidUploadArgumentException.class, () -> PartSizing.partCount(0, MB));
        assertThrows(InvalidUploadArgumentException.class, () -> PartSizing.partCount(10, 0));
        assertThrows(InvalidUploadArgumentException.class, () -> PartSizing.partCount(10, -1));
    }

    @Test
    @DisplayName("Part count of a file on disk uses its size")
    void partCountOfFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("payload.bin");
        Files.write(file, new byte[25]);

        assertEquals(3, PartSizing.partCount(file, 10));
        assertThrows(UncheckedIOException.class, () -> PartSizing.partCount(dir.resolve("missing"), 10));
    }

    @Test
    @DisplayName("Slices cover the payload, last one shorter")
    void sliceCoversPayload() {
        byte[] data = {0, 1, 2, 3, 4, 5, 6};

        assertArrayEquals(new byte[]{0, 1, 2}, PartSizing.slice(data, 1, 3));
        assertArrayEquals(new byte[]{3, 4, 5}, PartSizing.slice(data, 2, 3));
        assertArrayEquals(new byte[]{6}, PartSizing.slice(data, 3, 3));
        assertThrows(InvalidUploadArgumentException.class, () -> PartSizing.slice(data, 4, 3));
        assertThrows(InvalidUploadArgumentException.class, () -> PartSizing.slice(data, 0, 3));
    }
}
