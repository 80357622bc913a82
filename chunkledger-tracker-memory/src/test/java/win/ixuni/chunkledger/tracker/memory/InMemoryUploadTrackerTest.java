package win.ixuni.chunkledger.tracker.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.exception.UploadAlreadyExistsException;
import win.ixuni.chunkledger.core.exception.UploadNotFoundException;
import win.ixuni.chunkledger.core.model.CompletedPart;
import win.ixuni.chunkledger.core.model.UploadStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryUploadTrackerTest {

    private InMemoryUploadTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new InMemoryUploadTracker();
    }

    @Nested
    @DisplayName("createUpload")
    class CreateUpload {

        @Test
        @DisplayName("Upload id is readable right after creation")
        void uploadIdRoundTrip() {
            tracker.createUpload("videos/a.mp4", "upload-1", 3);

            assertEquals("upload-1", tracker.getUploadId("videos/a.mp4"));
            assertEquals(1, tracker.activeUploadCount());
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 10000})
        @DisplayName("Boundary part counts are accepted")
        void boundaryTotalsAccepted(int totalParts) {
            tracker.createUpload("k", "u", totalParts);

            UploadStatus status = tracker.getStatus("k");
            assertEquals(totalParts, status.getTotalParts());
            assertEquals(0, status.getCompletedPartsCount());
            assertFalse(status.isCompleted());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 10001})
        @DisplayName("Out-of-range part counts are rejected")
        void outOfRangeTotalsRejected(int totalParts) {
            InvalidUploadArgumentException e = assertThrows(InvalidUploadArgumentException.class,
                    () -> tracker.createUpload("k", "u", totalParts));
            assertEquals("InvalidArgument", e.getErrorCode());
            assertEquals(0, tracker.activeUploadCount());
        }

        @Test
        @DisplayName("Empty key is rejected whatever the other arguments")
        void emptyKeyRejected() {
            assertThrows(InvalidUploadArgumentException.class, () -> tracker.createUpload("", "u", 3));
            assertThrows(InvalidUploadArgumentException.class, () -> tracker.createUpload("", "u", 0));
            assertThrows(InvalidUploadArgumentException.class, () -> tracker.createUpload(null, "u", 3));
        }

        @Test
        @DisplayName("Second create for the same key fails and keeps the first record")
        void duplicateRejected() {
            tracker.createUpload("k", "first", 2);

            UploadAlreadyExistsException e = assertThrows(UploadAlreadyExistsException.class,
                    () -> tracker.createUpload("k", "second", 5));
            assertEquals(409, e.getHttpStatus());
            assertEquals("first", tracker.getUploadId("k"));
            assertEquals(2, tracker.getStatus("k").getTotalParts());
        }

        @Test
        @DisplayName("Key can be reused after complete or abort")
        void keyReusableAfterTerminalState() {
            tracker.createUpload("k", "u1", 1);
            tracker.completeUpload("k");
            tracker.createUpload("k", "u2", 1);
            tracker.abortUpload("k");
            tracker.createUpload("k", "u3", 1);

            assertEquals("u3", tracker.getUploadId("k"));
        }
    }

    @Nested
    @DisplayName("addPart and status")
    class AddPart {

        @Test
        @DisplayName("Status flips to completed when the last part arrives")
        void completionIsDerived() {
            tracker.createUpload("k", "u", 3);
            tracker.addPart("k", 1, "a");
            tracker.addPart("k", 2, "b");

            UploadStatus status = tracker.getStatus("k");
            assertEquals(2, status.getCompletedPartsCount());
            assertFalse(status.isCompleted());

            tracker.addPart("k", 3, "c");

            status = tracker.getStatus("k");
            assertEquals(3, status.getCompletedPartsCount());
            assertTrue(status.isCompleted());
        }

        @Test
        @DisplayName("Re-adding a part overwrites its tag without changing the count")
        void reAddOverwrites() {
            tracker.createUpload("k", "u", 3);
            tracker.addPart("k", 1, "a");
            tracker.addPart("k", 1, "a2");

            assertEquals(1, tracker.getStatus("k").getCompletedPartsCount());
            assertEquals(List.of(CompletedPart.of(1, "a2")), List.copyOf(tracker.getParts("k")));
        }

        @Test
        @DisplayName("Part numbers are not bounds-checked by the tracker")
        void noBoundsCheck() {
            tracker.createUpload("k", "u", 2);
            tracker.addPart("k", 7, "x");

            assertEquals(1, tracker.getStatus("k").getCompletedPartsCount());
        }

        @Test
        @DisplayName("Parts added out of order are all returned")
        void outOfOrderParts() {
            tracker.createUpload("k", "u", 2);
            tracker.addPart("k", 2, "b");
            tracker.addPart("k", 1, "a");

            Map<Integer, String> parts = tracker.getParts("k").stream()
                    .collect(Collectors.toMap(CompletedPart::getPartNumber, CompletedPart::getEtag));
            assertEquals(Map.of(1, "a", 2, "b"), parts);
        }

        @Test
        @DisplayName("Returned parts are a snapshot that cannot be modified")
        void partsAreImmutableSnapshot() {
            tracker.createUpload("k", "u", 3);
            tracker.addPart("k", 1, "a");

            Collection<CompletedPart> parts = tracker.getParts("k");
            tracker.addPart("k", 2, "b");

            assertEquals(1, parts.size());
            assertThrows(UnsupportedOperationException.class, () -> parts.add(CompletedPart.of(3, "c")));
        }
    }

    @Nested
    @DisplayName("missing records")
    class MissingRecords {

        @Test
        @DisplayName("Every operation except abort fails with NotFound")
        void notFound() {
            assertThrows(UploadNotFoundException.class, () -> tracker.addPart("nope", 1, "a"));
            assertThrows(UploadNotFoundException.class, () -> tracker.getUploadId("nope"));
            assertThrows(UploadNotFoundException.class, () -> tracker.getParts("nope"));
            assertThrows(UploadNotFoundException.class, () -> tracker.getStatus("nope"));
            assertThrows(UploadNotFoundException.class, () -> tracker.completeUpload("nope"));
        }

        @Test
        @DisplayName("Abort of an unknown key is a no-op")
        void abortIsIdempotent() {
            assertDoesNotThrow(() -> tracker.abortUpload("nope"));

            tracker.createUpload("k", "u", 1);
            tracker.abortUpload("k");
            assertDoesNotThrow(() -> tracker.abortUpload("k"));
            assertEquals(0, tracker.activeUploadCount());
        }

        @Test
        @DisplayName("Complete removes the record without checking completeness")
        void completeRemovesRecord() {
            tracker.createUpload("k", "u", 3);
            tracker.addPart("k", 1, "a");

            tracker.completeUpload("k");

            assertThrows(UploadNotFoundException.class, () -> tracker.getStatus("k"));
            assertThrows(UploadNotFoundException.class, () -> tracker.completeUpload("k"));
        }
    }
}
