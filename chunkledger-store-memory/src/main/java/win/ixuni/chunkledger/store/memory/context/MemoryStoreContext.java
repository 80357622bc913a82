package win.ixuni.chunkledger.store.memory.context;

import lombok.Builder;
import lombok.Getter;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.operation.StoreContext;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memory store context
 * <p>
 * Shared data structures of the in-memory object store.
 */
@Getter
@Builder
public class MemoryStoreContext implements StoreContext {

    private final ComponentConfig config;

    /**
     * Object storage: path -> ObjectData
     */
    @Builder.Default
    private final Map<String, ObjectData> objects = new ConcurrentHashMap<>();

    /**
     * Chunked upload sessions: uploadId -> ChunkedState
     */
    @Builder.Default
    private final Map<String, ChunkedState> chunkedUploads = new ConcurrentHashMap<>();

    @Override
    public ComponentConfig getConfig() {
        return config;
    }

    @Override
    public String getStoreName() {
        return config.getName();
    }

    @Override
    public String getStoreType() {
        return "memory";
    }

    // ============ Data Structure Definitions ============

    @Getter
    @Builder
    public static class ObjectData {
        private final String path;
        private final byte[] data;
        private final String etag;
        private final String contentType;
        private final ObjectAcl acl;
        private final Instant lastModified;
    }

    @Getter
    @Builder
    public static class ChunkedState {
        private final String uploadId;
        private final String path;
        private final String contentType;
        private final ObjectAcl acl;
        private final Instant initiated;
        @Builder.Default
        private final Map<Integer, ChunkData> chunks = new ConcurrentHashMap<>();
    }

    @Getter
    @Builder
    public static class ChunkData {
        private final byte[] data;
        private final String etag;
        private final Instant lastModified;
    }
}
