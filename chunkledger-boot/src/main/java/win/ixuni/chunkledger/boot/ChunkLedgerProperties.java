package win.ixuni.chunkledger.boot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.model.ObjectAcl;
import win.ixuni.chunkledger.core.upload.ChunkedUploadService;

import java.time.Duration;

/**
 * ChunkLedger configuration
 * <p>
 * Example:
 *
 * <pre>
 * chunkledger:
 *   tracker:
 *     type: memory
 *   object-store:
 *     name: uploads
 *     type: s3
 *     properties:
 *       endpoint: http://localhost:9000
 *       access-key: minioadmin
 *       secret-key: minioadmin
 *       bucket: uploads
 *   default-acl: private
 *   cleanup:
 *     enabled: true
 *     idle-timeout: 24h
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "chunkledger")
public class ChunkLedgerProperties {

    /**
     * Upload tracker backend
     */
    private ComponentConfig tracker = ComponentConfig.of("default", "memory");

    /**
     * Object store backend
     */
    private ComponentConfig objectStore = ComponentConfig.of("default", "memory");

    /**
     * ACL used when a caller does not pass one
     */
    private ObjectAcl defaultAcl = ObjectAcl.PRIVATE;

    /**
     * Chunks pushed in parallel by {@code uploadAll}
     */
    private int concurrency = ChunkedUploadService.DEFAULT_CONCURRENCY;

    private Cleanup cleanup = new Cleanup();

    @Data
    public static class Cleanup {

        /**
         * Whether abandoned uploads are expired on a schedule
         */
        private boolean enabled = false;

        /**
         * Uploads without activity for this long are aborted
         */
        private Duration idleTimeout = Duration.ofHours(24);

        private String cron = "0 0 * * * *";
    }
}
