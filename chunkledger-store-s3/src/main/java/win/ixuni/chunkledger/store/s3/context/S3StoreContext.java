package win.ixuni.chunkledger.store.s3.context;

import lombok.Builder;
import lombok.Getter;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.operation.StoreContext;

/**
 * S3 store context
 * <p>
 * Holds the AWS S3 async client and the target bucket
 */
@Getter
@Builder
public class S3StoreContext implements StoreContext {

    private final ComponentConfig config;

    private final S3AsyncClient s3Client;

    /**
     * Bucket every object path is resolved against
     */
    private final String bucket;

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
        return "s3";
    }
}
