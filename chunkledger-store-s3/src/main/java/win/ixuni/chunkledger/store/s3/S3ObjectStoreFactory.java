package win.ixuni.chunkledger.store.s3;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.factory.ObjectStoreFactory;
import win.ixuni.chunkledger.core.store.ObjectStore;

/**
 * S3 object store factory
 */
@Slf4j
public class S3ObjectStoreFactory implements ObjectStoreFactory {

    public static final String STORE_TYPE = "s3";

    @Override
    public String getType() {
        return STORE_TYPE;
    }

    @Override
    public ObjectStore createStore(ComponentConfig config) {
        log.info("Creating S3 object store instance: {}", config.getName());
        return new S3ObjectStore(config);
    }

    @Override
    public String getDescription() {
        return "S3 object store for MinIO, AWS S3, and other S3-compatible backends";
    }
}
