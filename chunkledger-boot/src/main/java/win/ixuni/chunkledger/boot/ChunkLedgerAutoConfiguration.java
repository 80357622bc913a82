package win.ixuni.chunkledger.boot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.factory.ComponentFactoryLoader;
import win.ixuni.chunkledger.core.factory.ObjectStoreFactory;
import win.ixuni.chunkledger.core.factory.TrackerFactory;
import win.ixuni.chunkledger.core.store.ObjectStore;
import win.ixuni.chunkledger.core.tracker.UploadTracker;
import win.ixuni.chunkledger.core.upload.ChunkedUploadService;

/**
 * Spring Boot auto-configuration
 * <p>
 * Creates the tracker and object store named in {@link ChunkLedgerProperties} through their
 * SPI factories, and the {@link ChunkedUploadService} on top of them.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ChunkLedgerProperties.class)
public class ChunkLedgerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public UploadTracker uploadTracker(ChunkLedgerProperties properties) {
        ComponentConfig config = properties.getTracker();
        log.info("Creating upload tracker '{}' (type: {})", config.getName(), config.getType());
        return ComponentFactoryLoader.find(TrackerFactory.class, config.getType()).createTracker(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectStore objectStore(ChunkLedgerProperties properties) {
        ComponentConfig config = properties.getObjectStore();
        if (!config.isEnabled()) {
            throw new IllegalStateException("Object store '" + config.getName() + "' is disabled");
        }
        log.info("Creating object store '{}' (type: {})", config.getName(), config.getType());
        return ComponentFactoryLoader.find(ObjectStoreFactory.class, config.getType()).createStore(config);
    }

    @Bean
    public ObjectStoreLifecycle objectStoreLifecycle(ObjectStore objectStore) {
        return new ObjectStoreLifecycle(objectStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChunkedUploadService chunkedUploadService(UploadTracker uploadTracker,
                                                     ObjectStore objectStore,
                                                     ChunkLedgerProperties properties) {
        return new ChunkedUploadService(uploadTracker, objectStore,
                properties.getConcurrency(), properties.getDefaultAcl());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "chunkledger.cleanup", name = "enabled", havingValue = "true")
    static class CleanupConfiguration {

        @Bean
        public UploadCleanupScheduler uploadCleanupScheduler(ChunkedUploadService chunkedUploadService,
                                                             ChunkLedgerProperties properties) {
            return new UploadCleanupScheduler(chunkedUploadService, properties);
        }
    }
}
