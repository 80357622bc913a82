package win.ixuni.chunkledger.boot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import win.ixuni.chunkledger.core.store.ObjectStore;

/**
 * Ties the object store's initialize/shutdown to the application context
 */
@Slf4j
@RequiredArgsConstructor
public class ObjectStoreLifecycle implements InitializingBean, DisposableBean {

    private final ObjectStore store;

    @Override
    public void afterPropertiesSet() {
        store.initialize().block();
    }

    @Override
    public void destroy() {
        try {
            store.shutdown().block();
            log.info("Object store '{}' shutdown complete", store.getStoreName());
        } catch (Exception e) {
            log.error("Error shutting down object store '{}': {}", store.getStoreName(), e.getMessage());
        }
    }
}
