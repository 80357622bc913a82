package win.ixuni.chunkledger.core.factory;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.chunkledger.core.exception.ComponentNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover tracker and object store factories on the classpath.
 * Third-party backends only need to declare themselves in META-INF/services.
 * <p>
 * Usage example:
 *
 * <pre>
 * TrackerFactory factory = ComponentFactoryLoader.find(TrackerFactory.class, "memory");
 * UploadTracker tracker = factory.createTracker(config);
 * </pre>
 */
@Slf4j
public final class ComponentFactoryLoader {

    private ComponentFactoryLoader() {
        // Utility class, not instantiable
    }

    /**
     * Load all implementations of a factory type via SPI
     */
    public static <F extends ComponentFactory> List<F> load(Class<F> factoryType) {
        return load(factoryType, Thread.currentThread().getContextClassLoader());
    }

    public static <F extends ComponentFactory> List<F> load(Class<F> factoryType, ClassLoader classLoader) {
        ServiceLoader<F> loader = ServiceLoader.load(factoryType, classLoader);
        List<F> factories = new ArrayList<>();

        for (F factory : loader) {
            factories.add(factory);
            log.info("Discovered {} via SPI: {} - {}",
                    factoryType.getSimpleName(), factory.getType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No {} implementations found via SPI", factoryType.getSimpleName());
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory serving the given type
     *
     * @throws ComponentNotFoundException if none is registered
     */
    public static <F extends ComponentFactory> F find(Class<F> factoryType, String type) {
        return load(factoryType).stream()
                .filter(f -> f.getType().equals(type))
                .findFirst()
                .orElseThrow(() -> new ComponentNotFoundException(factoryType.getSimpleName(), type));
    }
}
