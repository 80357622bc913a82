package win.ixuni.chunkledger.core.factory;

/**
 * Common contract of tracker and object store factories
 */
public interface ComponentFactory {

    /**
     * Get the backend type supported by this factory
     *
     * @return type identifier (e.g. "memory", "s3")
     */
    String getType();

    /**
     * Get the factory description
     *
     * @return description text
     */
    default String getDescription() {
        return getType() + " component";
    }
}
