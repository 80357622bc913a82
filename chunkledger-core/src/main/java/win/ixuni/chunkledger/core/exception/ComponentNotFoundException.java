package win.ixuni.chunkledger.core.exception;

/**
 * No factory is registered for the requested component type
 */
public class ComponentNotFoundException extends ChunkLedgerException {

    public ComponentNotFoundException(String kind, String type) {
        super("ComponentNotFound", "No " + kind + " factory registered for type: " + type, 500);
    }
}
