package win.ixuni.chunkledger.core.model;

/**
 * Access control applied to stored objects
 */
public enum ObjectAcl {

    PUBLIC_READ("public-read"),

    PRIVATE("private");

    private final String cannedAcl;

    ObjectAcl(String cannedAcl) {
        this.cannedAcl = cannedAcl;
    }

    /**
     * Canned ACL name as understood by S3-compatible services
     */
    public String cannedAcl() {
        return cannedAcl;
    }

    /**
     * Resolve from either the canned name ("public-read") or the enum name ("PUBLIC_READ")
     */
    public static ObjectAcl fromValue(String value) {
        for (ObjectAcl acl : values()) {
            if (acl.cannedAcl.equalsIgnoreCase(value) || acl.name().equalsIgnoreCase(value)) {
                return acl;
            }
        }
        throw new IllegalArgumentException("Unknown ACL: " + value
                + " (expected " + PUBLIC_READ.cannedAcl + " or " + PRIVATE.cannedAcl + ")");
    }
}
