package win.ixuni.chunkledger.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.chunkledger.core.model.ObjectAcl;

import static org.junit.jupiter.api.Assertions.*;

class ComponentConfigTest {

    @Test
    @DisplayName("Typed getters convert bound strings and fall back to defaults")
    void typedGetters() {
        ComponentConfig config = ComponentConfig.of("uploads", "s3")
                .with("bucket", "media")
                .with("path-style", "false")
                .with("max-connections", "64")
                .with("part-size", 5242880)
                .with("enabled-flag", true);

        assertEquals("uploads", config.getName());
        assertEquals("s3", config.getType());
        assertTrue(config.isEnabled());
        assertEquals("media", config.getString("bucket", null));
        assertEquals("us-east-1", config.getString("region", "us-east-1"));
        assertFalse(config.getBoolean("path-style", true));
        assertTrue(config.getBoolean("enabled-flag", false));
        assertEquals(64, config.getInt("max-connections", 10));
        assertEquals(5242880L, config.getLong("part-size", 0L));
        assertEquals(7L, config.getLong("missing", 7L));
    }

    @Test
    @DisplayName("ACL resolves from canned or enum name")
    void aclFromValue() {
        assertEquals(ObjectAcl.PUBLIC_READ, ObjectAcl.fromValue("public-read"));
        assertEquals(ObjectAcl.PRIVATE, ObjectAcl.fromValue("PRIVATE"));
        assertEquals("public-read", ObjectAcl.PUBLIC_READ.cannedAcl());
        assertThrows(IllegalArgumentException.class, () -> ObjectAcl.fromValue("authenticated-read"));
    }
}
