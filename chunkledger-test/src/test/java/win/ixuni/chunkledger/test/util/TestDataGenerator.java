package win.ixuni.chunkledger.test.util;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Test data generator
 */
public final class TestDataGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private TestDataGenerator() {
    }

    public static byte[] generateRandomBytes(int sizeBytes) {
        byte[] data = new byte[sizeBytes];
        RANDOM.nextBytes(data);
        return data;
    }

    /**
     * Unique upload key so tests sharing a store never collide
     */
    public static String uniqueKey(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + ".bin";
    }
}
