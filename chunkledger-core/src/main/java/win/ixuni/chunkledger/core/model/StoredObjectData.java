package win.ixuni.chunkledger.core.model;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Object metadata plus its content stream
 */
@Data
@Builder
public class StoredObjectData {

    private StoredObject metadata;

    /**
     * Object content stream (reactive)
     */
    private Flux<ByteBuffer> content;

    /**
     * Drain the content stream into a byte array
     */
    public Mono<byte[]> contentAsBytes() {
        return content
                .reduce(new ByteArrayOutputStream(), (baos, buf) -> {
                    byte[] bytes = new byte[buf.remaining()];
                    buf.get(bytes);
                    baos.write(bytes, 0, bytes.length);
                    return baos;
                })
                .map(ByteArrayOutputStream::toByteArray)
                .defaultIfEmpty(new byte[0]);
    }
}
