package win.ixuni.chunkledger.store.s3;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import win.ixuni.chunkledger.core.config.ComponentConfig;
import win.ixuni.chunkledger.core.operation.StoreContext;
import win.ixuni.chunkledger.core.store.AbstractObjectStore;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.chunked.S3AbortChunkedUploadHandler;
import win.ixuni.chunkledger.store.s3.handler.chunked.S3CompleteChunkedUploadHandler;
import win.ixuni.chunkledger.store.s3.handler.chunked.S3StartChunkedUploadHandler;
import win.ixuni.chunkledger.store.s3.handler.chunked.S3UploadChunkHandler;
import win.ixuni.chunkledger.store.s3.handler.object.S3DeleteObjectHandler;
import win.ixuni.chunkledger.store.s3.handler.object.S3GetObjectHandler;
import win.ixuni.chunkledger.store.s3.handler.object.S3PutObjectHandler;
import win.ixuni.chunkledger.store.s3.interceptor.S3ExceptionTranslationInterceptor;

import java.net.URI;

/**
 * S3 object store
 * <p>
 * Talks to any S3-compatible backend (MinIO, AWS S3, Aliyun OSS...) through the async SDK client.
 * All objects live in the configured bucket.
 */
@Slf4j
public class S3ObjectStore extends AbstractObjectStore {

    @Getter
    private final ComponentConfig config;

    private final S3StoreContext context;
    private final S3AsyncClient s3Client;

    public S3ObjectStore(ComponentConfig config) {
        this(config, buildS3Client(config));
    }

    public S3ObjectStore(ComponentConfig config, S3AsyncClient s3Client) {
        this.config = config;
        this.s3Client = s3Client;

        this.context = S3StoreContext.builder()
                .config(config)
                .s3Client(s3Client)
                .bucket(requireBucket(config))
                .build();

        registerHandlers();
        registerInterceptors();
    }

    private static S3AsyncClient buildS3Client(ComponentConfig config) {
        String endpoint = config.getString("endpoint", null);
        String accessKey = config.getString("access-key", "");
        String secretKey = config.getString("secret-key", "");
        String region = config.getString("region", "us-east-1");
        boolean pathStyle = config.getBoolean("path-style", true);

        requireBucket(config);
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("S3 store '{}': no endpoint configured, will use AWS default", config.getName());
        }
        if (accessKey.isBlank() || secretKey.isBlank()) {
            throw new IllegalArgumentException(
                    "S3 store '" + config.getName() + "': access-key and secret-key must be configured");
        }

        var builder = S3AsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey, secretKey)))
                .forcePathStyle(pathStyle);

        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }

        return builder.build();
    }

    private static String requireBucket(ComponentConfig config) {
        String bucket = config.getString("bucket", "");
        if (bucket.isBlank()) {
            throw new IllegalArgumentException(
                    "S3 store '" + config.getName() + "': bucket must be configured");
        }
        return bucket;
    }

    private void registerHandlers() {
        // Object handlers (3)
        getHandlerRegistry().register(new S3PutObjectHandler());
        getHandlerRegistry().register(new S3GetObjectHandler());
        getHandlerRegistry().register(new S3DeleteObjectHandler());

        // Chunked upload handlers (4)
        getHandlerRegistry().register(new S3StartChunkedUploadHandler());
        getHandlerRegistry().register(new S3UploadChunkHandler());
        getHandlerRegistry().register(new S3CompleteChunkedUploadHandler());
        getHandlerRegistry().register(new S3AbortChunkedUploadHandler());

        log.info("Registered {} operation handlers for S3 store", getHandlerRegistry().size());
    }

    private void registerInterceptors() {
        getHandlerRegistry().addInterceptor(new S3ExceptionTranslationInterceptor());
        log.debug("Registered S3 exception translation interceptor");
    }

    /**
     * Public URL of an object.
     * <p>
     * Path-style: {@code <public-url>/<bucket>/<path>}, otherwise {@code <public-url>/<path>}.
     * {@code public-url} falls back to the endpoint.
     */
    public String objectUrl(String path) {
        String base = config.getString("public-url", config.getString("endpoint", ""));
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String objectPath = path.startsWith("/") ? path.substring(1) : path;
        if (config.getBoolean("path-style", true)) {
            return base + "/" + context.getBucket() + "/" + objectPath;
        }
        return base + "/" + objectPath;
    }

    @Override
    public StoreContext getStoreContext() {
        return context;
    }

    @Override
    public String getStoreType() {
        return S3ObjectStoreFactory.STORE_TYPE;
    }

    @Override
    public String getStoreName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing S3 object store: {} -> {}/{}",
                config.getName(),
                config.getString("endpoint", "AWS S3"),
                context.getBucket());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down S3 object store: {}", config.getName());
        s3Client.close();
        return Mono.empty();
    }
}
