package win.ixuni.chunkledger.store.s3.handler.chunked;

import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import win.ixuni.chunkledger.core.exception.InvalidUploadArgumentException;
import win.ixuni.chunkledger.core.model.StoredObject;
import win.ixuni.chunkledger.core.operation.chunked.CompleteChunkedUploadOperation;
import win.ixuni.chunkledger.core.util.UploadValidationUtils;
import win.ixuni.chunkledger.store.s3.context.S3StoreContext;
import win.ixuni.chunkledger.store.s3.handler.AbstractS3Handler;

import java.time.Instant;
import java.util.Comparator;

/**
 * S3 complete-chunked-upload handler (CompleteMultipartUpload)
 * <p>
 * S3 rejects part lists that are not in ascending order, so the list is sorted once more here.
 */
public class S3CompleteChunkedUploadHandler
        extends AbstractS3Handler<CompleteChunkedUploadOperation, StoredObject> {

    @Override
    protected Mono<StoredObject> doHandle(CompleteChunkedUploadOperation operation, S3StoreContext ctx) {
        String error = UploadValidationUtils.validateUploadId(operation.getUploadId());
        if (error == null && (operation.getParts() == null || operation.getParts().isEmpty())) {
            error = "No completed parts, nothing to upload";
        }
        if (error != null) {
            return Mono.error(new InvalidUploadArgumentException(error));
        }

        var completedParts = operation.getParts().stream()
                .sorted(Comparator.comparingInt(win.ixuni.chunkledger.core.model.CompletedPart::getPartNumber))
                .map(p -> CompletedPart.builder()
                        .partNumber(p.getPartNumber())
                        .eTag(p.getEtag())
                        .build())
                .toList();

        var request = CompleteMultipartUploadRequest.builder()
                .bucket(ctx.getBucket())
                .key(operation.getPath())
                .uploadId(operation.getUploadId())
                .multipartUpload(CompletedMultipartUpload.builder()
                        .parts(completedParts)
                        .build())
                .build();

        return Mono.fromFuture(() -> ctx.getS3Client().completeMultipartUpload(request))
                .map(response -> StoredObject.builder()
                        .path(operation.getPath())
                        .etag(unquote(response.eTag()))
                        .lastModified(Instant.now())
                        .build());
    }

    @Override
    public Class<CompleteChunkedUploadOperation> getOperationType() {
        return CompleteChunkedUploadOperation.class;
    }
}
