/**
 * S3 object store
 * <p>
 * Runs chunked uploads against any S3-compatible service (AWS S3, MinIO, DigitalOcean Spaces, ...)
 * through the AWS SDK v2 async client.
 */
package win.ixuni.chunkledger.store.s3;
