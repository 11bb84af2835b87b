package dev.newsroom.service.storage;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * S3-compatible storage provider.
 * Works with AWS S3, MinIO (local dev), and Cloudflare R2. Cancelling the returned Mono cancels
 * the underlying SDK future.
 */
@Slf4j
public class S3StorageProvider implements StorageProvider {

    private final S3AsyncClient s3Client;
    private final String bucket;
    private final String publicUrl;

    /**
     * @param s3Client  the async S3 client
     * @param bucket    the bucket name
     * @param publicUrl the public base URL for accessing objects (CDN URL or MinIO public endpoint)
     */
    public S3StorageProvider(S3AsyncClient s3Client, String bucket, String publicUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.publicUrl = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        log.info("S3StorageProvider initialized: bucket={}, publicUrl={}", bucket, this.publicUrl);
    }

    @Override
    public Mono<String> store(String key, byte[] data, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) data.length)
                .cacheControl("public, max-age=31536000") // keys are immutable
                .build();

        return Mono.fromFuture(() -> s3Client.putObject(request, AsyncRequestBody.fromBytes(data)))
                .map(response -> {
                    log.info("File stored in S3: bucket={}, key={}, size={} bytes", bucket, key, data.length);
                    return getUrl(key);
                });
    }

    @Override
    public Mono<Void> delete(String key) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        return Mono.fromFuture(() -> s3Client.deleteObject(request))
                .doOnSuccess(response -> log.info("File deleted from S3: bucket={}, key={}", bucket, key))
                .then();
    }

    @Override
    public String getUrl(String key) {
        return publicUrl + "/" + key;
    }

    @Override
    public String getType() {
        return "S3";
    }
}
