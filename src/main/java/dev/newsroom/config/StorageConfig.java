package dev.newsroom.config;

import dev.newsroom.service.media.ArticleMediaSettings;
import dev.newsroom.service.storage.LocalStorageProvider;
import dev.newsroom.service.storage.S3StorageProvider;
import dev.newsroom.service.storage.StorageProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;

import java.net.URI;

/**
 * Where article images and videos live. {@code app.storage.type} picks the backend; both share
 * the key layout of {@link ArticleMediaSettings}, so switching backends keeps stored paths valid.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class StorageConfig {

    @Bean
    public ArticleMediaSettings articleMediaSettings(
            @Value("${app.storage.key-prefix:articles}") String keyPrefix,
            @Value("${app.upload.max-size:52428800}") long maxFileSize) {
        ArticleMediaSettings settings = new ArticleMediaSettings(keyPrefix, maxFileSize);
        log.info("Article media keys under '{}/', max {} bytes per file", settings.keyPrefix(), settings.maxFileSize());
        return settings;
    }

    @Bean
    @ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
    public StorageProvider localStorageProvider(
            @Value("${app.upload.path:uploads}") String uploadPath,
            @Value("${app.site-url:http://localhost:8080}") String siteUrl) {
        log.info("Article media stored on local disk (uploadPath={})", uploadPath);
        return new LocalStorageProvider(uploadPath, siteUrl);
    }

    @Bean
    @ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
    public S3AsyncClient articleMediaS3Client(
            @Value("${app.storage.s3.endpoint:}") String endpoint,
            @Value("${app.storage.s3.access-key:}") String accessKey,
            @Value("${app.storage.s3.secret-key:}") String secretKey,
            @Value("${app.storage.s3.region:auto}") String region,
            @Value("${app.storage.s3.path-style:true}") boolean pathStyle) {
        S3AsyncClientBuilder builder = S3AsyncClient.builder()
                .credentialsProvider(credentials(accessKey, secretKey))
                .region(Region.of(region))
                .forcePathStyle(pathStyle);
        if (!isBlank(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
    public StorageProvider s3StorageProvider(
            S3AsyncClient articleMediaS3Client,
            @Value("${app.storage.s3.bucket:}") String bucket,
            @Value("${app.storage.s3.public-url:}") String publicUrl) {
        requireSetting("app.storage.s3.bucket", bucket);
        requireSetting("app.storage.s3.public-url", publicUrl);
        log.info("Article media stored in S3 (bucket={})", bucket);
        return new S3StorageProvider(articleMediaS3Client, bucket, publicUrl);
    }

    /**
     * Static keys when both are configured, otherwise the SDK default chain (env, profile, instance role).
     */
    static AwsCredentialsProvider credentials(String accessKey, String secretKey) {
        if (isBlank(accessKey) || isBlank(secretKey)) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }

    static void requireSetting(String name, String value) {
        if (isBlank(value)) {
            throw new IllegalStateException(name + " must be set when app.storage.type=s3");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
