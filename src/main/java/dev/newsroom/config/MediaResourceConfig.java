package dev.newsroom.config;

import dev.newsroom.service.media.ArticleMediaSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Serves article media written by the local storage provider at
 * /images/{key-prefix}/{year}/{month}/{filename}. Not registered when media lives in S3.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "app.storage.type", havingValue = "local", matchIfMissing = true)
public class MediaResourceConfig {

    private final ArticleMediaSettings settings;

    @Value("${app.upload.path:uploads}")
    private String uploadPath;

    public MediaResourceConfig(ArticleMediaSettings settings) {
        this.settings = settings;
    }

    @Bean
    public RouterFunction<ServerResponse> mediaRouter() {
        return RouterFunctions.route()
                .GET("/images/" + settings.keyPrefix() + "/{year}/{month}/{filename}", this::serve)
                .build();
    }

    Mono<ServerResponse> serve(ServerRequest request) {
        String filename = request.pathVariable("filename");
        Path uploadRoot = Paths.get(uploadPath).toAbsolutePath().normalize();
        Path resolvedPath = uploadRoot.resolve(Paths.get(settings.keyPrefix(),
                request.pathVariable("year"), request.pathVariable("month"), filename)).normalize();

        // Path traversal protection: resolved path must stay within the upload directory
        if (!resolvedPath.startsWith(uploadRoot)) {
            return ServerResponse.status(HttpStatus.FORBIDDEN).build();
        }

        Resource resource = new FileSystemResource(resolvedPath.toFile());
        if (!resource.exists()) {
            return ServerResponse.notFound().build();
        }

        return ServerResponse.ok()
                .contentType(mediaTypeOf(filename))
                .header("Cache-Control", "public, max-age=31536000")
                .bodyValue(resource);
    }

    static MediaType mediaTypeOf(String filename) {
        String extension = filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "jpg", "jpeg" -> MediaType.IMAGE_JPEG;
            case "png" -> MediaType.IMAGE_PNG;
            case "gif" -> MediaType.IMAGE_GIF;
            case "webp" -> MediaType.parseMediaType("image/webp");
            case "mp4" -> MediaType.parseMediaType("video/mp4");
            case "webm" -> MediaType.parseMediaType("video/webm");
            case "mov" -> MediaType.parseMediaType("video/quicktime");
            default -> MediaType.APPLICATION_OCTET_STREAM;
        };
    }
}
