package dev.newsroom.service.media;

/**
 * A raw file payload read from a multipart request.
 */
public record MediaUpload(byte[] content, String filename, String mimetype) {

    public boolean hasContent() {
        return content != null && content.length > 0;
    }

    public long size() {
        return content == null ? 0 : content.length;
    }
}
