package dev.newsroom.dto;

import dev.newsroom.entity.MediaFile;

public record MediaFileResponse(String id, String url) {

    public static MediaFileResponse from(MediaFile file) {
        return file == null ? null : new MediaFileResponse(file.getId(), file.getUrl());
    }
}
