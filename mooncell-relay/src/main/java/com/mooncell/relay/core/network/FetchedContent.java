package com.mooncell.relay.core.network;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchedContent {

    public enum Type {
        TEXT,
        MEDIA
    }

    private Type type;
    private String text;
    private Path file;       // 仅 MEDIA
    private String mediaType; // video / photo / document ...
    private String caption;
    private long sizeBytes;

    public static FetchedContent text(String text) {
        return FetchedContent.builder()
                .type(Type.TEXT)
                .text(text)
                .sizeBytes(text == null ? 0 : text.getBytes(StandardCharsets.UTF_8).length)
                .build();
    }

    public static FetchedContent media(Path file, String mediaType, long sizeBytes) {
        return FetchedContent.builder()
                .type(Type.MEDIA)
                .file(file)
                .mediaType(mediaType)
                .sizeBytes(sizeBytes)
                .build();
    }
}
