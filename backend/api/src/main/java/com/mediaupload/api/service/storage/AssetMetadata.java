package com.mediaupload.api.service.storage;

import java.time.Instant;

/**
 * 저장소에 함께 기록되는 파일 메타데이터
 */
public record AssetMetadata(
        String contentType,
        String originalName,
        String ownerId,
        long sizeBytes,
        Instant uploadedAt
) {
}
