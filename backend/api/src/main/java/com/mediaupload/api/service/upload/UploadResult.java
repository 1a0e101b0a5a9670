package com.mediaupload.api.service.upload;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 업로드 결과
 * - 성공: key, publicUrl 및 원본 파일 정보
 * - 실패: error, message 만 채워짐
 */
@Getter
@Builder(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UploadResult {

    private final boolean success;
    private final String key;
    private final String publicUrl;
    private final String originalName;
    private final Long sizeBytes;
    private final String mimeType;
    private final UploadErrorKind error;
    private final String message;

    public static UploadResult success(String key, String publicUrl, UploadRequest request) {
        return UploadResult.builder()
                .success(true)
                .key(key)
                .publicUrl(publicUrl)
                .originalName(request.originalFilename())
                .sizeBytes(request.sizeBytes())
                .mimeType(request.mimeType())
                .build();
    }

    public static UploadResult failure(UploadErrorKind error, String message) {
        return UploadResult.builder()
                .success(false)
                .error(error)
                .message(message)
                .build();
    }
}
