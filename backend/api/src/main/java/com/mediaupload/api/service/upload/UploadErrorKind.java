package com.mediaupload.api.service.upload;

import com.mediaupload.common.exception.ErrorCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 업로드 실패 분류
 * - userMessage는 호출자에게 그대로 노출되는 고정 문구 (저장소 원본 에러 메시지는 로그에만 남김)
 */
@Getter
@RequiredArgsConstructor
public enum UploadErrorKind {

    VALIDATION("Invalid file data", ErrorCode.MEDIA_INVALID_FILE),
    STORAGE("Failed to store file in storage", ErrorCode.MEDIA_STORAGE_FAILED),
    PERMISSION("Insufficient permissions", ErrorCode.MEDIA_STORAGE_PERMISSION),
    NETWORK("Network error while uploading", ErrorCode.MEDIA_STORAGE_NETWORK),
    TIMEOUT("Upload operation timed out", ErrorCode.MEDIA_STORAGE_TIMEOUT),
    UNKNOWN("Failed to upload file", ErrorCode.INTERNAL_SERVER_ERROR);

    private final String userMessage;
    private final ErrorCode errorCode;
}
