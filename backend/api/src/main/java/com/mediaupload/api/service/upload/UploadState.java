package com.mediaupload.api.service.upload;

/**
 * 업로드 1건의 진행 상태
 * VALIDATING → KEY_ASSIGNED → WRITING → (PUBLISHED | COMPENSATING → FAILED)
 */
public enum UploadState {
    VALIDATING,
    KEY_ASSIGNED,
    WRITING,
    PUBLISHED,
    COMPENSATING,
    FAILED
}
