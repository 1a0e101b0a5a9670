package com.mediaupload.api.service.storage;

import com.mediaupload.api.service.upload.UploadErrorKind;
import lombok.Getter;

/**
 * 저장소 쓰기 실패
 * - kind로 권한/네트워크/타임아웃/일반 저장 실패를 구분
 * - compensable=false 이면 해당 키에 이 업로드가 쓴 내용이 없으므로 보상 삭제를 하지 않음
 *   (이미 존재하는 다른 자산의 파일 등)
 */
@Getter
public class StorageException extends RuntimeException {

    private final UploadErrorKind kind;
    private final boolean compensable;

    public StorageException(UploadErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.compensable = true;
    }

    public StorageException(UploadErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, true);
    }

    public StorageException(UploadErrorKind kind, String message, Throwable cause, boolean compensable) {
        super(message, cause);
        this.kind = kind;
        this.compensable = compensable;
    }
}
