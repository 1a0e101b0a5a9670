package com.mediaupload.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "잘못된 요청입니다."),

    // Media - 업로드 검증
    MEDIA_INVALID_FILE(HttpStatus.BAD_REQUEST, "M001", "업로드할 수 없는 파일입니다."),
    MEDIA_FILE_MISSING(HttpStatus.BAD_REQUEST, "M002", "업로드된 파일이 없습니다."),

    // Media - 저장소
    MEDIA_STORAGE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M011", "파일 저장에 실패했습니다."),
    MEDIA_STORAGE_PERMISSION(HttpStatus.BAD_GATEWAY, "M012", "저장소 접근 권한이 없습니다."),
    MEDIA_STORAGE_NETWORK(HttpStatus.SERVICE_UNAVAILABLE, "M013", "저장소 연결에 실패했습니다. 잠시 후 다시 시도해주세요."),
    MEDIA_STORAGE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "M014", "업로드 시간이 초과되었습니다. 다시 시도해주세요."),
    MEDIA_DELETE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M021", "파일 삭제에 실패했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
