package com.mediaupload.api.config;

import com.mediaupload.api.service.upload.AssetValidator;
import com.mediaupload.common.dto.ApiResponse;
import com.mediaupload.common.exception.ApiException;
import com.mediaupload.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.UUID;

/**
 * 전역 예외 처리기
 * - 모든 예외를 ApiResponse 형식으로 변환
 * - 스택 트레이스는 서버 로그에만 기록하고 응답에는 요청 ID만 포함
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final AssetValidator assetValidator;

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        log.error("[{}] API exception - code: {} ({}), message: {}, uri: {}",
                requestId, errorCode.getCode(), errorCode.name(), e.getMessage(),
                request.getDescription(false), e);

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, e.getMessage(), requestId));
    }

    /**
     * 파일 파트 누락
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(MissingServletRequestPartException e,
                                                              WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] No file uploaded - part: {}, uri: {}",
                requestId, e.getRequestPartName(), request.getDescription(false));

        return ResponseEntity
                .status(ErrorCode.MEDIA_FILE_MISSING.getStatus())
                .body(ApiResponse.error(ErrorCode.MEDIA_FILE_MISSING, "No file uploaded", requestId));
    }

    /**
     * 멀티파트 크기 제한 초과 (컨테이너 단계에서 거부된 경우)
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSize(MaxUploadSizeExceededException e,
                                                                WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] Multipart size limit exceeded - maxUploadSize: {}, uri: {}",
                requestId, e.getMaxUploadSize(), request.getDescription(false));

        return ResponseEntity
                .status(ErrorCode.MEDIA_INVALID_FILE.getStatus())
                .body(ApiResponse.error(ErrorCode.MEDIA_INVALID_FILE, assetValidator.sizeLimitMessage(), requestId));
    }

    /**
     * 요청 값 오류 (UploadRequest 생성 실패 등)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] Invalid request - message: {}, uri: {}",
                requestId, e.getMessage(), request.getDescription(false));

        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST, e.getMessage(), requestId));
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Unexpected Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Exception Type: {}", e.getClass().getName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("============================");

        String userMessage = String.format(
                "서버 오류가 발생했습니다. [요청 ID: %s] 문제가 지속되면 관리자에게 문의해주세요.",
                requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage, requestId));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
