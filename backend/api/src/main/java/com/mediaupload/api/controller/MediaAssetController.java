package com.mediaupload.api.controller;

import com.mediaupload.api.dto.MediaDto;
import com.mediaupload.api.service.storage.DeleteResult;
import com.mediaupload.api.service.upload.UploadOrchestrator;
import com.mediaupload.api.service.upload.UploadRequest;
import com.mediaupload.api.service.upload.UploadResult;
import com.mediaupload.common.dto.ApiResponse;
import com.mediaupload.common.exception.ApiException;
import com.mediaupload.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * 미디어 자산 API
 * 인증/소유권 확인은 앞단에서 끝났다고 가정하고 ownerId를 그대로 신뢰함
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/media")
@Tag(name = "Media", description = "프로필 이미지/커버 사진 업로드 및 삭제 API")
public class MediaAssetController {

    private static final String FALLBACK_CONTENT_TYPE = "application/octet-stream";

    private final UploadOrchestrator uploadOrchestrator;

    @PostMapping(value = "/{ownerId}/assets", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "이미지 업로드", description = "JPEG/PNG/WebP 이미지를 저장하고 공개 URL을 반환합니다.")
    public CompletableFuture<ResponseEntity<ApiResponse<MediaDto.UploadResponse>>> upload(
            @PathVariable String ownerId,
            @RequestPart("file") MultipartFile file) {
        log.info("[Media] Upload - owner: {}, filename: {}, size: {}",
                ownerId, file.getOriginalFilename(), file.getSize());

        UploadRequest request = UploadRequest.of(
                ownerId,
                file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName(),
                file.getContentType() != null ? file.getContentType() : FALLBACK_CONTENT_TYPE,
                readBytes(file));

        return uploadOrchestrator.uploadAsync(request).thenApply(this::toUploadResponse);
    }

    @DeleteMapping("/assets/{key}")
    @Operation(summary = "이미지 삭제", description = "저장 키로 이전 이미지를 삭제합니다. 이미 없는 경우도 성공으로 처리합니다.")
    public ResponseEntity<ApiResponse<MediaDto.DeleteResponse>> deleteAsset(@PathVariable String key) {
        log.info("[Media] Delete - key: {}", key);
        return toDeleteResponse(uploadOrchestrator.deleteAsset(key), ErrorCode.MEDIA_DELETE_FAILED);
    }

    @DeleteMapping(value = "/assets", params = "url")
    @Operation(summary = "URL로 이미지 삭제", description = "프로필에 저장된 공개 URL로 이전 이미지를 삭제합니다.")
    public ResponseEntity<ApiResponse<MediaDto.DeleteResponse>> retireAsset(@RequestParam String url) {
        log.info("[Media] Retire - url: {}", url);
        DeleteResult result = uploadOrchestrator.retireAsset(url);
        // 키를 추출하지 못한 경우는 잘못된 요청
        ErrorCode failureCode = result.key() == null ? ErrorCode.INVALID_REQUEST : ErrorCode.MEDIA_DELETE_FAILED;
        return toDeleteResponse(result, failureCode);
    }

    private ResponseEntity<ApiResponse<MediaDto.UploadResponse>> toUploadResponse(UploadResult result) {
        if (!result.isSuccess()) {
            ErrorCode errorCode = result.getError().getErrorCode();
            return ResponseEntity.status(errorCode.getStatus())
                    .body(ApiResponse.error(errorCode, result.getMessage()));
        }
        return ResponseEntity.ok(ApiResponse.success("파일이 업로드되었습니다.", MediaDto.UploadResponse.from(result)));
    }

    private ResponseEntity<ApiResponse<MediaDto.DeleteResponse>> toDeleteResponse(DeleteResult result,
                                                                                ErrorCode failureCode) {
        if (!result.isSuccess()) {
            return ResponseEntity.status(failureCode.getStatus())
                    .body(ApiResponse.error(failureCode, result.message()));
        }
        return ResponseEntity.ok(ApiResponse.success(result.message(), MediaDto.DeleteResponse.from(result)));
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new ApiException(ErrorCode.INVALID_REQUEST, "Invalid file object received", e);
        }
    }
}
