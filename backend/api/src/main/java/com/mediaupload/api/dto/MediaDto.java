package com.mediaupload.api.dto;

import com.mediaupload.api.service.storage.DeleteResult;
import com.mediaupload.api.service.upload.UploadResult;
import lombok.*;

/**
 * 미디어 업로드/삭제 API DTO
 */
public class MediaDto {

    /**
     * 업로드 성공 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UploadResponse {
        private String key;           // 저장 키 (이전 자산 삭제 시 사용)
        private String url;           // 공개 URL (프로필에 저장할 값)
        private String originalName;
        private Long size;            // bytes
        private String mimeType;

        public static UploadResponse from(UploadResult result) {
            return UploadResponse.builder()
                    .key(result.getKey())
                    .url(result.getPublicUrl())
                    .originalName(result.getOriginalName())
                    .size(result.getSizeBytes())
                    .mimeType(result.getMimeType())
                    .build();
        }
    }

    /**
     * 삭제 응답
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeleteResponse {
        private String key;
        private String outcome;       // "DELETED", "NOT_FOUND"
        private String message;

        public static DeleteResponse from(DeleteResult result) {
            return DeleteResponse.builder()
                    .key(result.key())
                    .outcome(result.outcome().name())
                    .message(result.message())
                    .build();
        }
    }
}
