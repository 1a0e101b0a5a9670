package com.mediaupload.api.service.upload;

import com.mediaupload.api.config.StorageProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 업로드 파일 정책 검사 (MIME 타입, 크기)
 * I/O 없이 동기적으로 동작하며 키 생성/저장소 호출 전에 실행됨
 */
@Component
public class AssetValidator {

    public static final Set<String> ALLOWED_MIME_TYPES = Set.of("image/jpeg", "image/png", "image/webp");

    static final String INVALID_TYPE_MESSAGE = "Invalid file type. Only JPEG, PNG, and WebP images are allowed.";
    static final String EMPTY_FILE_MESSAGE = "Uploaded file is empty.";

    private static final long KB = 1024L;
    private static final long MB = 1024L * 1024L;

    private final long maxSizeBytes;

    @Autowired
    public AssetValidator(StorageProperties properties) {
        this(properties.getMaxFileSize().toBytes());
    }

    public AssetValidator(long maxSizeBytes) {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("Max file size must be positive: " + maxSizeBytes);
        }
        this.maxSizeBytes = maxSizeBytes;
    }

    /**
     * @return 거부 사유, 통과하면 empty
     */
    public Optional<String> validate(UploadRequest request) {
        String mimeType = request.mimeType().toLowerCase(Locale.ROOT);
        if (!ALLOWED_MIME_TYPES.contains(mimeType)) {
            return Optional.of(INVALID_TYPE_MESSAGE);
        }
        if (request.sizeBytes() <= 0) {
            return Optional.of(EMPTY_FILE_MESSAGE);
        }
        if (request.sizeBytes() > maxSizeBytes) {
            return Optional.of(sizeLimitMessage());
        }
        return Optional.empty();
    }

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    /**
     * 크기 초과 안내 문구 (멀티파트 단계에서 거부된 경우에도 같은 문구 사용)
     */
    public String sizeLimitMessage() {
        return "File size exceeds the " + formatLimit(maxSizeBytes) + " limit.";
    }

    static String formatLimit(long bytes) {
        if (bytes % MB == 0) {
            return (bytes / MB) + "MB";
        }
        if (bytes % KB == 0) {
            return (bytes / KB) + "KB";
        }
        return bytes + " bytes";
    }
}
