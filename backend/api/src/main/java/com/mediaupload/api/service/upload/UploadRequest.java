package com.mediaupload.api.service.upload;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 업로드 요청
 * - 컨트롤러 등 경계에서 생성되며 생성 시점에 구조적 유효성을 검사함
 * - ownerId는 인증/권한 확인이 끝난 값이어야 함 (이 서비스는 권한을 검사하지 않음)
 * - mimeType은 소문자로 정규화되어 저장됨
 * - content는 생성 시 복사되며 호출자의 버퍼와 공유하지 않음
 */
public record UploadRequest(
        String ownerId,
        String originalFilename,
        String mimeType,
        long sizeBytes,
        byte[] content
) {

    // 저장 키의 접두어로 쓰이므로 경로 구분자를 허용하지 않음
    private static final Pattern OWNER_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,128}$");

    public UploadRequest {
        if (ownerId == null || !OWNER_ID_PATTERN.matcher(ownerId).matches() || ownerId.contains("..")) {
            throw new IllegalArgumentException("Invalid owner id");
        }
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new IllegalArgumentException("Original filename is required");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("MIME type is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("File content is required");
        }
        if (sizeBytes != content.length) {
            throw new IllegalArgumentException(
                    "Declared size " + sizeBytes + " does not match content length " + content.length);
        }
        mimeType = mimeType.trim().toLowerCase(Locale.ROOT);
        content = content.clone();
    }

    /**
     * 내용 사본 반환
     */
    @Override
    public byte[] content() {
        return content.clone();
    }

    public static UploadRequest of(String ownerId, String originalFilename, String mimeType, byte[] content) {
        return new UploadRequest(ownerId, originalFilename, mimeType,
                content != null ? content.length : -1, content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UploadRequest other)) {
            return false;
        }
        return sizeBytes == other.sizeBytes
                && ownerId.equals(other.ownerId)
                && originalFilename.equals(other.originalFilename)
                && mimeType.equals(other.mimeType)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(ownerId, originalFilename, mimeType, sizeBytes) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "UploadRequest[ownerId=" + ownerId + ", originalFilename=" + originalFilename
                + ", mimeType=" + mimeType + ", sizeBytes=" + sizeBytes + "]";
    }
}
