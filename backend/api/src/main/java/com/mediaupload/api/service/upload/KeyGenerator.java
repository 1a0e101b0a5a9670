package com.mediaupload.api.service.upload;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 저장 키 생성: {ownerId}-{UUID}.{확장자}
 * - 랜덤 UUID를 사용하므로 같은 밀리초의 동시 업로드에서도 충돌하지 않음
 * - 확장자는 MIME 타입별 허용 목록에 있을 때만 원본 파일명을 따르고, 아니면 대표 확장자 사용
 */
@Component
public class KeyGenerator {

    // 첫 번째 값이 대표 확장자
    private static final Map<String, List<String>> EXTENSIONS_BY_MIME_TYPE = Map.of(
            "image/jpeg", List.of("jpg", "jpeg"),
            "image/png", List.of("png"),
            "image/webp", List.of("webp")
    );

    public String generate(String ownerId, String originalFilename, String mimeType) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required");
        }
        return ownerId + "-" + UUID.randomUUID() + "." + resolveExtension(originalFilename, mimeType);
    }

    String resolveExtension(String originalFilename, String mimeType) {
        List<String> allowed = EXTENSIONS_BY_MIME_TYPE.get(
                mimeType != null ? mimeType.toLowerCase(Locale.ROOT) : "");
        if (allowed == null) {
            throw new IllegalArgumentException("Unsupported MIME type: " + mimeType);
        }
        String extension = extensionOf(originalFilename);
        return allowed.contains(extension) ? extension : allowed.get(0);
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
