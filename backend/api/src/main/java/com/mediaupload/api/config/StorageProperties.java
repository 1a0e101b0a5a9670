package com.mediaupload.api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * 미디어 저장소 설정 (storage.*)
 * - 프로세스 시작 시 한 번 바인딩되고 이후 변경되지 않음
 * - backend 값으로 활성 저장소 구현체가 결정됨 (요청 처리 중에는 다시 분기하지 않음)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /**
     * 활성 저장소 종류
     */
    public enum Backend {
        LOCAL,
        S3
    }

    private Backend backend = Backend.LOCAL;

    // 업로드 허용 최대 크기 (기본 5MB)
    private DataSize maxFileSize = DataSize.ofMegabytes(5);

    // 저장소 쓰기 제한 시간
    private Duration uploadTimeout = Duration.ofSeconds(30);

    // 동시에 진행되는 저장소 쓰기 수 (파일 디스크립터/아웃바운드 커넥션 보호)
    private int maxConcurrentUploads = 16;

    private Local local = new Local();

    private S3 s3 = new S3();

    @Getter
    @Setter
    public static class Local {
        private String directory = "uploads";
        private String urlPrefix = "uploads";  // 공개 URL: /{urlPrefix}/{key}
    }

    @Getter
    @Setter
    public static class S3 {
        private String bucket;
        private String region = "ap-northeast-2";
        private String endpoint;           // LocalStack/MinIO 등 호환 엔드포인트 (선택)
        private String publicHost;         // 공개 URL 호스트 (미지정 시 s3.{region}.amazonaws.com)
        private String accessKeyId;
        private String secretAccessKey;

        public String resolvePublicHost() {
            if (publicHost != null && !publicHost.isBlank()) {
                return publicHost;
            }
            return "s3." + region + ".amazonaws.com";
        }
    }
}
