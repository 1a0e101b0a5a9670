package com.mediaupload.api;

import com.mediaupload.api.service.storage.S3StorageBackend;
import com.mediaupload.api.service.storage.StorageBackend;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * storage.backend=s3 설정 시 S3 저장소 선택 (클라이언트 생성만 확인, 네트워크 호출 없음)
 */
@SpringBootTest(properties = {
        "storage.backend=s3",
        "storage.s3.bucket=media-bucket",
        "storage.s3.region=us-east-1",
        "storage.s3.endpoint=http://localhost:4566",
        "storage.s3.public-host=localhost:4566",
        "storage.s3.access-key-id=test",
        "storage.s3.secret-access-key=test",
        "storage.upload-timeout=7s"
})
class S3BackendSelectionTest {

    @Autowired
    StorageBackend storageBackend;

    @Autowired
    S3Client s3Client;

    @Test
    void s3BackendIsSelected() {
        assertNotNull(s3Client);
        assertInstanceOf(S3StorageBackend.class, storageBackend);
        assertEquals("s3", storageBackend.name());
        assertEquals("https://localhost:4566/media-bucket/k.png", storageBackend.publicUrl("k.png"));
    }

    @Test
    void apiCallTimeoutFollowsUploadTimeout() {
        assertEquals(Optional.of(Duration.ofSeconds(7)),
                s3Client.serviceClientConfiguration().overrideConfiguration().apiCallTimeout());
    }
}
