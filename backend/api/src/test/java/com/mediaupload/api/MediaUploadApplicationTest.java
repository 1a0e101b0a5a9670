package com.mediaupload.api;

import com.mediaupload.api.config.StorageProperties;
import com.mediaupload.api.service.storage.LocalStorageBackend;
import com.mediaupload.api.service.storage.StorageBackend;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "storage.local.directory=target/test-uploads")
class MediaUploadApplicationTest {

    @Autowired
    StorageBackend storageBackend;

    @Autowired
    StorageProperties storageProperties;

    @Test
    void contextLoadsWithLocalBackendByDefault() {
        assertInstanceOf(LocalStorageBackend.class, storageBackend);
        assertEquals("/uploads/k.png", storageBackend.publicUrl("k.png"));
        assertEquals(StorageProperties.Backend.LOCAL, storageProperties.getBackend());
        assertEquals(DataSize.ofMegabytes(5), storageProperties.getMaxFileSize());
        assertEquals(Duration.ofSeconds(30), storageProperties.getUploadTimeout());
        assertEquals(16, storageProperties.getMaxConcurrentUploads());
    }
}
