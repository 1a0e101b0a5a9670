package com.mediaupload.api.service.storage;

import com.mediaupload.api.config.StorageProperties;
import com.mediaupload.api.service.upload.UploadErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectAclRequest;
import software.amazon.awssdk.services.s3.model.PutObjectAclResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.net.ConnectException;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class S3StorageBackendTest {

    @Mock
    private S3Client s3Client;

    private S3StorageBackend backend;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.getS3().setBucket("media-bucket");
        backend = new S3StorageBackend(s3Client, properties);
    }

    private static AssetMetadata metadata() {
        return new AssetMetadata("image/jpeg", "내 사진.jpg", "alice", 3, Instant.parse("2024-05-01T00:00:00Z"));
    }

    @Test
    @DisplayName("put writes the object, then grants public-read on the same key")
    void twoPhasePut() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());
        when(s3Client.putObjectAcl(any(PutObjectAclRequest.class)))
                .thenReturn(PutObjectAclResponse.builder().build());

        backend.put("alice-1.jpg", new byte[]{1, 2, 3}, metadata());

        ArgumentCaptor<PutObjectRequest> put = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(put.capture(), any(RequestBody.class));
        assertEquals("media-bucket", put.getValue().bucket());
        assertEquals("alice-1.jpg", put.getValue().key());
        assertEquals("image/jpeg", put.getValue().contentType());
        assertEquals(3L, put.getValue().contentLength());
        assertEquals("alice", put.getValue().metadata().get("uploadedBy"));
        assertEquals("2024-05-01T00:00:00Z", put.getValue().metadata().get("uploadedAt"));
        assertTrue(put.getValue().metadata().get("originalName").chars().allMatch(c -> c < 128));

        ArgumentCaptor<PutObjectAclRequest> acl = ArgumentCaptor.forClass(PutObjectAclRequest.class);
        verify(s3Client).putObjectAcl(acl.capture());
        assertEquals("alice-1.jpg", acl.getValue().key());
        assertEquals(ObjectCannedACL.PUBLIC_READ, acl.getValue().acl());
    }

    @Test
    @DisplayName("Failure to make the object public fails the put")
    void makePublicFailureRaises() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());
        when(s3Client.putObjectAcl(any(PutObjectAclRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("AccessDenied").build());

        StorageException e = assertThrows(StorageException.class,
                () -> backend.put("alice-1.jpg", new byte[]{1, 2, 3}, metadata()));

        assertEquals(UploadErrorKind.PERMISSION, e.getKind());
    }

    @Test
    void writeFailureSkipsMakePublic() {
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request", new ConnectException("refused")));

        StorageException e = assertThrows(StorageException.class,
                () -> backend.put("alice-1.jpg", new byte[]{1, 2, 3}, metadata()));

        assertEquals(UploadErrorKind.NETWORK, e.getKind());
        verify(s3Client, never()).putObjectAcl(any(PutObjectAclRequest.class));
    }

    @Test
    @DisplayName("SDK exceptions map onto upload error kinds")
    void translateErrorKinds() {
        assertEquals(UploadErrorKind.PERMISSION, S3StorageBackend.translate("x",
                S3Exception.builder().statusCode(403).message("AccessDenied").build()).getKind());
        assertEquals(UploadErrorKind.PERMISSION, S3StorageBackend.translate("x",
                S3Exception.builder().statusCode(401).message("Unauthorized").build()).getKind());
        assertEquals(UploadErrorKind.STORAGE, S3StorageBackend.translate("x",
                S3Exception.builder().statusCode(500).message("InternalError").build()).getKind());
        assertEquals(UploadErrorKind.TIMEOUT, S3StorageBackend.translate("x",
                S3Exception.builder().statusCode(408).message("RequestTimeout").build()).getKind());
        assertEquals(UploadErrorKind.TIMEOUT, S3StorageBackend.translate("x",
                ApiCallTimeoutException.create(1000)).getKind());
        assertEquals(UploadErrorKind.NETWORK, S3StorageBackend.translate("x",
                SdkClientException.create("Unable to execute HTTP request", new ConnectException("refused"))).getKind());
        assertEquals(UploadErrorKind.PERMISSION, S3StorageBackend.translate("x",
                SdkClientException.create("Unable to load credentials from any of the providers in the chain")).getKind());
    }

    @Test
    void deleteIssuesDeleteObject() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
                .thenReturn(DeleteObjectResponse.builder().build());

        DeleteResult result = backend.delete("alice-1.jpg");

        assertEquals(DeleteResult.Outcome.DELETED, result.outcome());
        ArgumentCaptor<DeleteObjectRequest> delete = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(delete.capture());
        assertEquals("media-bucket", delete.getValue().bucket());
        assertEquals("alice-1.jpg", delete.getValue().key());
    }

    @Test
    @DisplayName("Delete failures are reported, not thrown")
    void deleteFailureIsReported() {
        when(s3Client.deleteObject(any(DeleteObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("InternalError").build());

        DeleteResult result = backend.delete("alice-1.jpg");

        assertFalse(result.isSuccess());
        assertEquals(DeleteResult.Outcome.FAILED, result.outcome());
        assertEquals("Failed to delete file from S3", result.message());
    }

    @Test
    void blankKeyDeleteNeverCallsS3() {
        assertEquals(DeleteResult.Outcome.FAILED, backend.delete(" ").outcome());
        verifyNoInteractions(s3Client);
    }

    @Test
    void publicUrlRoundTrip() {
        String url = backend.publicUrl("alice-1.jpg");

        assertEquals("https://s3.ap-northeast-2.amazonaws.com/media-bucket/alice-1.jpg", url);
        assertEquals(Optional.of("alice-1.jpg"), backend.extractKey(url));
        assertTrue(backend.extractKey("https://s3.ap-northeast-2.amazonaws.com/other-bucket/alice-1.jpg").isEmpty());
        assertTrue(backend.extractKey("/uploads/alice-1.jpg").isEmpty());
    }

    @Test
    void publicHostOverride() {
        StorageProperties properties = new StorageProperties();
        properties.getS3().setBucket("media-bucket");
        properties.getS3().setPublicHost("localhost:9000");

        S3StorageBackend minio = new S3StorageBackend(s3Client, properties);

        assertEquals("https://localhost:9000/media-bucket/k.png", minio.publicUrl("k.png"));
    }
}
