package com.mediaupload.api.service.storage;

import com.mediaupload.api.config.StorageProperties;
import com.mediaupload.api.service.upload.UploadErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectAclRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * AWS S3 기반 미디어 저장소
 * storage.backend=s3 일 때 사용
 *
 * 저장은 2단계로 진행:
 * 1. PutObject (content-type, 업로더 메타데이터 포함)
 * 2. PutObjectAcl public-read (명시적 공개 설정)
 * 2단계 실패 시 객체는 존재하지만 공개되지 않으므로 업로드 실패로 처리 (호출자가 삭제로 보상)
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.backend", havingValue = "s3")
public class S3StorageBackend implements StorageBackend {

    private final S3Client s3Client;
    private final String bucket;
    private final String urlBase;

    public S3StorageBackend(S3Client s3Client, StorageProperties properties) {
        this.s3Client = s3Client;
        this.bucket = properties.getS3().getBucket();
        this.urlBase = "https://" + properties.getS3().resolvePublicHost() + "/" + bucket + "/";
        log.info("S3StorageBackend initialized - bucket: {}, region: {}, publicBase: {}",
                bucket, properties.getS3().getRegion(), urlBase);
    }

    @Override
    public void put(String key, byte[] content, AssetMetadata metadata) {
        // 1단계: 객체 쓰기
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(metadata.contentType())
                    .contentLength((long) content.length)
                    .metadata(Map.of(
                            // S3 사용자 메타데이터는 US-ASCII만 허용
                            "originalName", URLEncoder.encode(metadata.originalName(), StandardCharsets.UTF_8),
                            "uploadedBy", metadata.ownerId(),
                            "uploadedAt", metadata.uploadedAt().toString()))
                    .build();

            s3Client.putObject(request, RequestBody.fromBytes(content));
            log.info("File uploaded to S3: {}/{} (size: {} bytes)", bucket, key, content.length);
        } catch (SdkException e) {
            log.error("Failed to upload file to S3: {}", key, e);
            throw translate("S3 upload failed", e);
        }

        // 2단계: 공개 설정
        try {
            PutObjectAclRequest aclRequest = PutObjectAclRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .acl(ObjectCannedACL.PUBLIC_READ)
                    .build();

            s3Client.putObjectAcl(aclRequest);
            log.info("File made public on S3: {}/{}", bucket, key);
        } catch (SdkException e) {
            log.error("Failed to make file public on S3: {}", key, e);
            throw translate("S3 make-public failed", e);
        }
    }

    @Override
    public DeleteResult delete(String key) {
        if (key == null || key.isBlank()) {
            return DeleteResult.failed(key, "Invalid filename provided");
        }
        try {
            DeleteObjectRequest request = DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build();

            // S3 DeleteObject는 없는 키에도 성공을 반환함
            s3Client.deleteObject(request);
            log.info("File deleted from S3: {}", key);
            return DeleteResult.deleted(key);
        } catch (SdkException e) {
            log.error("Failed to delete file from S3: {}", key, e);
            return DeleteResult.failed(key, "Failed to delete file from S3");
        }
    }

    @Override
    public String publicUrl(String key) {
        return urlBase + key;
    }

    @Override
    public Optional<String> extractKey(String publicUrl) {
        if (publicUrl == null || !publicUrl.startsWith(urlBase)) {
            return Optional.empty();
        }
        String key = publicUrl.substring(urlBase.length());
        return key.isEmpty() ? Optional.empty() : Optional.of(key);
    }

    @Override
    public String name() {
        return "s3";
    }

    /**
     * SDK 예외를 업로드 실패 분류로 변환
     */
    static StorageException translate(String message, SdkException e) {
        UploadErrorKind kind;
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            kind = UploadErrorKind.TIMEOUT;
        } else if (e instanceof AwsServiceException serviceException) {
            int status = serviceException.statusCode();
            if (status == 401 || status == 403) {
                kind = UploadErrorKind.PERMISSION;
            } else if (status == 408) {
                kind = UploadErrorKind.TIMEOUT;
            } else {
                kind = UploadErrorKind.STORAGE;
            }
        } else if (e instanceof SdkClientException) {
            kind = isCredentialsFailure(e) ? UploadErrorKind.PERMISSION : UploadErrorKind.NETWORK;
        } else {
            kind = UploadErrorKind.STORAGE;
        }
        return new StorageException(kind, message + ": " + e.getMessage(), e);
    }

    private static boolean isCredentialsFailure(SdkException e) {
        // I/O 원인이 있으면 연결 문제로 봄
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return false;
            }
        }
        String message = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        return message.contains("credentials");
    }
}
