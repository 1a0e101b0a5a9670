package com.mediaupload.api.service.upload;

import com.mediaupload.api.config.StorageProperties;
import com.mediaupload.api.service.storage.AssetMetadata;
import com.mediaupload.api.service.storage.DeleteResult;
import com.mediaupload.api.service.storage.StorageBackend;
import com.mediaupload.api.service.storage.StorageException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 미디어 업로드 진입점
 *
 * 처리 순서:
 * 1. AssetValidator 검사 (실패 시 즉시 반환, 저장소 호출 없음)
 * 2. KeyGenerator로 새 키 발급
 * 3. 저장소 쓰기 (제한된 워커 풀 + 타임아웃)
 * 4. 성공 시 공개 URL 반환
 * 5. 키 발급 이후의 모든 실패는 해당 키 삭제로 보상 (보상 실패는 로그만, 원래 에러를 덮지 않음)
 *
 * 자동 재시도는 하지 않음. 재시도는 호출자가 새 upload 호출로 수행 (새 키 발급)
 */
@Slf4j
@Service
public class UploadOrchestrator {

    private final StorageBackend storageBackend;
    private final AssetValidator assetValidator;
    private final KeyGenerator keyGenerator;
    private final Duration uploadTimeout;
    private final ExecutorService storageExecutor;

    @Autowired
    public UploadOrchestrator(StorageBackend storageBackend,
                              AssetValidator assetValidator,
                              KeyGenerator keyGenerator,
                              StorageProperties properties) {
        this(storageBackend, assetValidator, keyGenerator,
                properties.getUploadTimeout(), properties.getMaxConcurrentUploads());
    }

    public UploadOrchestrator(StorageBackend storageBackend,
                              AssetValidator assetValidator,
                              KeyGenerator keyGenerator,
                              Duration uploadTimeout,
                              int maxConcurrentUploads) {
        if (maxConcurrentUploads <= 0) {
            throw new IllegalArgumentException("maxConcurrentUploads must be positive: " + maxConcurrentUploads);
        }
        this.storageBackend = storageBackend;
        this.assetValidator = assetValidator;
        this.keyGenerator = keyGenerator;
        this.uploadTimeout = uploadTimeout;

        AtomicInteger threadCount = new AtomicInteger();
        this.storageExecutor = Executors.newFixedThreadPool(maxConcurrentUploads, r -> {
            Thread t = new Thread(r, "storage-writer-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[Upload] UploadOrchestrator initialized - backend: {}, timeout: {}, maxConcurrentUploads: {}",
                storageBackend.name(), uploadTimeout, maxConcurrentUploads);
    }

    @PreDestroy
    public void shutdown() {
        storageExecutor.shutdown();
        try {
            if (!storageExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                storageExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            storageExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 업로드 (호출 스레드에서 결과까지 대기)
     */
    public UploadResult upload(UploadRequest request) {
        return uploadAsync(request).join();
    }

    /**
     * 업로드 (비동기)
     * 반환된 future는 예외로 완료되지 않으며 실패도 UploadResult로 전달됨
     */
    public CompletableFuture<UploadResult> uploadAsync(UploadRequest request) {
        log.info("[Upload] {} - owner: {}, filename: {}, mimeType: {}, size: {}",
                UploadState.VALIDATING, request.ownerId(), request.originalFilename(),
                request.mimeType(), request.sizeBytes());

        Optional<String> rejection = assetValidator.validate(request);
        if (rejection.isPresent()) {
            log.warn("[Upload] Validation rejected - owner: {}, filename: {}, reason: {}",
                    request.ownerId(), request.originalFilename(), rejection.get());
            return CompletableFuture.completedFuture(
                    UploadResult.failure(UploadErrorKind.VALIDATION, rejection.get()));
        }

        Optional<String> assignedKey = assignKey(request);
        if (assignedKey.isEmpty()) {
            return CompletableFuture.completedFuture(
                    UploadResult.failure(UploadErrorKind.VALIDATION, UploadErrorKind.VALIDATION.getUserMessage()));
        }
        String key = assignedKey.get();
        log.info("[Upload] {} - owner: {}, key: {}", UploadState.KEY_ASSIGNED, request.ownerId(), key);

        AssetMetadata metadata = new AssetMetadata(
                request.mimeType(), request.originalFilename(), request.ownerId(),
                request.sizeBytes(), Instant.now());

        CompletableFuture<Void> write = submitWrite(key, request.content(), metadata);

        return write.copy()
                .orTimeout(uploadTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return published(key, request);
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        return timedOut(key, write);
                    }
                    return fail(key, cause);
                });
    }

    /**
     * 이전 자산 삭제
     * 호출자가 새 참조를 저장한 뒤에 호출해야 함 (참조 갱신 실패 시 유일한 자산이 사라지지 않도록)
     */
    public DeleteResult deleteAsset(String key) {
        if (key == null || key.isBlank()) {
            log.error("[Upload] No filename provided for deletion");
            return DeleteResult.failed(key, "Invalid filename provided");
        }
        try {
            DeleteResult result = storageBackend.delete(key);
            log.info("[Upload] Delete asset - key: {}, outcome: {}", key, result.outcome());
            return result;
        } catch (RuntimeException e) {
            log.error("[Upload] Delete asset failed - key: {}", key, e);
            return DeleteResult.failed(key, "Failed to delete file from " + storageBackend.name() + " storage");
        }
    }

    /**
     * 공개 URL로 이전 자산 삭제 (프로필에 저장된 URL 기준)
     */
    public DeleteResult retireAsset(String publicUrl) {
        Optional<String> key = storageBackend.extractKey(publicUrl);
        if (key.isEmpty()) {
            log.warn("[Upload] URL does not belong to {} storage: {}", storageBackend.name(), publicUrl);
            return DeleteResult.failed(null, "Unrecognized asset URL");
        }
        return deleteAsset(key.get());
    }

    public String publicUrl(String key) {
        return storageBackend.publicUrl(key);
    }

    private Optional<String> assignKey(UploadRequest request) {
        try {
            return Optional.of(keyGenerator.generate(request.ownerId(), request.originalFilename(), request.mimeType()));
        } catch (IllegalArgumentException e) {
            log.warn("[Upload] Key generation rejected - owner: {}, reason: {}", request.ownerId(), e.getMessage());
            return Optional.empty();
        }
    }

    private CompletableFuture<Void> submitWrite(String key, byte[] content, AssetMetadata metadata) {
        try {
            return CompletableFuture.runAsync(() -> {
                log.info("[Upload] {} - key: {}, backend: {}", UploadState.WRITING, key, storageBackend.name());
                storageBackend.put(key, content, metadata);
            }, storageExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private UploadResult published(String key, UploadRequest request) {
        String publicUrl = storageBackend.publicUrl(key);
        log.info("[Upload] {} - owner: {}, key: {}, url: {}",
                UploadState.PUBLISHED, request.ownerId(), key, publicUrl);
        return UploadResult.success(key, publicUrl, request);
    }

    private UploadResult fail(String key, Throwable cause) {
        UploadErrorKind kind = classify(cause);
        log.error("[Upload] Write failed - key: {}, kind: {}", key, kind, cause);
        if (cause instanceof StorageException storageException && !storageException.isCompensable()) {
            log.warn("[Upload] Skipping cleanup, key holds no data from this upload - key: {}", key);
        } else {
            compensate(key);
        }
        log.info("[Upload] {} - key: {}, kind: {}", UploadState.FAILED, key, kind);
        return UploadResult.failure(kind, kind.getUserMessage());
    }

    /**
     * 타임아웃: 결과는 즉시 TIMEOUT으로 반환하고,
     * 보상 삭제는 멈춰 있던 쓰기가 끝난 뒤에 실행 (삭제 후 늦게 도착한 쓰기가 객체를 남기지 않도록)
     */
    private UploadResult timedOut(String key, CompletableFuture<Void> write) {
        log.error("[Upload] Write timed out - key: {}, timeout: {}", key, uploadTimeout);
        write.whenComplete((ignored, error) -> compensate(key));
        log.info("[Upload] {} - key: {}, kind: {}", UploadState.FAILED, key, UploadErrorKind.TIMEOUT);
        return UploadResult.failure(UploadErrorKind.TIMEOUT, UploadErrorKind.TIMEOUT.getUserMessage());
    }

    private void compensate(String key) {
        log.info("[Upload] {} - key: {}", UploadState.COMPENSATING, key);
        try {
            DeleteResult cleanup = storageBackend.delete(key);
            if (cleanup.isSuccess()) {
                log.info("[Upload] Partial file cleaned up - key: {}, outcome: {}", key, cleanup.outcome());
            } else {
                log.error("[Upload] Failed to clean up partial file - key: {}, message: {}", key, cleanup.message());
            }
        } catch (RuntimeException e) {
            log.error("[Upload] Failed to clean up partial file - key: {}", key, e);
        }
    }

    private static UploadErrorKind classify(Throwable cause) {
        if (cause instanceof StorageException storageException) {
            return storageException.getKind();
        }
        if (cause instanceof TimeoutException) {
            return UploadErrorKind.TIMEOUT;
        }
        return UploadErrorKind.UNKNOWN;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
