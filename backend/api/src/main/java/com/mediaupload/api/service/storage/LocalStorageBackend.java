package com.mediaupload.api.service.storage;

import com.mediaupload.api.config.StorageProperties;
import com.mediaupload.api.service.upload.UploadErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * 로컬 파일 시스템 기반 저장소
 * storage.backend=local (기본값) 일 때 사용
 * 공개 URL은 /{urlPrefix}/{key} 형태이며 정적 리소스 핸들러(WebMvcConfig)가 제공
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "storage.backend", havingValue = "local", matchIfMissing = true)
public class LocalStorageBackend implements StorageBackend {

    private final Path storageRoot;
    private final String urlPrefix;

    @Autowired
    public LocalStorageBackend(StorageProperties properties) {
        this(Paths.get(properties.getLocal().getDirectory()), properties.getLocal().getUrlPrefix());
    }

    public LocalStorageBackend(Path storageRoot, String urlPrefix) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        this.urlPrefix = trimSlashes(urlPrefix);
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalStorageBackend initialized - path: {}, urlPrefix: /{}", this.storageRoot, this.urlPrefix);
        } catch (IOException e) {
            // 첫 쓰기 시점에 다시 생성을 시도함
            log.warn("Failed to create local storage directory at startup: {} ({})", this.storageRoot, e.getMessage());
        }
    }

    @Override
    public void put(String key, byte[] content, AssetMetadata metadata) {
        Path filePath = resolve(key);
        try {
            Files.createDirectories(filePath.getParent());
            // 새로 생성된 고유 키에만 쓰므로 CREATE_NEW로 덮어쓰기를 막음
            Files.write(filePath, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.info("File saved locally: {} ({} bytes, type={})", filePath, content.length, metadata.contentType());
        } catch (AccessDeniedException e) {
            log.error("Permission denied writing local file: {}", key, e);
            throw new StorageException(UploadErrorKind.PERMISSION, "Local storage permission denied: " + key, e);
        } catch (FileAlreadyExistsException e) {
            log.error("Local file already exists: {}", key);
            throw new StorageException(UploadErrorKind.STORAGE, "Local file already exists: " + key, e, false);
        } catch (IOException e) {
            log.error("Failed to save file locally: {}", key, e);
            throw new StorageException(UploadErrorKind.STORAGE, "Local storage failed: " + e.getMessage(), e);
        }
    }

    @Override
    public DeleteResult delete(String key) {
        try {
            Path filePath = resolve(key);
            if (Files.deleteIfExists(filePath)) {
                log.info("File deleted locally: {}", key);
                return DeleteResult.deleted(key);
            }
            log.warn("File not found for deletion: {}", key);
            return DeleteResult.notFound(key);
        } catch (StorageException e) {
            return DeleteResult.failed(key, "Invalid filename provided");
        } catch (IOException e) {
            log.error("Failed to delete local file: {}", key, e);
            return DeleteResult.failed(key, "Failed to delete file from local storage");
        }
    }

    @Override
    public String publicUrl(String key) {
        return "/" + urlPrefix + "/" + key;
    }

    @Override
    public Optional<String> extractKey(String publicUrl) {
        if (publicUrl == null) {
            return Optional.empty();
        }
        String prefix = "/" + urlPrefix + "/";
        int index = publicUrl.indexOf(prefix);
        // 상대 경로(/uploads/..) 또는 절대 URL(http://host/uploads/..) 모두 허용
        if (index < 0 || (index > 0 && !publicUrl.startsWith("http"))) {
            return Optional.empty();
        }
        String key = publicUrl.substring(index + prefix.length());
        if (key.isEmpty() || key.contains("/")) {
            return Optional.empty();
        }
        return Optional.of(key);
    }

    @Override
    public String name() {
        return "local";
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    public String getUrlPrefix() {
        return urlPrefix;
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException(UploadErrorKind.STORAGE, "Storage key is empty");
        }
        // Path traversal 방지
        Path resolved = storageRoot.resolve(key).normalize();
        if (!resolved.startsWith(storageRoot) || resolved.equals(storageRoot)) {
            log.warn("Path traversal attempt detected: {}", key);
            throw new StorageException(UploadErrorKind.STORAGE, "Storage key outside storage root: " + key);
        }
        return resolved;
    }

    private static String trimSlashes(String value) {
        String trimmed = value == null ? "" : value.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? "uploads" : trimmed;
    }
}
