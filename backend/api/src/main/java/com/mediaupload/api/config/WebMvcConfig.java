package com.mediaupload.api.config;

import com.mediaupload.api.service.storage.LocalStorageBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 로컬 저장소 파일을 /{urlPrefix}/** 경로로 정적 제공
 * S3 사용 시에는 S3 공개 URL을 그대로 사용하므로 등록하지 않음
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "storage.backend", havingValue = "local", matchIfMissing = true)
public class WebMvcConfig implements WebMvcConfigurer {

    private final LocalStorageBackend localStorageBackend;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String pattern = "/" + localStorageBackend.getUrlPrefix() + "/**";
        String location = "file:" + localStorageBackend.getStorageRoot() + "/";
        registry.addResourceHandler(pattern).addResourceLocations(location);
        log.info("Serving static files from: {} -> {}", pattern, location);
    }
}
