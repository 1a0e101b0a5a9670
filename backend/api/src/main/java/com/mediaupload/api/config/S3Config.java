package com.mediaupload.api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * S3 클라이언트 설정
 * - storage.backend=s3 일 때만 생성
 * - access key가 설정되어 있으면 정적 자격증명, 없으면 기본 자격증명 체인 사용
 * - endpoint가 지정되면 path-style 접근으로 전환 (LocalStack, MinIO)
 * - API 호출 제한 시간은 storage.upload-timeout (멈춘 요청이 워커 스레드를 계속 점유하지 않도록)
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "storage.backend", havingValue = "s3")
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(StorageProperties properties) {
        StorageProperties.S3 s3 = properties.getS3();
        if (s3.getBucket() == null || s3.getBucket().isBlank()) {
            throw new IllegalStateException("storage.s3.bucket must be set when storage.backend=s3");
        }

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(credentialsProvider(s3))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(properties.getUploadTimeout())
                        .build());

        boolean customEndpoint = s3.getEndpoint() != null && !s3.getEndpoint().isBlank();
        if (customEndpoint) {
            builder.endpointOverride(URI.create(s3.getEndpoint()))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }

        log.info("S3Client initialized - bucket: {}, region: {}, endpoint: {}, apiCallTimeout: {}",
                s3.getBucket(), s3.getRegion(), customEndpoint ? s3.getEndpoint() : "default",
                properties.getUploadTimeout());
        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider(StorageProperties.S3 s3) {
        if (s3.getAccessKeyId() != null && !s3.getAccessKeyId().isBlank()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
