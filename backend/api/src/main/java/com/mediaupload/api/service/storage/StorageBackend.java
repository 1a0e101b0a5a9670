package com.mediaupload.api.service.storage;

import java.util.Optional;

/**
 * 미디어 저장소 인터페이스
 * S3 또는 로컬 파일 시스템을 추상화
 * 구현체는 여러 업로드에서 동시에 사용되므로 스레드 안전해야 함
 */
public interface StorageBackend {

    /**
     * 파일 저장
     * S3는 쓰기 후 공개 설정까지 완료되어야 성공
     * @param key 저장 키
     * @param content 파일 데이터
     * @param metadata MIME 타입 등 메타데이터
     * @throws StorageException 저장 실패 시
     */
    void put(String key, byte[] content, AssetMetadata metadata);

    /**
     * 파일 삭제 (멱등)
     * @param key 저장 키
     * @return 삭제 결과 (실패도 예외 대신 결과로 반환)
     */
    DeleteResult delete(String key);

    /**
     * 공개 URL 생성 (네트워크 호출 없음)
     * @param key 저장 키
     * @return 공개 URL
     */
    String publicUrl(String key);

    /**
     * 공개 URL에서 저장 키 추출
     * @param publicUrl 이 저장소가 발급한 공개 URL
     * @return 저장 키, 이 저장소의 URL이 아니면 empty
     */
    Optional<String> extractKey(String publicUrl);

    /**
     * 로그용 저장소 이름
     */
    String name();
}
