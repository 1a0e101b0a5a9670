package com.mediaupload.api.service.storage;

/**
 * 삭제 결과
 * - DELETED, NOT_FOUND 모두 성공으로 취급 (삭제는 멱등)
 * - FAILED는 로그로 남기고 호출자에게 보고만 함
 */
public record DeleteResult(Outcome outcome, String key, String message) {

    public enum Outcome {
        DELETED,
        NOT_FOUND,
        FAILED
    }

    public static DeleteResult deleted(String key) {
        return new DeleteResult(Outcome.DELETED, key, "File deleted successfully");
    }

    public static DeleteResult notFound(String key) {
        return new DeleteResult(Outcome.NOT_FOUND, key, "File not found");
    }

    public static DeleteResult failed(String key, String message) {
        return new DeleteResult(Outcome.FAILED, key, message);
    }

    public boolean isSuccess() {
        return outcome != Outcome.FAILED;
    }
}
