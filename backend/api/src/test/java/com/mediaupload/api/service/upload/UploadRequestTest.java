package com.mediaupload.api.service.upload;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UploadRequestTest {

    @Test
    void sizeIsTakenFromContent() {
        UploadRequest request = UploadRequest.of("alice", "a.png", "image/png", new byte[42]);

        assertEquals(42, request.sizeBytes());
    }

    @Test
    void declaredSizeMustMatchContent() {
        assertThrows(IllegalArgumentException.class,
                () -> new UploadRequest("alice", "a.png", "image/png", 10, new byte[9]));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "../alice", "a/b", "a\\b", "bad!id", "al..ice"})
    void unsafeOwnerIdsRejected(String ownerId) {
        assertThrows(IllegalArgumentException.class,
                () -> UploadRequest.of(ownerId, "a.png", "image/png", new byte[1]));
    }

    @Test
    void missingFieldsRejected() {
        assertThrows(IllegalArgumentException.class, () -> UploadRequest.of(null, "a.png", "image/png", new byte[1]));
        assertThrows(IllegalArgumentException.class, () -> UploadRequest.of("alice", " ", "image/png", new byte[1]));
        assertThrows(IllegalArgumentException.class, () -> UploadRequest.of("alice", "a.png", null, new byte[1]));
        assertThrows(IllegalArgumentException.class, () -> UploadRequest.of("alice", "a.png", "image/png", null));
    }

    @Test
    void toStringOmitsContent() {
        UploadRequest request = UploadRequest.of("alice", "a.png", "image/png", new byte[3]);

        assertFalse(request.toString().contains("content"));
        assertTrue(request.toString().contains("alice"));
    }

    @Test
    void mimeTypeIsNormalised() {
        UploadRequest request = UploadRequest.of("alice", "a.png", " IMAGE/PNG ", new byte[3]);

        assertEquals("image/png", request.mimeType());
    }

    @Test
    void contentIsCopiedFromCallerBuffer() {
        byte[] buffer = {1, 2, 3};
        UploadRequest request = UploadRequest.of("alice", "a.png", "image/png", buffer);

        buffer[0] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, request.content());

        request.content()[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, request.content());
    }

    @Test
    void equalityComparesContent() {
        UploadRequest first = UploadRequest.of("alice", "a.png", "image/png", new byte[]{1, 2, 3});
        UploadRequest second = UploadRequest.of("alice", "a.png", "image/png", new byte[]{1, 2, 3});
        UploadRequest other = UploadRequest.of("alice", "a.png", "image/png", new byte[]{1, 2, 4});

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, other);
    }
}
