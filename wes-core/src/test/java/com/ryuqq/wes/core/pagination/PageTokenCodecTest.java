package com.ryuqq.wes.core.pagination;

import com.ryuqq.wes.core.error.InvalidPageTokenException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PageTokenCodec 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PageTokenCodecTest {

    private final PageTokenCodec codec = new PageTokenCodec();

    @Test
    void decodeSequence_EncodedToken_ReturnsPosition() {
        // Given
        String token = codec.encodeSequence(42L);

        // When & Then
        assertEquals(42L, codec.decodeSequence(token));
    }

    @Test
    void encodeSequence_IsUrlSafe() {
        // When
        String token = codec.encodeSequence(Long.MAX_VALUE);

        // Then
        assertTrue(token.matches("^[A-Za-z0-9_-]+$"), token);
    }

    @Test
    void decodeSequence_Garbage_ThrowsInvalidPageToken() {
        // When & Then
        assertThrows(InvalidPageTokenException.class, () -> codec.decodeSequence("not a token!"));
        assertThrows(InvalidPageTokenException.class, () -> codec.decodeSequence("   "));
    }

    @Test
    void decodeSequence_JsonWithoutPosition_ThrowsInvalidPageToken() {
        // Given
        String token = Base64.getUrlEncoder().encodeToString("{}".getBytes(StandardCharsets.UTF_8));

        // When & Then
        assertThrows(InvalidPageTokenException.class, () -> codec.decodeSequence(token));
    }

    @Test
    void decodeSequence_UnknownField_ThrowsInvalidPageToken() {
        // Given
        String token = Base64.getUrlEncoder()
            .encodeToString("{\"offset\":3}".getBytes(StandardCharsets.UTF_8));

        // When & Then
        assertThrows(InvalidPageTokenException.class, () -> codec.decodeSequence(token));
    }

    @Test
    void decodeOffset_EncodedToken_ReturnsOffset() {
        // When & Then
        assertEquals(7, codec.decodeOffset(codec.encodeOffset(7)));
    }
}
