package com.ryuqq.wes.core.pagination;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wes.core.error.InvalidPageTokenException;

import java.io.IOException;
import java.util.Base64;

/**
 * 불투명 page token 인코더/디코더.
 *
 * <p>토큰은 위치 정보를 담은 JSON을 URL-safe Base64로 인코딩한 값입니다.</p>
 * <ul>
 *   <li>Run 목록: {@code {"lastSequence": N}} - 마지막으로 반환한 생성 순번</li>
 *   <li>Task 목록: {@code {"offset": N}} - 다음 task의 위치</li>
 * </ul>
 *
 * <p>해석할 수 없는 토큰은 {@link InvalidPageTokenException}으로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PageTokenCodec {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Run 목록 위치 인코딩.
     *
     * @param lastSequence 마지막으로 반환한 순번 (양수)
     * @return page token
     */
    public String encodeSequence(long lastSequence) {
        return encode(new SequenceToken(lastSequence));
    }

    /**
     * Run 목록 위치 디코딩.
     *
     * @param pageToken page token
     * @return 마지막으로 반환한 순번
     * @throws InvalidPageTokenException 토큰이 유효하지 않은 경우
     */
    public long decodeSequence(String pageToken) {
        SequenceToken token = decode(pageToken, SequenceToken.class);
        if (token.lastSequence() <= 0) {
            throw new InvalidPageTokenException("Page token carries no valid position");
        }
        return token.lastSequence();
    }

    /**
     * Task 목록 위치 인코딩.
     *
     * @param offset 다음 task의 위치
     * @return page token
     */
    public String encodeOffset(int offset) {
        return encode(new OffsetToken(offset));
    }

    /**
     * Task 목록 위치 디코딩.
     *
     * @param pageToken page token
     * @return 다음 task의 위치
     * @throws InvalidPageTokenException 토큰이 유효하지 않은 경우
     */
    public int decodeOffset(String pageToken) {
        OffsetToken token = decode(pageToken, OffsetToken.class);
        if (token.offset() <= 0) {
            throw new InvalidPageTokenException("Page token carries no valid position");
        }
        return token.offset();
    }

    private String encode(Object token) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(token);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private <T> T decode(String pageToken, Class<T> tokenClass) {
        if (pageToken == null || pageToken.isBlank()) {
            throw new InvalidPageTokenException("Page token cannot be blank");
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(pageToken);
            return objectMapper.readValue(json, tokenClass);
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidPageTokenException("Invalid page token: " + pageToken, e);
        }
    }

    record SequenceToken(long lastSequence) {
    }

    record OffsetToken(int offset) {
    }
}
