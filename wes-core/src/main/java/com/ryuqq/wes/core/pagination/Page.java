package com.ryuqq.wes.core.pagination;

import java.util.List;

/**
 * 커서 기반 목록 조회의 한 페이지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param items 이 페이지의 항목
 * @param nextPageToken 다음 페이지 토큰 (마지막 페이지면 null)
 * @param <T> 항목 타입
 */
public record Page<T>(List<T> items, String nextPageToken) {

    public Page {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        items = List.copyOf(items);
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), null);
    }

    public boolean hasNextPage() {
        return nextPageToken != null;
    }
}
