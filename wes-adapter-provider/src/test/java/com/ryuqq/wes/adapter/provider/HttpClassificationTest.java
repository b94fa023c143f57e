package com.ryuqq.wes.adapter.provider;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class HttpClassificationTest {

    @ParameterizedTest
    @ValueSource(ints = {401, 403, 408, 429, 500, 502, 503, 504})
    void 일시적_상태코드(int statusCode) {
        assertThat(AbstractHttpProviderAdapter.isTransient(statusCode)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 202, 400, 404, 409, 422})
    void 일시적이지_않은_상태코드(int statusCode) {
        assertThat(AbstractHttpProviderAdapter.isTransient(statusCode)).isFalse();
    }
}
