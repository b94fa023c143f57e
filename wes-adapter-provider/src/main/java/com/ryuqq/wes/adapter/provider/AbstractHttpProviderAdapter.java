package com.ryuqq.wes.adapter.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.spi.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * REST 기반 Provider 어댑터 공통 클래스.
 *
 * <p>java.net.http HttpClient와 Jackson으로 JSON API를 호출하고, HTTP 결과를 Provider 예외로 분류합니다.</p>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <pre>
 * 2xx                          성공
 * 401, 403, 408, 429, 5xx      ProviderUnavailableException (일시적)
 * IOException, 타임아웃, 인터럽트  ProviderUnavailableException (일시적)
 * 404 (상태 조회)               ProviderRunNotFoundException (영구)
 * 그 외 4xx (제출)              ProviderSubmissionException (영구)
 * 그 외 4xx (취소)              false 반환
 * </pre>
 *
 * <p>하위 클래스는 인증 헤더({@link #authorize(HttpRequest.Builder)})와 API 매핑만 구현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProviderAdapter.class);

    protected final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * 생성자.
     *
     * @param httpClient HTTP 클라이언트
     * @param mapper JSON 매퍼
     * @param requestTimeout 요청 타임아웃
     * @throws IllegalArgumentException 파라미터가 null이거나 타임아웃이 양수가 아닌 경우
     */
    protected AbstractHttpProviderAdapter(HttpClient httpClient, ObjectMapper mapper, Duration requestTimeout) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * 요청에 인증 정보를 추가합니다.
     *
     * @param builder 요청 빌더
     */
    protected abstract void authorize(HttpRequest.Builder builder);

    // ============================================================
    // Calls
    // ============================================================

    /**
     * 제출용 POST.
     *
     * @param uri 요청 URI
     * @param body JSON으로 직렬화할 본문
     * @return 응답 JSON
     * @throws ProviderSubmissionException 백엔드가 요청을 거부한 경우
     * @throws ProviderUnavailableException 일시적 실패
     */
    protected JsonNode submitRequest(URI uri, Object body)
        throws ProviderSubmissionException, ProviderUnavailableException {
        HttpResponse<String> response = exchange(post(uri, body));
        int statusCode = response.statusCode();
        if (!isSuccess(statusCode)) {
            throw new ProviderSubmissionException(String.format(
                "%s rejected submission with HTTP %d: %s", providerType(), statusCode, abbreviate(response.body())
            ));
        }
        // 2xx면 이미 수락된 제출: 본문 오류는 일시적 실패가 아님
        try {
            return parse(response.body());
        } catch (JsonProcessingException e) {
            throw new ProviderSubmissionException(String.format(
                "%s accepted submission but returned malformed JSON: %s",
                providerType(), abbreviate(response.body())
            ), e);
        }
    }

    /**
     * 상태 조회용 GET.
     *
     * @param uri 요청 URI
     * @param handle 외부 핸들 (404 메시지용)
     * @return 응답 JSON
     * @throws ProviderRunNotFoundException 404인 경우
     * @throws ProviderUnavailableException 일시적 실패 또는 예상하지 못한 응답
     */
    protected JsonNode statusRequest(URI uri, String handle)
        throws ProviderRunNotFoundException, ProviderUnavailableException {
        HttpResponse<String> response = exchange(get(uri));
        int statusCode = response.statusCode();
        if (statusCode == 404) {
            throw new ProviderRunNotFoundException(handle);
        }
        if (!isSuccess(statusCode)) {
            throw new ProviderUnavailableException(String.format(
                "%s status lookup failed with HTTP %d", providerType(), statusCode
            ));
        }
        return readBody(response);
    }

    /**
     * 취소 요청.
     *
     * @param request 요청 빌더 (메서드와 본문 포함)
     * @param handle 외부 핸들
     * @return 백엔드가 수락하면 true, 거부하면 false
     * @throws ProviderUnavailableException 일시적 실패
     */
    protected boolean cancelRequest(HttpRequest.Builder request, String handle) throws ProviderUnavailableException {
        HttpResponse<String> response = exchange(request);
        int statusCode = response.statusCode();
        if (isSuccess(statusCode)) {
            return true;
        }
        log.warn("{} refused to cancel {} with HTTP {}: {}",
            providerType(), handle, statusCode, abbreviate(response.body()));
        return false;
    }

    protected HttpRequest.Builder get(URI uri) {
        return HttpRequest.newBuilder(uri).GET();
    }

    protected HttpRequest.Builder post(URI uri, Object body) {
        return HttpRequest.newBuilder(uri)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(toJson(body)));
    }

    protected HttpRequest.Builder put(URI uri, Object body) {
        return HttpRequest.newBuilder(uri)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(toJson(body)));
    }

    /**
     * 요청을 보내고 일시적 실패를 분류합니다.
     *
     * <p>성공과 영구 실패 응답은 호출자가 판단하도록 그대로 반환합니다.</p>
     */
    private HttpResponse<String> exchange(HttpRequest.Builder builder) throws ProviderUnavailableException {
        builder.header("Accept", "application/json").timeout(requestTimeout);
        authorize(builder);
        HttpRequest request = builder.build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderUnavailableException(String.format(
                "%s %s %s timed out after %dms",
                providerType(), request.method(), request.uri().getPath(), requestTimeout.toMillis()
            ), e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(String.format(
                "%s %s %s failed: %s", providerType(), request.method(), request.uri().getPath(), e
            ), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(providerType() + " call interrupted", e);
        }

        int statusCode = response.statusCode();
        if (isTransient(statusCode)) {
            throw new ProviderUnavailableException(String.format(
                "%s %s %s returned HTTP %d", providerType(), request.method(), request.uri().getPath(), statusCode
            ));
        }
        log.debug("{} {} {} → {}", providerType(), request.method(), request.uri().getPath(), statusCode);
        return response;
    }

    // ============================================================
    // Helpers
    // ============================================================

    static boolean isTransient(int statusCode) {
        return statusCode == 401 || statusCode == 403 || statusCode == 408 || statusCode == 429
            || statusCode >= 500;
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode <= 299;
    }

    private JsonNode readBody(HttpResponse<String> response) throws ProviderUnavailableException {
        try {
            return parse(response.body());
        } catch (JsonProcessingException e) {
            throw new ProviderUnavailableException(providerType() + " returned malformed JSON", e);
        }
    }

    private JsonNode parse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(body);
    }

    private String toJson(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 텍스트 필드 조회.
     *
     * @return 값이 없거나 null이면 null
     */
    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * ISO-8601 시각 필드 조회.
     *
     * @return 값이 없거나 파싱할 수 없으면 null
     */
    protected static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp {}={}", field, value);
            return null;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
