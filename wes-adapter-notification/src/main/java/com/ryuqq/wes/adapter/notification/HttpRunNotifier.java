package com.ryuqq.wes.adapter.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wes.application.trigger.RunNotifier;
import com.ryuqq.wes.core.model.RunId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * 알림 채널 HTTP 클라이언트.
 *
 * <p>제출/취소 경로가 별도 프로세스의 리컨실 데몬을 깨울 때 사용합니다.
 * best-effort: 실패는 WARN 로그만 남기고 예외를 던지지 않습니다. 폴링 루프가 최종 보증입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HttpRunNotifier implements RunNotifier {

    private static final Logger log = LoggerFactory.getLogger(HttpRunNotifier.class);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * 설정의 endpoint와 clientTimeoutMs를 사용하는 생성자.
     *
     * @param config 알림 채널 설정
     */
    public HttpRunNotifier(NotificationConfig config) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(config.clientTimeoutMs())).build(),
            config.endpoint(), Duration.ofMillis(config.clientTimeoutMs()));
    }

    /**
     * 생성자.
     *
     * @param httpClient HTTP 클라이언트
     * @param endpoint 알림 URL
     * @param timeout 요청 타임아웃
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public HttpRunNotifier(HttpClient httpClient, URI endpoint, Duration timeout) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    @Override
    public void announce(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(
                    mapper.writeValueAsString(Map.of("run_id", runId.getValue()))))
                .timeout(timeout)
                .build();
        } catch (JsonProcessingException e) {
            log.warn("Failed to build notification for {}", runId, e);
            return;
        }

        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode > 299) {
                log.warn("Notification for {} rejected by {} with status {}", runId, endpoint, statusCode);
                return;
            }
            log.debug("Notified {} for {}", endpoint, runId);
        } catch (HttpTimeoutException e) {
            log.warn("Notification for {} timed out after {}ms", runId, timeout.toMillis());
        } catch (IOException e) {
            log.warn("Notification for {} not delivered to {}: {}", runId, endpoint, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while notifying {} for {}", endpoint, runId);
        }
    }
}
