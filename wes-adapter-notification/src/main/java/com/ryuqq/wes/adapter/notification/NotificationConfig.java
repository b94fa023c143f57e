package com.ryuqq.wes.adapter.notification;

import java.net.URI;

/**
 * 알림 채널 설정 (불변 record).
 *
 * <p>서버({@link NotificationServer})와 클라이언트({@link HttpRunNotifier})가 같은 설정을 공유합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>host: 바인드/접속 호스트 (기본 localhost)</li>
 *   <li>port: 포트 (기본 5001, 0이면 서버가 임의 포트 사용)</li>
 *   <li>path: 알림 경로 (기본 /notify)</li>
 *   <li>maxContentLength: 요청 본문 최대 크기 (기본 65536 bytes)</li>
 *   <li>clientTimeoutMs: 클라이언트 요청 타임아웃 (기본 5000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param host 호스트
 * @param port 포트 (0 ~ 65535)
 * @param path '/'로 시작하는 경로
 * @param maxContentLength 본문 최대 크기 (양수)
 * @param clientTimeoutMs 클라이언트 타임아웃 (밀리초, 양수)
 */
public record NotificationConfig(
    String host,
    int port,
    String path,
    int maxContentLength,
    long clientTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: host=localhost, port=5001, path=/notify, maxContentLength=65536, clientTimeoutMs=5000</p>
     */
    public NotificationConfig() {
        this("localhost", 5001, "/notify", 64 * 1024, 5_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public NotificationConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535 (current: " + port + ")");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/' (current: " + path + ")");
        }
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException(
                "maxContentLength must be positive (current: " + maxContentLength + ")"
            );
        }
        if (clientTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "clientTimeoutMs must be positive (current: " + clientTimeoutMs + ")"
            );
        }
    }

    public NotificationConfig withHost(String host) {
        return new NotificationConfig(host, port, path, maxContentLength, clientTimeoutMs);
    }

    public NotificationConfig withPort(int port) {
        return new NotificationConfig(host, port, path, maxContentLength, clientTimeoutMs);
    }

    public NotificationConfig withPath(String path) {
        return new NotificationConfig(host, port, path, maxContentLength, clientTimeoutMs);
    }

    public NotificationConfig withClientTimeoutMs(long clientTimeoutMs) {
        return new NotificationConfig(host, port, path, maxContentLength, clientTimeoutMs);
    }

    /**
     * 클라이언트가 사용할 알림 URL.
     *
     * @return http://host:port/path
     */
    public URI endpoint() {
        return URI.create("http://" + host + ":" + port + path);
    }
}
