package com.ryuqq.wes.adapter.notification;

import com.ryuqq.wes.application.trigger.ReconcileQueue;
import com.ryuqq.wes.core.model.RunId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * NotificationServer 테스트.
 *
 * <p>임의 포트에 실제 서버를 띄우고 java.net.http 클라이언트로 요청합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class NotificationServerTest {

    @Mock
    private ReconcileQueue queue;

    private NotificationServer server;
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        server = new NotificationServer(new NotificationConfig().withPort(0), queue);
        int port = server.start();
        baseUrl = "http://localhost:" + port;
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void 유효한_알림은_큐에_넣고_202를_반환한다() throws Exception {
        // given
        when(queue.enqueue(RunId.of("run-1"))).thenReturn(true);

        // when
        HttpResponse<String> response = post("/notify", "{\"run_id\":\"run-1\"}");

        // then
        assertThat(response.statusCode()).isEqualTo(202);
        assertThat(response.body()).contains("\"status\":\"accepted\"");
        assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json; charset=utf-8");
        verify(queue).enqueue(RunId.of("run-1"));
    }

    @Test
    void run_id가_없으면_400() throws Exception {
        // when
        HttpResponse<String> response = post("/notify", "{\"other\":\"x\"}");

        // then
        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("Missing run_id");
        verify(queue, never()).enqueue(any());
    }

    @Test
    void JSON이_아니면_400() throws Exception {
        // when
        HttpResponse<String> response = post("/notify", "not json");

        // then
        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.body()).contains("Invalid JSON");
        verify(queue, never()).enqueue(any());
    }

    @Test
    void 객체가_아닌_JSON은_400() throws Exception {
        // when
        HttpResponse<String> response = post("/notify", "[\"run-1\"]");

        // then
        assertThat(response.statusCode()).isEqualTo(400);
    }

    @Test
    void run_id가_문자열이_아니면_400() throws Exception {
        // when
        HttpResponse<String> response = post("/notify", "{\"run_id\":42}");

        // then
        assertThat(response.statusCode()).isEqualTo(400);
        verify(queue, never()).enqueue(any());
    }

    @Test
    void 다른_경로는_404() throws Exception {
        // when
        HttpResponse<String> response = post("/other", "{\"run_id\":\"run-1\"}");

        // then
        assertThat(response.statusCode()).isEqualTo(404);
        verify(queue, never()).enqueue(any());
    }

    @Test
    void POST가_아니면_405와_Allow_헤더() throws Exception {
        // when
        HttpResponse<String> response = client.send(
            HttpRequest.newBuilder(URI.create(baseUrl + "/notify")).GET().build(),
            HttpResponse.BodyHandlers.ofString()
        );

        // then
        assertThat(response.statusCode()).isEqualTo(405);
        assertThat(response.headers().firstValue("Allow")).hasValue("POST");
    }

    @Test
    void 큐가_가득_차면_503() throws Exception {
        // given
        when(queue.enqueue(RunId.of("run-1"))).thenReturn(false);

        // when
        HttpResponse<String> response = post("/notify", "{\"run_id\":\"run-1\"}");

        // then
        assertThat(response.statusCode()).isEqualTo(503);
    }

    @Test
    void 같은_알림을_여러번_보내도_모두_수락된다() throws Exception {
        // given
        when(queue.enqueue(RunId.of("run-1"))).thenReturn(true);

        // when
        int first = post("/notify", "{\"run_id\":\"run-1\"}").statusCode();
        int second = post("/notify", "{\"run_id\":\"run-1\"}").statusCode();

        // then
        assertThat(first).isEqualTo(202);
        assertThat(second).isEqualTo(202);
    }

    @Test
    void 시작_전에는_port를_조회할_수_없다() {
        // given
        NotificationServer idle = new NotificationServer(new NotificationConfig().withPort(0), queue);

        // when & then
        assertThat(idle.isRunning()).isFalse();
        assertThatThrownBy(idle::port).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 이미_사용중인_포트면_시작_실패() {
        // given
        NotificationServer clash = new NotificationServer(
            new NotificationConfig().withPort(server.port()), queue
        );

        // when & then
        assertThatThrownBy(clash::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to bind");
        assertThat(clash.isRunning()).isFalse();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
