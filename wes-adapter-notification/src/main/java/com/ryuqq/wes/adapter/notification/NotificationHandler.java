package com.ryuqq.wes.adapter.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wes.application.trigger.ReconcileQueue;
import com.ryuqq.wes.core.model.RunId;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static io.netty.handler.codec.http.HttpResponseStatus.ACCEPTED;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.METHOD_NOT_ALLOWED;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.SERVICE_UNAVAILABLE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * 알림 수신 핸들러.
 *
 * <p>{@code POST {path}} 본문 {@code {"run_id":"..."}}를 받아 Run ID를 리컨실 큐에 넣습니다.
 * 같은 알림이 여러 번 와도 큐가 중복을 합치므로 안전합니다.</p>
 *
 * <pre>
 * 202 {"status":"accepted"}      큐에 들어감
 * 400 {"error":"..."}            JSON 아님, run_id 없음, run_id 형식 오류
 * 404                            다른 경로
 * 405                            POST 이외 메서드
 * 503                            큐 포화 (폴링 루프가 이후 처리)
 * </pre>
 *
 * <p>채널별 상태가 없으므로 @Sharable 입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Sharable
public final class NotificationHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(NotificationHandler.class);
    private static final String JSON = "application/json; charset=utf-8";

    private final ReconcileQueue queue;
    private final String path;
    private final ObjectMapper mapper;

    /**
     * 생성자.
     *
     * @param queue 리컨실 큐
     * @param path 알림 경로
     * @param mapper JSON 매퍼
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public NotificationHandler(ReconcileQueue queue, String path, ObjectMapper mapper) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.queue = queue;
        this.path = path;
        this.mapper = mapper;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String uri = request.uri();
        String requestPath = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        if (!path.equals(requestPath)) {
            log.debug("No handler for {} {}", request.method(), requestPath);
            write(ctx, request, NOT_FOUND, Map.of("error", "not found"));
            return;
        }
        if (!HttpMethod.POST.equals(request.method())) {
            FullHttpResponse response = response(METHOD_NOT_ALLOWED, Map.of("error", "method not allowed"));
            response.headers().set(HttpHeaderNames.ALLOW, HttpMethod.POST.name());
            send(ctx, request, response);
            return;
        }

        RunId runId;
        try {
            runId = parseRunId(request.content().toString(StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected notification: {}", e.getMessage());
            write(ctx, request, BAD_REQUEST, Map.of("error", e.getMessage()));
            return;
        }

        if (!queue.enqueue(runId)) {
            write(ctx, request, SERVICE_UNAVAILABLE, Map.of("error", "reconcile queue full"));
            return;
        }
        log.debug("Notification accepted for {}", runId);
        write(ctx, request, ACCEPTED, Map.of("status", "accepted"));
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object event) throws Exception {
        if (event instanceof IdleStateEvent) {
            log.debug("Closing idle notification connection {}", ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, event);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in notification channel", cause);
        ctx.close();
    }

    private RunId parseRunId(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        JsonNode runId = node.get("run_id");
        if (runId == null || !runId.isTextual() || runId.asText().isBlank()) {
            throw new IllegalArgumentException("Missing run_id");
        }
        try {
            return RunId.of(runId.asText());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid run_id: " + e.getMessage(), e);
        }
    }

    private void write(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status,
                       Map<String, String> body) {
        send(ctx, request, response(status, body));
    }

    private FullHttpResponse response(HttpResponseStatus status, Map<String, String> body) {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize notification response", e);
            status = INTERNAL_SERVER_ERROR;
            bytes = new byte[0];
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, JSON);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        return response;
    }

    private void send(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
