package com.ryuqq.wes.adapter.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.model.TaskLog;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.spi.ProviderStatus;
import com.ryuqq.wes.core.spi.StatusMapping;
import com.ryuqq.wes.core.statemachine.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seven Bridges (Velsera) 플랫폼 어댑터.
 *
 * <p><strong>API 호출:</strong></p>
 * <pre>
 * submit     POST {api}/tasks?action=run
 * getStatus  GET  {api}/tasks/{id}
 *            GET  {api}/tasks/{id}/execution_details   (태스크 로그, 실패해도 무시)
 * cancel     POST {api}/tasks/{id}/actions/abort
 * </pre>
 *
 * <p><strong>상태 매핑:</strong></p>
 * <pre>
 * DRAFT, CREATING → INITIALIZING    QUEUED → QUEUED
 * RUNNING → RUNNING                 COMPLETED → COMPLETE
 * FAILED → EXECUTOR_ERROR           ABORTED → CANCELED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SevenBridgesProviderAdapter extends AbstractHttpProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(SevenBridgesProviderAdapter.class);

    public static final String TYPE = "sevenbridges";

    private static final StatusMapping MAPPING = StatusMapping.builder()
        .map(RunState.INITIALIZING, "DRAFT", "CREATING")
        .map(RunState.QUEUED, "QUEUED")
        .map(RunState.RUNNING, "RUNNING")
        .map(RunState.COMPLETE, "COMPLETED")
        .map(RunState.EXECUTOR_ERROR, "FAILED")
        .map(RunState.CANCELED, "ABORTED")
        .build();

    private static final TypeReference<Map<String, Object>> OUTPUTS = new TypeReference<>() {
    };

    private final SevenBridgesConfig config;

    public SevenBridgesProviderAdapter(SevenBridgesConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(Duration.ofMillis(config.requestTimeoutMs())).build(),
            new ObjectMapper());
    }

    public SevenBridgesProviderAdapter(SevenBridgesConfig config, HttpClient httpClient, ObjectMapper mapper) {
        super(httpClient, mapper, Duration.ofMillis(config.requestTimeoutMs()));
        this.config = config;
    }

    @Override
    public String providerType() {
        return TYPE;
    }

    @Override
    public StatusMapping statusMapping() {
        return MAPPING;
    }

    @Override
    protected void authorize(HttpRequest.Builder builder) {
        builder.header("X-SBG-Auth-Token", config.apiToken());
    }

    @Override
    public String submit(WorkflowRun run) throws ProviderSubmissionException, ProviderUnavailableException {
        Map<String, Object> task = new LinkedHashMap<>();
        task.put("name", "WES-" + run.runId().getValue());
        task.put("project", config.project());
        task.put("app", run.spec().workflowUrl());
        task.put("inputs", run.spec().workflowParams());
        task.put("description", "Workflow run " + run.runId().getValue());

        JsonNode response = submitRequest(uri("/tasks?action=run"), task);
        String taskId = text(response, "id");
        if (taskId == null || taskId.isBlank()) {
            throw new ProviderSubmissionException("Seven Bridges response did not contain a task id");
        }
        log.info("Submitted run {} to Seven Bridges as task {}", run.runId(), taskId);
        return taskId;
    }

    @Override
    public ProviderStatus getStatus(String externalHandle)
        throws ProviderUnavailableException, ProviderRunNotFoundException {
        JsonNode task = statusRequest(uri("/tasks/" + encode(externalHandle)), externalHandle);
        String nativeStatus = text(task, "status");
        RunState state = MAPPING.map(nativeStatus);

        Map<String, Object> outputs = Map.of();
        if ("COMPLETED".equals(nativeStatus) && task.has("outputs") && task.get("outputs").isObject()) {
            outputs = mapper.convertValue(task.get("outputs"), OUTPUTS);
        }

        String message = null;
        if (state == RunState.EXECUTOR_ERROR) {
            String detail = text(task.path("execution_status"), "message");
            message = detail != null ? detail : "Seven Bridges task " + externalHandle + " FAILED";
        }

        return new ProviderStatus(state, nativeStatus, outputs, executionDetails(externalHandle), message);
    }

    @Override
    public boolean cancel(String externalHandle) throws ProviderUnavailableException {
        log.info("Aborting Seven Bridges task {}", externalHandle);
        return cancelRequest(post(uri("/tasks/" + encode(externalHandle) + "/actions/abort"), Map.of()),
            externalHandle);
    }

    /**
     * 실행 상세의 job 목록을 태스크 로그로 변환합니다.
     *
     * <p>상세가 없으면(404) 빈 목록, 일시적 실패는 상태 조회 전체를 실패시켜 다음 패스에서 재시도합니다.</p>
     *
     * @throws ProviderUnavailableException 상세 조회의 일시적 실패
     */
    private List<TaskLog> executionDetails(String taskId) throws ProviderUnavailableException {
        JsonNode details;
        try {
            details = statusRequest(uri("/tasks/" + encode(taskId) + "/execution_details"), taskId);
        } catch (ProviderRunNotFoundException e) {
            log.warn("No execution details for task {}", taskId);
            return List.of();
        }

        JsonNode jobs = details.path("jobs");
        if (!jobs.isArray()) {
            return List.of();
        }
        List<TaskLog> tasks = new ArrayList<>();
        for (JsonNode job : jobs) {
            String name = text(job, "name");
            if (name == null || name.isBlank()) {
                continue;
            }
            String command = text(job, "command");
            JsonNode logs = job.path("logs");
            tasks.add(new TaskLog(
                name,
                name,
                command == null ? List.of() : List.of(command),
                instant(job, "start_time"),
                instant(job, "end_time"),
                null,
                text(logs, "stdout"),
                text(logs, "stderr"),
                text(job, "status")
            ));
        }
        return tasks;
    }

    private URI uri(String path) {
        return URI.create(config.apiEndpoint() + path);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
