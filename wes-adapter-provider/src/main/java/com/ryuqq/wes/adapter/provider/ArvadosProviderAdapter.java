package com.ryuqq.wes.adapter.provider;

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
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arvados 컨테이너 워크플로우 서비스 어댑터.
 *
 * <p>Run 하나를 Committed 상태의 Container Request 하나로 제출합니다.
 * CWL은 {@code arvados-cwl-runner}, WDL은 Cromwell 이미지로 실행하며 workflow params는 JSON mount로 전달합니다.</p>
 *
 * <p><strong>상태 결정:</strong> Container Request 상태가 Final이면 Container 상태로 세분화합니다.</p>
 * <pre>
 * Uncommitted                        → QUEUED
 * Committed                          → RUNNING
 * Final + Complete (exit 0)          → COMPLETE
 * Final + Cancelled                  → CANCELED
 * Final + 그 외                       → EXECUTOR_ERROR
 * Final + Container 없음              → SYSTEM_ERROR
 * </pre>
 *
 * <p>취소는 priority를 0으로 내립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ArvadosProviderAdapter extends AbstractHttpProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(ArvadosProviderAdapter.class);

    public static final String TYPE = "arvados";

    static final String UNCOMMITTED = "UNCOMMITTED";
    static final String COMMITTED = "COMMITTED";
    static final String FINAL_COMPLETE = "FINAL_COMPLETE";
    static final String FINAL_CANCELLED = "FINAL_CANCELLED";
    static final String FINAL_FAILED = "FINAL_FAILED";
    static final String FINAL_NO_CONTAINER = "FINAL_NO_CONTAINER";

    private static final StatusMapping MAPPING = StatusMapping.builder()
        .map(RunState.QUEUED, UNCOMMITTED)
        .map(RunState.RUNNING, COMMITTED)
        .map(RunState.COMPLETE, FINAL_COMPLETE)
        .map(RunState.CANCELED, FINAL_CANCELLED)
        .map(RunState.EXECUTOR_ERROR, FINAL_FAILED)
        .map(RunState.SYSTEM_ERROR, FINAL_NO_CONTAINER)
        .build();

    private static final long GIB = 1024L * 1024 * 1024;
    private static final int DEFAULT_PRIORITY = 500;

    private final ArvadosConfig config;

    public ArvadosProviderAdapter(ArvadosConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(Duration.ofMillis(config.requestTimeoutMs())).build(),
            new ObjectMapper());
    }

    public ArvadosProviderAdapter(ArvadosConfig config, HttpClient httpClient, ObjectMapper mapper) {
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
        builder.header("Authorization", "Bearer " + config.apiToken());
    }

    // ============================================================
    // Submit
    // ============================================================

    @Override
    public String submit(WorkflowRun run) throws ProviderSubmissionException, ProviderUnavailableException {
        Map<String, Object> containerRequest = switch (run.spec().workflowType()) {
            case "CWL" -> cwlRequest(run);
            case "WDL" -> wdlRequest(run);
            default -> throw new ProviderSubmissionException(
                "Unsupported workflow type for Arvados: " + run.spec().workflowType()
            );
        };

        JsonNode response = submitRequest(
            uri("/arvados/v1/container_requests"), Map.of("container_request", containerRequest)
        );
        String uuid = text(response, "uuid");
        if (uuid == null || uuid.isBlank()) {
            throw new ProviderSubmissionException("Arvados response did not contain a container request uuid");
        }
        log.info("Submitted run {} to Arvados as container request {}", run.runId(), uuid);
        return uuid;
    }

    private Map<String, Object> cwlRequest(WorkflowRun run) {
        Map<String, Object> request = baseRequest(run, "arvados/jobs:latest", "/var/spool/cwl", "/var/spool/cwl");
        request.put("runtime_constraints", Map.of("vcpus", 1, "ram", GIB, "API", true));

        Map<String, Object> mounts = new LinkedHashMap<>();
        mounts.put("/var/spool/cwl", Map.of("kind", "tmp", "capacity", GIB));
        mounts.put("/var/spool/cwl/cwl.input.json", Map.of("kind", "json", "content", run.spec().workflowParams()));

        String workflowUrl = run.spec().workflowUrl();
        if (workflowUrl.startsWith("arvados:")) {
            String[] parts = workflowUrl.substring("arvados:".length()).split("/", 2);
            Map<String, Object> collection = new LinkedHashMap<>();
            collection.put("kind", "collection");
            collection.put("uuid", parts[0]);
            collection.put("path", parts.length > 1 ? parts[1] : "");
            mounts.put("/var/lib/cwl/workflow", collection);
            request.put("command", List.of(
                "arvados-cwl-runner", "--api=containers", "/var/lib/cwl/workflow", "/var/spool/cwl/cwl.input.json"
            ));
        } else {
            request.put("environment", Map.of("WORKFLOW_URL", workflowUrl));
            request.put("command", List.of(
                "bash", "-c",
                "curl -fsSL -o workflow.cwl \"$WORKFLOW_URL\" && "
                    + "arvados-cwl-runner --api=containers workflow.cwl cwl.input.json"
            ));
        }
        request.put("mounts", mounts);
        return request;
    }

    private Map<String, Object> wdlRequest(WorkflowRun run) {
        Map<String, Object> request = baseRequest(
            run, "broadinstitute/cromwell:latest", "/var/spool/wdl", "/var/spool/wdl/outputs"
        );
        request.put("runtime_constraints", Map.of("vcpus", 2, "ram", 2 * GIB));

        Map<String, Object> mounts = new LinkedHashMap<>();
        mounts.put("/var/spool/wdl", Map.of("kind", "tmp", "capacity", 2 * GIB));
        mounts.put("/var/spool/wdl/inputs.json", Map.of("kind", "json", "content", run.spec().workflowParams()));
        request.put("mounts", mounts);

        request.put("environment", Map.of("WORKFLOW_URL", run.spec().workflowUrl()));
        request.put("command", List.of(
            "bash", "-c",
            "curl -fsSL -o workflow.wdl \"$WORKFLOW_URL\" && "
                + "java -jar /app/cromwell.jar run workflow.wdl -i inputs.json"
        ));
        return request;
    }

    private Map<String, Object> baseRequest(WorkflowRun run, String image, String cwd, String outputPath) {
        String runId = run.runId().getValue();
        Map<String, Object> properties = new LinkedHashMap<>(run.spec().tags());
        properties.put("wes_run_id", runId);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("name", "WES-" + runId);
        request.put("description", "Workflow run " + runId);
        request.put("properties", properties);
        request.put("state", "Committed");
        request.put("priority", DEFAULT_PRIORITY);
        request.put("owner_uuid", config.projectUuid());
        request.put("container_image", image);
        request.put("cwd", cwd);
        request.put("output_path", outputPath);
        request.put("scheduling_parameters", Map.of("preemptible", false));
        return request;
    }

    // ============================================================
    // Status
    // ============================================================

    @Override
    public ProviderStatus getStatus(String externalHandle)
        throws ProviderUnavailableException, ProviderRunNotFoundException {
        JsonNode request = statusRequest(uri("/arvados/v1/container_requests/" + externalHandle), externalHandle);
        JsonNode container = container(request);

        String nativeStatus = nativeStatus(request, container);
        RunState state = MAPPING.map(nativeStatus);

        Map<String, Object> outputs = Map.of();
        String outputUuid = text(request, "output_uuid");
        if (state == RunState.COMPLETE && outputUuid != null) {
            outputs = Map.of("output_collection", Map.of(
                "uuid", outputUuid,
                "url", config.baseUri() + "/collections/" + outputUuid
            ));
        }

        return new ProviderStatus(state, nativeStatus, outputs, tasks(request, container), message(state, container));
    }

    /**
     * Container Request에 연결된 Container 조회.
     *
     * @return Container가 없거나 삭제된 경우 null
     */
    private JsonNode container(JsonNode request) throws ProviderUnavailableException {
        String containerUuid = text(request, "container_uuid");
        if (containerUuid == null || containerUuid.isBlank()) {
            return null;
        }
        try {
            return statusRequest(uri("/arvados/v1/containers/" + containerUuid), containerUuid);
        } catch (ProviderRunNotFoundException e) {
            log.warn("Container {} of request {} not found", containerUuid, text(request, "uuid"));
            return null;
        }
    }

    static String nativeStatus(JsonNode request, JsonNode container) {
        String requestState = text(request, "state");
        if ("Uncommitted".equals(requestState)) {
            return UNCOMMITTED;
        }
        if ("Committed".equals(requestState)) {
            return COMMITTED;
        }
        if (!"Final".equals(requestState)) {
            return requestState;
        }
        if (container == null) {
            return FINAL_NO_CONTAINER;
        }
        String containerState = text(container, "state");
        JsonNode exitCode = container.get("exit_code");
        if ("Complete".equals(containerState) && exitCode != null && exitCode.isInt() && exitCode.asInt() == 0) {
            return FINAL_COMPLETE;
        }
        if ("Cancelled".equals(containerState)) {
            return FINAL_CANCELLED;
        }
        return FINAL_FAILED;
    }

    private List<TaskLog> tasks(JsonNode request, JsonNode container) {
        List<TaskLog> tasks = new ArrayList<>();
        tasks.add(new TaskLog(
            text(request, "uuid") != null ? text(request, "uuid") : "container_request",
            "container_request",
            List.of(),
            instant(request, "created_at"),
            instant(request, "modified_at"),
            null,
            null,
            null,
            text(request, "state")
        ));
        if (container != null) {
            String uuid = text(container, "uuid");
            JsonNode exitCode = container.get("exit_code");
            List<String> command = new ArrayList<>();
            container.path("command").forEach(part -> command.add(part.asText()));
            tasks.add(new TaskLog(
                uuid != null ? uuid : "container",
                "container",
                command,
                instant(container, "started_at"),
                instant(container, "finished_at"),
                exitCode != null && exitCode.isInt() ? exitCode.asInt() : null,
                uuid != null ? config.baseUri() + "/containers/" + uuid + "/log" : null,
                null,
                text(container, "state")
            ));
        }
        return tasks;
    }

    private static String message(RunState state, JsonNode container) {
        if (state == RunState.SYSTEM_ERROR) {
            return "Container request reached Final without a container";
        }
        if (state == RunState.EXECUTOR_ERROR) {
            return String.format("Container finished in state %s with exit code %s",
                text(container, "state"), text(container, "exit_code"));
        }
        return null;
    }

    // ============================================================
    // Cancel
    // ============================================================

    @Override
    public boolean cancel(String externalHandle) throws ProviderUnavailableException {
        log.info("Cancelling Arvados container request {}", externalHandle);
        return cancelRequest(
            put(uri("/arvados/v1/container_requests/" + externalHandle),
                Map.of("container_request", Map.of("priority", 0))),
            externalHandle
        );
    }

    private URI uri(String path) {
        return URI.create(config.baseUri() + path);
    }
}
