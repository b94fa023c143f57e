package com.ryuqq.wes.adapter.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.SubmissionSpec;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.spi.ProviderStatus;
import com.ryuqq.wes.core.statemachine.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ArvadosProviderAdapter 테스트 (WireMock).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@WireMockTest
class ArvadosProviderAdapterTest {

    private static final String CR = "zzzzz-xvhdp-000000000000001";
    private static final String CONTAINER = "zzzzz-dz642-000000000000001";

    private ArvadosProviderAdapter adapter;
    private String baseUrl;

    @BeforeEach
    void beforeEach(WireMockRuntimeInfo wmRuntimeInfo) {
        baseUrl = wmRuntimeInfo.getHttpBaseUrl();
        ArvadosConfig config = new ArvadosConfig(baseUrl, "arv-token", "zzzzz-j7d0g-project000000001", 500);
        adapter = new ArvadosProviderAdapter(config, HttpClient.newHttpClient(), new ObjectMapper());
    }

    // ============================================================
    // submit
    // ============================================================

    @Test
    void submit_CWL은_Committed_Container_Request로_제출한다() throws Exception {
        // given
        stubFor(post(urlEqualTo("/arvados/v1/container_requests")).willReturn(okJson("{\"uuid\":\"" + CR + "\"}")));

        // when
        String handle = adapter.submit(run("CWL", "https://example.org/wf.cwl"));

        // then
        assertThat(handle).isEqualTo(CR);
        verify(postRequestedFor(urlEqualTo("/arvados/v1/container_requests"))
            .withHeader("Authorization", equalTo("Bearer arv-token"))
            .withRequestBody(matchingJsonPath("$.container_request.state", equalTo("Committed")))
            .withRequestBody(matchingJsonPath("$.container_request.priority", equalTo("500")))
            .withRequestBody(matchingJsonPath("$.container_request.container_image", equalTo("arvados/jobs:latest")))
            .withRequestBody(matchingJsonPath("$.container_request.owner_uuid",
                equalTo("zzzzz-j7d0g-project000000001")))
            .withRequestBody(matchingJsonPath("$.container_request.properties.wes_run_id", equalTo("run-1")))
            .withRequestBody(matchingJsonPath("$.container_request.environment.WORKFLOW_URL",
                equalTo("https://example.org/wf.cwl")))
            .withRequestBody(matchingJsonPath("$.container_request.command[2]", containing("arvados-cwl-runner")))
            .withRequestBody(matchingJsonPath("$.container_request.mounts['/var/spool/cwl/cwl.input.json'].content",
                equalToJson("{\"reads\":\"keep:abc/reads.fq\"}"))));
    }

    @Test
    void submit_arvados_컬렉션_워크플로우는_collection_mount를_사용한다() throws Exception {
        // given
        stubFor(post(urlEqualTo("/arvados/v1/container_requests")).willReturn(okJson("{\"uuid\":\"" + CR + "\"}")));

        // when
        adapter.submit(run("CWL", "arvados:zzzzz-4zz18-collection0001/main.cwl"));

        // then
        verify(postRequestedFor(urlEqualTo("/arvados/v1/container_requests"))
            .withRequestBody(matchingJsonPath("$.container_request.mounts['/var/lib/cwl/workflow'].uuid",
                equalTo("zzzzz-4zz18-collection0001")))
            .withRequestBody(matchingJsonPath("$.container_request.mounts['/var/lib/cwl/workflow'].path",
                equalTo("main.cwl")))
            .withRequestBody(matchingJsonPath("$.container_request.command[0]", equalTo("arvados-cwl-runner"))));
    }

    @Test
    void submit_WDL은_Cromwell_이미지를_사용한다() throws Exception {
        // given
        stubFor(post(urlEqualTo("/arvados/v1/container_requests")).willReturn(okJson("{\"uuid\":\"" + CR + "\"}")));

        // when
        adapter.submit(run("WDL", "https://example.org/wf.wdl"));

        // then
        verify(postRequestedFor(urlEqualTo("/arvados/v1/container_requests"))
            .withRequestBody(matchingJsonPath("$.container_request.container_image",
                equalTo("broadinstitute/cromwell:latest")))
            .withRequestBody(matchingJsonPath("$.container_request.command[2]", containing("cromwell.jar"))));
    }

    @Test
    void submit_지원하지_않는_언어는_호출없이_영구_실패() {
        // when & then
        assertThatThrownBy(() -> adapter.submit(run("NEXTFLOW", "https://example.org/main.nf")))
            .isInstanceOf(ProviderSubmissionException.class)
            .hasMessageContaining("NEXTFLOW");
    }

    @Test
    void submit_422는_영구_실패() {
        // given
        stubFor(post(urlEqualTo("/arvados/v1/container_requests"))
            .willReturn(aResponse().withStatus(422).withBody("{\"errors\":[\"bad mount\"]}")));

        // when & then
        assertThatThrownBy(() -> adapter.submit(run("CWL", "https://example.org/wf.cwl")))
            .isInstanceOf(ProviderSubmissionException.class)
            .hasMessageContaining("bad mount");
    }

    @Test
    void submit_수락_응답의_본문이_JSON이_아니면_영구_실패() {
        // given
        stubFor(post(urlEqualTo("/arvados/v1/container_requests"))
            .willReturn(aResponse().withStatus(200).withBody("<html>ok</html>")));

        // when & then
        assertThatThrownBy(() -> adapter.submit(run("CWL", "https://example.org/wf.cwl")))
            .isInstanceOf(ProviderSubmissionException.class)
            .hasMessageContaining("malformed JSON");
    }

    // ============================================================
    // getStatus
    // ============================================================

    @Test
    void getStatus_Uncommitted는_QUEUED() throws Exception {
        // given
        stubFor(get(urlEqualTo("/arvados/v1/container_requests/" + CR))
            .willReturn(okJson("{\"uuid\":\"" + CR + "\",\"state\":\"Uncommitted\"}")));

        // when
        ProviderStatus status = adapter.getStatus(CR);

        // then
        assertThat(status.state()).isEqualTo(RunState.QUEUED);
        assertThat(status.tasks()).hasSize(1);
    }

    @Test
    void getStatus_Committed는_RUNNING() throws Exception {
        // given
        stubRequest("Committed", null);

        // when & then
        assertThat(adapter.getStatus(CR).state()).isEqualTo(RunState.RUNNING);
    }

    @Test
    void getStatus_Final과_exit0_Complete는_COMPLETE와_output_collection() throws Exception {
        // given
        stubRequest("Final", "zzzzz-4zz18-output00000001");
        stubContainer("Complete", 0);

        // when
        ProviderStatus status = adapter.getStatus(CR);

        // then
        assertThat(status.state()).isEqualTo(RunState.COMPLETE);
        assertThat(status.outputs()).containsKey("output_collection");
        assertThat(status.outputs().get("output_collection").toString()).contains("zzzzz-4zz18-output00000001");
        assertThat(status.tasks()).hasSize(2);
        assertThat(status.tasks().get(1).exitCode()).isZero();
        assertThat(status.tasks().get(1).stdoutUrl()).endsWith("/containers/" + CONTAINER + "/log");
    }

    @Test
    void getStatus_Final과_nonzero_exit는_EXECUTOR_ERROR() throws Exception {
        // given
        stubRequest("Final", null);
        stubContainer("Complete", 1);

        // when
        ProviderStatus status = adapter.getStatus(CR);

        // then
        assertThat(status.state()).isEqualTo(RunState.EXECUTOR_ERROR);
        assertThat(status.message()).contains("exit code 1");
    }

    @Test
    void getStatus_Final과_Cancelled는_CANCELED() throws Exception {
        // given
        stubRequest("Final", null);
        stubContainer("Cancelled", null);

        // when & then
        assertThat(adapter.getStatus(CR).state()).isEqualTo(RunState.CANCELED);
    }

    @Test
    void getStatus_Final이지만_Container가_없으면_SYSTEM_ERROR() throws Exception {
        // given
        stubFor(get(urlEqualTo("/arvados/v1/container_requests/" + CR))
            .willReturn(okJson("{\"uuid\":\"" + CR + "\",\"state\":\"Final\",\"container_uuid\":null}")));

        // when
        ProviderStatus status = adapter.getStatus(CR);

        // then
        assertThat(status.state()).isEqualTo(RunState.SYSTEM_ERROR);
        assertThat(status.message()).contains("without a container");
    }

    @Test
    void getStatus_Container_조회_일시적_실패는_Unavailable() {
        // given
        stubRequest("Final", null);
        stubFor(get(urlEqualTo("/arvados/v1/containers/" + CONTAINER)).willReturn(aResponse().withStatus(503)));

        // when & then
        assertThatThrownBy(() -> adapter.getStatus(CR)).isInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void getStatus_404는_RunNotFound() {
        // given
        stubFor(get(urlEqualTo("/arvados/v1/container_requests/" + CR)).willReturn(aResponse().withStatus(404)));

        // when & then
        assertThatThrownBy(() -> adapter.getStatus(CR)).isInstanceOf(ProviderRunNotFoundException.class);
    }

    // ============================================================
    // cancel
    // ============================================================

    @Test
    void cancel_priority를_0으로_내린다() throws Exception {
        // given
        stubFor(put(urlEqualTo("/arvados/v1/container_requests/" + CR)).willReturn(okJson("{\"priority\":0}")));

        // when
        boolean accepted = adapter.cancel(CR);

        // then
        assertThat(accepted).isTrue();
        verify(putRequestedFor(urlEqualTo("/arvados/v1/container_requests/" + CR))
            .withRequestBody(equalToJson("{\"container_request\":{\"priority\":0}}")));
    }

    @Test
    void cancel_429는_Unavailable() {
        // given
        stubFor(put(urlEqualTo("/arvados/v1/container_requests/" + CR)).willReturn(aResponse().withStatus(429)));

        // when & then
        assertThatThrownBy(() -> adapter.cancel(CR)).isInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void 스킴이_없는_호스트는_https를_사용한다() {
        ArvadosConfig config = new ArvadosConfig("zzzzz.arvadosapi.com", "token", "zzzzz-j7d0g-project000000001");

        assertThat(config.baseUri().toString()).isEqualTo("https://zzzzz.arvadosapi.com");
        assertThat(config.toString()).doesNotContain("token=");
    }

    private void stubRequest(String state, String outputUuid) {
        String output = outputUuid == null ? "null" : "\"" + outputUuid + "\"";
        stubFor(get(urlEqualTo("/arvados/v1/container_requests/" + CR))
            .willReturn(okJson("{\"uuid\":\"" + CR + "\",\"state\":\"" + state + "\","
                + "\"container_uuid\":\"" + CONTAINER + "\",\"output_uuid\":" + output + ","
                + "\"created_at\":\"2024-05-01T10:00:00Z\",\"modified_at\":\"2024-05-01T11:00:00Z\"}")));
    }

    private void stubContainer(String state, Integer exitCode) {
        stubFor(get(urlEqualTo("/arvados/v1/containers/" + CONTAINER))
            .willReturn(okJson("{\"uuid\":\"" + CONTAINER + "\",\"state\":\"" + state + "\","
                + "\"exit_code\":" + exitCode + ",\"command\":[\"arvados-cwl-runner\"],"
                + "\"started_at\":\"2024-05-01T10:01:00Z\",\"finished_at\":\"2024-05-01T10:59:00Z\"}")));
    }

    private static WorkflowRun run(String workflowType, String workflowUrl) {
        SubmissionSpec spec = SubmissionSpec.of(workflowUrl, workflowType, "v1.0")
            .withWorkflowParams(Map.of("reads", "keep:abc/reads.fq"));
        return WorkflowRun.queued(RunId.of("run-1"), spec, ArvadosProviderAdapter.TYPE, Instant.now());
    }
}
