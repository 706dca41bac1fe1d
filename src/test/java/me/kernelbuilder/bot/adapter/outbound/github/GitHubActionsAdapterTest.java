package me.kernelbuilder.bot.adapter.outbound.github;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.kernelbuilder.bot.domain.model.WorkflowRun;
import me.kernelbuilder.bot.infrastructure.config.BotProperties;
import me.kernelbuilder.bot.port.outbound.WorkflowApiException;
import me.kernelbuilder.bot.port.outbound.WorkflowPort;
import me.kernelbuilder.bot.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GitHubActionsAdapterTest {

    private static final String API_URL = "http://mock.github.local";
    private static final String DISPATCH_PATH = "/repos/zyexro/kernel_builder/actions/workflows/main.yml/dispatches";
    private static final String RUNS_PATH = "/repos/zyexro/kernel_builder/actions/runs";

    private OkHttpMockEngine httpEngine;
    private GitHubActionsAdapter adapter;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        BotProperties properties = new BotProperties();
        properties.getGithub().setApiUrl(API_URL);
        properties.getGithub().setToken("ghp_test");

        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(httpEngine)
                .build();
        objectMapper = new ObjectMapper();
        adapter = new GitHubActionsAdapter(properties, client, objectMapper);
    }

    @Test
    void dispatchPostsRefAndInputsWithGitHubHeaders() throws Exception {
        httpEngine.enqueueEmpty(204);
        Map<String, String> inputs = new LinkedHashMap<>();
        inputs.put("COMPILER", "Geopelia-Clang-20");
        inputs.put("KSU", "both");

        WorkflowPort.DispatchResponse response = adapter.dispatchWorkflow("enanan", inputs);

        assertTrue(response.isAccepted());
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertNotNull(request);
        assertEquals("POST", request.method());
        assertEquals(DISPATCH_PATH, request.path());
        assertEquals("Bearer ghp_test", request.header("Authorization"));
        assertEquals("application/vnd.github+json", request.header("Accept"));
        assertEquals("2022-11-28", request.header("X-GitHub-Api-Version"));
        assertTrue(request.contentType().startsWith("application/json"));

        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("enanan", body.get("ref").asText());
        assertEquals(2, body.get("inputs").size());
        assertEquals("Geopelia-Clang-20", body.get("inputs").get("COMPILER").asText());
        assertEquals("both", body.get("inputs").get("KSU").asText());
    }

    @Test
    void dispatchReturnsStatusAndBodyOfRejection() {
        httpEngine.enqueueJson(401, "{\"message\":\"Unauthorized\"}");

        WorkflowPort.DispatchResponse response = adapter.dispatchWorkflow("enanan", Map.of());

        assertFalse(response.isAccepted());
        assertEquals(401, response.statusCode());
        assertTrue(response.body().contains("Unauthorized"));
        assertEquals(1, httpEngine.getRequestCount());
    }

    @Test
    void dispatchWrapsTransportFailure() {
        httpEngine.enqueueFailure(new IOException("connection refused"));

        WorkflowApiException e = assertThrows(WorkflowApiException.class,
                () -> adapter.dispatchWorkflow("enanan", Map.of()));

        assertEquals("connection refused", e.getMessage());
        assertEquals(1, httpEngine.getRequestCount());
    }

    @Test
    void listRunsParsesWorkflowRuns() {
        httpEngine.enqueueJson(200, "{\"total_count\":2,\"workflow_runs\":["
                + "{\"id\":11,\"status\":\"in_progress\",\"conclusion\":null,"
                + "\"html_url\":\"https://github.com/zyexro/kernel_builder/actions/runs/11\","
                + "\"created_at\":\"2026-03-01T10:15:30Z\"},"
                + "{\"id\":10,\"status\":\"completed\",\"conclusion\":\"success\","
                + "\"html_url\":\"https://github.com/zyexro/kernel_builder/actions/runs/10\"}]}");

        WorkflowPort.RunsResponse response = adapter.listWorkflowRuns();

        assertTrue(response.isSuccessful());
        List<WorkflowRun> runs = response.runs();
        assertEquals(2, runs.size());
        assertEquals(11L, runs.get(0).id());
        assertEquals("in_progress", runs.get(0).status());
        assertNull(runs.get(0).conclusion());
        assertFalse(runs.get(0).isConcluded());
        assertEquals("success", runs.get(1).conclusion());
        assertTrue(runs.get(1).isConcluded());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals(RUNS_PATH, request.path());
        assertEquals("Bearer ghp_test", request.header("Authorization"));
    }

    @Test
    void listRunsReturnsStatusWithoutRunsOnError() {
        httpEngine.enqueueJson(404, "{\"message\":\"Not Found\"}");

        WorkflowPort.RunsResponse response = adapter.listWorkflowRuns();

        assertFalse(response.isSuccessful());
        assertEquals(404, response.statusCode());
        assertTrue(response.runs().isEmpty());
    }

    @Test
    void listRunsRejectsMalformedBody() {
        httpEngine.enqueueText(200, "<html>oops</html>", "text/html");

        assertThrows(WorkflowApiException.class, () -> adapter.listWorkflowRuns());
    }

    @Test
    void listRunsRejectsBodyWithoutRunsArray() {
        httpEngine.enqueueJson(200, "{\"total_count\":0}");

        assertThrows(WorkflowApiException.class, () -> adapter.listWorkflowRuns());
    }
}
