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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * GitHub Actions adapter: talks to the GitHub REST API over OkHttp.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /repos/{owner}/{repo}/actions/workflows/{workflow}/dispatches -
 * start a workflow run (answers 204 without a body)
 * <li>GET /repos/{owner}/{repo}/actions/runs - latest runs, newest first
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code bot.github.api-url} - API base URL
 * <li>{@code bot.github.api-version} - value of the X-GitHub-Api-Version header
 * <li>{@code bot.github.token} - bearer token with workflow permission
 * <li>{@code bot.github.owner}, {@code bot.github.repo},
 * {@code bot.github.workflow} - workflow coordinates
 * </ul>
 *
 * @see me.kernelbuilder.bot.domain.service.WorkflowDispatchService
 * @see me.kernelbuilder.bot.domain.service.BuildStatusService
 */
@Component
@Slf4j
public class GitHubActionsAdapter implements WorkflowPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String ACCEPT = "application/vnd.github+json";

    private final BotProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubActionsAdapter(BotProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public DispatchResponse dispatchWorkflow(String ref, Map<String, String> inputs) {
        BotProperties.GitHubProperties github = properties.getGithub();
        HttpUrl url = repositoryUrl()
                .addPathSegments("actions/workflows")
                .addPathSegment(github.getWorkflow())
                .addPathSegment("dispatches")
                .build();

        try {
            String body = objectMapper.writeValueAsString(new DispatchRequest(ref, inputs));
            Request request = authorized(new Request.Builder().url(url))
                    .post(RequestBody.create(body, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                String responseBody = readBody(response);
                log.debug("[GitHub] Dispatch of {} answered HTTP {}", github.getWorkflow(), response.code());
                return new DispatchResponse(response.code(), responseBody);
            }
        } catch (IOException e) {
            throw new WorkflowApiException(describe(e), e);
        }
    }

    @Override
    public RunsResponse listWorkflowRuns() {
        HttpUrl url = repositoryUrl()
                .addPathSegments("actions/runs")
                .build();
        Request request = authorized(new Request.Builder().url(url)).get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            String responseBody = readBody(response);
            if (response.code() != 200) {
                log.debug("[GitHub] Runs listing answered HTTP {}", response.code());
                return new RunsResponse(response.code(), List.of());
            }
            return new RunsResponse(response.code(), parseRuns(responseBody));
        } catch (IOException e) {
            throw new WorkflowApiException(describe(e), e);
        }
    }

    private HttpUrl.Builder repositoryUrl() {
        BotProperties.GitHubProperties github = properties.getGithub();
        HttpUrl base = HttpUrl.parse(github.getApiUrl());
        if (base == null) {
            throw new WorkflowApiException("Invalid GitHub API URL: " + github.getApiUrl(), null);
        }
        return base.newBuilder()
                .addPathSegment("repos")
                .addPathSegment(github.getOwner())
                .addPathSegment(github.getRepo());
    }

    private Request.Builder authorized(Request.Builder builder) {
        BotProperties.GitHubProperties github = properties.getGithub();
        builder.header("Accept", ACCEPT);
        builder.header("X-GitHub-Api-Version", github.getApiVersion());
        String token = github.getToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token.trim());
        }
        return builder;
    }

    private List<WorkflowRun> parseRuns(String responseBody) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode runsNode = root != null ? root.path("workflow_runs") : null;
            if (runsNode == null || !runsNode.isArray()) {
                throw new WorkflowApiException("Runs listing has no workflow_runs array", null);
            }
            List<WorkflowRun> runs = new ArrayList<>();
            for (JsonNode node : runsNode) {
                runs.add(WorkflowRun.builder()
                        .id(node.path("id").asLong())
                        .status(textOrNull(node, "status"))
                        .conclusion(textOrNull(node, "conclusion"))
                        .htmlUrl(textOrNull(node, "html_url"))
                        .build());
            }
            return runs;
        } catch (JsonProcessingException e) {
            throw new WorkflowApiException("Malformed runs listing: " + e.getOriginalMessage(), e);
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    record DispatchRequest(String ref, Map<String, String> inputs) {
    }
}
