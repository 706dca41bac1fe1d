package me.kernelbuilder.bot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.kernelbuilder.bot.domain.model.BuildConfig;
import me.kernelbuilder.bot.domain.model.BuildField;
import me.kernelbuilder.bot.domain.model.DispatchResult;
import me.kernelbuilder.bot.domain.model.WorkflowRun;
import me.kernelbuilder.bot.infrastructure.config.BotProperties;
import me.kernelbuilder.bot.infrastructure.i18n.MessageService;
import me.kernelbuilder.bot.port.outbound.WorkflowApiException;
import me.kernelbuilder.bot.port.outbound.WorkflowPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a finished {@link BuildConfig} into a workflow dispatch.
 *
 * <p>
 * Each call performs exactly one dispatch request and, if GitHub accepted it,
 * at most one runs listing to find the link of the new run. The listing is
 * best-effort: whatever happens there, an accepted dispatch stays a success.
 * Failures are reported in the returned {@link DispatchResult}, never thrown.
 *
 * <p>
 * The service does not touch any local state; recording the build for later
 * status requests is the caller's job.
 */
@Service
@Slf4j
public class WorkflowDispatchService {

    private static final List<BuildField> REQUIRED_INPUTS = List.of(
            BuildField.COMPILER,
            BuildField.KERNEL_REPO_URL,
            BuildField.KERNEL_BRANCH,
            BuildField.CONTAINER_IMAGE);

    private static final List<BuildField> OPTIONAL_INPUTS = List.of(
            BuildField.NOTES,
            BuildField.KERNEL_SU_MODE,
            BuildField.SUFFIX,
            BuildField.ZIP_REPO_URL,
            BuildField.ZIP_BRANCH);

    private final WorkflowPort workflowPort;
    private final BotProperties properties;
    private final MessageService messageService;

    public WorkflowDispatchService(WorkflowPort workflowPort, BotProperties properties,
            MessageService messageService) {
        this.workflowPort = workflowPort;
        this.properties = properties;
        this.messageService = messageService;
    }

    /**
     * Builds the workflow inputs: required fields always, optional ones only when
     * non-empty, plus the configured notification recipient.
     */
    public Map<String, String> buildInputs(BuildConfig config) {
        Map<String, String> inputs = new LinkedHashMap<>();
        for (BuildField field : REQUIRED_INPUTS) {
            inputs.put(field.getInputKey(), config.get(field));
        }
        for (BuildField field : OPTIONAL_INPUTS) {
            if (config.isPresent(field)) {
                inputs.put(field.getInputKey(), config.get(field));
            }
        }
        String recipient = properties.getGithub().getNotifyRecipient();
        if (recipient != null && !recipient.isBlank()) {
            inputs.put(BuildField.NOTIFY_RECIPIENT.getInputKey(), recipient.trim());
        }
        return inputs;
    }

    public DispatchResult dispatch(BuildConfig config) {
        Map<String, String> inputs = buildInputs(config);
        String ref = properties.getGithub().getDispatchRef();

        WorkflowPort.DispatchResponse response;
        try {
            response = workflowPort.dispatchWorkflow(ref, inputs);
        } catch (WorkflowApiException e) {
            log.warn("[Dispatch] Workflow trigger failed: {}", e.getMessage());
            return DispatchResult.failure(
                    messageService.getMessage("dispatch.transport-error", HtmlText.escape(e.getMessage())));
        }

        if (!response.isAccepted()) {
            log.warn("[Dispatch] GitHub rejected dispatch: HTTP {}", response.statusCode());
            return DispatchResult.failure(messageService.getMessage("dispatch.api-error",
                    String.valueOf(response.statusCode()), HtmlText.escape(response.body())));
        }

        log.info("[Dispatch] Workflow dispatched on ref {} with inputs {}", ref, inputs.keySet());
        String runUrl = findLatestRunUrl();
        if (runUrl != null) {
            return DispatchResult.success(
                    messageService.getMessage("dispatch.run-link", HtmlText.escape(runUrl)), runUrl);
        }
        return DispatchResult.success(messageService.getMessage("dispatch.triggered"), null);
    }

    private String findLatestRunUrl() {
        try {
            WorkflowPort.RunsResponse runs = workflowPort.listWorkflowRuns();
            if (!runs.isSuccessful()) {
                log.debug("[Dispatch] Runs listing returned HTTP {}", runs.statusCode());
                return null;
            }
            if (runs.runs().isEmpty()) {
                return null;
            }
            WorkflowRun latest = runs.runs().get(0);
            log.debug("[Dispatch] Latest run {} is {}", latest.id(), latest.status());
            return latest.htmlUrl();
        } catch (WorkflowApiException e) {
            log.debug("[Dispatch] Runs listing failed: {}", e.getMessage());
            return null;
        }
    }
}
