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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.kernelbuilder.bot.domain.model.ActiveBuild;
import me.kernelbuilder.bot.domain.model.BotReply;
import me.kernelbuilder.bot.domain.model.WorkflowRun;
import me.kernelbuilder.bot.infrastructure.i18n.MessageService;
import me.kernelbuilder.bot.port.outbound.ActiveBuildStore;
import me.kernelbuilder.bot.port.outbound.WorkflowApiException;
import me.kernelbuilder.bot.port.outbound.WorkflowPort;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * Answers status requests with the latest run of the build workflow.
 *
 * <p>
 * Pure read: a user without a recorded build gets a reply without any call to
 * GitHub; otherwise exactly one runs listing is made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BuildStatusService {

    private static final DateTimeFormatter STARTED_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final ActiveBuildStore activeBuildStore;
    private final WorkflowPort workflowPort;
    private final MessageService messageService;

    public BotReply status(String userId) {
        Optional<ActiveBuild> activeBuild = activeBuildStore.get(userId);
        if (activeBuild.isEmpty()) {
            return BotReply.text(messageService.getMessage("status.none"));
        }

        WorkflowPort.RunsResponse response;
        try {
            response = workflowPort.listWorkflowRuns();
        } catch (WorkflowApiException e) {
            log.warn("[Status] Runs listing failed: {}", e.getMessage());
            return BotReply.text(messageService.getMessage("status.transport-error",
                    HtmlText.escape(e.getMessage())));
        }

        if (!response.isSuccessful()) {
            log.warn("[Status] GitHub returned HTTP {} for runs listing", response.statusCode());
            return BotReply.text(messageService.getMessage("status.api-error",
                    String.valueOf(response.statusCode())));
        }
        if (response.runs().isEmpty()) {
            return BotReply.text(messageService.getMessage("status.no-runs"));
        }

        WorkflowRun latest = response.runs().get(0);
        String conclusion = latest.isConcluded()
                ? humanize(latest.conclusion())
                : messageService.getMessage("status.in-progress");
        return BotReply.text(messageService.getMessage("status.report",
                STARTED_FORMAT.format(activeBuild.get().startedAt()),
                HtmlText.escape(humanize(latest.status())),
                HtmlText.escape(conclusion),
                HtmlText.escape(latest.htmlUrl())));
    }

    /**
     * Turns GitHub identifiers such as {@code in_progress} into {@code In Progress}.
     */
    static String humanize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String[] words = value.trim().replace('_', ' ').split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
