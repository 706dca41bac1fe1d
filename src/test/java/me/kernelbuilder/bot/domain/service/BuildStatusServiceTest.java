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

import me.kernelbuilder.bot.adapter.outbound.storage.InMemoryActiveBuildStore;
import me.kernelbuilder.bot.domain.model.ActiveBuild;
import me.kernelbuilder.bot.domain.model.BotReply;
import me.kernelbuilder.bot.domain.model.BuildConfig;
import me.kernelbuilder.bot.domain.model.WorkflowRun;
import me.kernelbuilder.bot.infrastructure.i18n.MessageService;
import me.kernelbuilder.bot.port.outbound.WorkflowApiException;
import me.kernelbuilder.bot.port.outbound.WorkflowPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BuildStatusServiceTest {

    private static final String USER_ID = "7";
    private static final String RUN_URL = "https://github.com/zyexro/kernel_builder/actions/runs/42";

    private WorkflowPort workflowPort;
    private InMemoryActiveBuildStore activeBuildStore;
    private BuildStatusService service;

    @BeforeEach
    void setUp() {
        workflowPort = mock(WorkflowPort.class);
        activeBuildStore = new InMemoryActiveBuildStore();
        service = new BuildStatusService(activeBuildStore, workflowPort, new MessageService());
    }

    @Test
    void shouldReportNoActiveBuildWithoutCallingGitHub() {
        BotReply reply = service.status(USER_ID);

        assertTrue(reply.text().contains("No active builds found"));
        verify(workflowPort, never()).listWorkflowRuns();
    }

    @Test
    void shouldRenderLatestRun() {
        recordBuild();
        when(workflowPort.listWorkflowRuns()).thenReturn(new WorkflowPort.RunsResponse(200, List.of(
                WorkflowRun.builder().id(42).status("completed").conclusion("success").htmlUrl(RUN_URL).build(),
                WorkflowRun.builder().id(41).status("completed").conclusion("failure").htmlUrl("old").build())));

        BotReply reply = service.status(USER_ID);

        assertTrue(reply.text().contains("2026-03-01 10:15:30 UTC"));
        assertTrue(reply.text().contains("<b>Status:</b> Completed"));
        assertTrue(reply.text().contains("<b>Conclusion:</b> Success"));
        assertTrue(reply.text().contains("href=\"" + RUN_URL + "\""));
    }

    @Test
    void shouldShowInProgressWhenRunNotConcluded() {
        recordBuild();
        when(workflowPort.listWorkflowRuns()).thenReturn(new WorkflowPort.RunsResponse(200, List.of(
                WorkflowRun.builder().id(42).status("in_progress").htmlUrl(RUN_URL).build())));

        BotReply reply = service.status(USER_ID);

        assertTrue(reply.text().contains("<b>Status:</b> In Progress"));
        assertTrue(reply.text().contains("<b>Conclusion:</b> In Progress"));
    }

    @Test
    void shouldShowInProgressWhenConclusionBlank() {
        recordBuild();
        when(workflowPort.listWorkflowRuns()).thenReturn(new WorkflowPort.RunsResponse(200, List.of(
                WorkflowRun.builder().id(42).status("queued").conclusion(" ").htmlUrl(RUN_URL).build())));

        BotReply reply = service.status(USER_ID);

        assertTrue(reply.text().contains("<b>Conclusion:</b> In Progress"));
    }

    @Test
    void shouldReportNoRunsFound() {
        recordBuild();
        when(workflowPort.listWorkflowRuns()).thenReturn(new WorkflowPort.RunsResponse(200, List.of()));

        assertTrue(service.status(USER_ID).text().contains("No workflow runs found"));
    }

    @Test
    void shouldReportStatusCodeOnRejection() {
        recordBuild();
        when(workflowPort.listWorkflowRuns()).thenReturn(new WorkflowPort.RunsResponse(403, List.of()));

        assertTrue(service.status(USER_ID).text().contains("Error fetching status: 403"));
    }

    @Test
    void shouldReportTransportFailure() {
        recordBuild();
        when(workflowPort.listWorkflowRuns()).thenThrow(new WorkflowApiException("read timed out", null));

        assertTrue(service.status(USER_ID).text().contains("Error checking status: read timed out"));
    }

    @Test
    void shouldHumanizeGitHubIdentifiers() {
        assertEquals("In Progress", BuildStatusService.humanize("in_progress"));
        assertEquals("Timed Out", BuildStatusService.humanize("TIMED_OUT"));
        assertEquals("Queued", BuildStatusService.humanize("queued"));
        assertEquals("", BuildStatusService.humanize(null));
    }

    private void recordBuild() {
        activeBuildStore.put(USER_ID, ActiveBuild.started(new BuildConfig(), Instant.parse("2026-03-01T10:15:30Z")));
    }
}
