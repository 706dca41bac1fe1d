package me.kernelbuilder.bot.port.outbound;

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

import java.util.List;
import java.util.Map;

/**
 * Port for the remote automation service that runs kernel builds (GitHub
 * Actions). The target repository and workflow are fixed at startup.
 *
 * <p>
 * Both calls return whatever status the service answered with; deciding what
 * counts as success is up to the caller. Transport and parsing failures are
 * raised as {@link WorkflowApiException}.
 */
public interface WorkflowPort {

    /**
     * Status returned by GitHub when a dispatch is accepted.
     */
    int DISPATCH_ACCEPTED = 204;

    /**
     * Requests a new run of the configured workflow.
     *
     * @param ref
     *            branch or tag the workflow definition is taken from
     * @param inputs
     *            workflow inputs, sent as-is
     * @return HTTP status and raw body of the answer
     * @throws WorkflowApiException
     *             if the service could not be reached
     */
    DispatchResponse dispatchWorkflow(String ref, Map<String, String> inputs);

    /**
     * Lists the most recent runs of the repository, newest first.
     *
     * @throws WorkflowApiException
     *             if the service could not be reached or answered with an
     *             unreadable body
     */
    RunsResponse listWorkflowRuns();

    /**
     * Answer to a dispatch request.
     */
    record DispatchResponse(int statusCode, String body) {

        public boolean isAccepted() {
            return statusCode == DISPATCH_ACCEPTED;
        }
    }

    /**
     * Answer to a runs listing. {@code runs} is empty unless the status is 200.
     */
    record RunsResponse(int statusCode, List<WorkflowRun> runs) {

        public RunsResponse {
            runs = runs != null ? List.copyOf(runs) : List.of();
        }

        public boolean isSuccessful() {
            return statusCode == 200;
        }
    }
}
