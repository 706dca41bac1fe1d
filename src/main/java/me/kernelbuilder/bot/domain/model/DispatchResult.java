package me.kernelbuilder.bot.domain.model;

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

/**
 * Outcome of a workflow dispatch: whether GitHub accepted it, the text shown to
 * the user, and the run link when it could be resolved.
 */
public record DispatchResult(boolean succeeded, String message, String runUrl) {

    public static DispatchResult success(String message, String runUrl) {
        return new DispatchResult(true, message, runUrl);
    }

    public static DispatchResult failure(String message) {
        return new DispatchResult(false, message, null);
    }
}
