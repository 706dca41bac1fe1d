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
 * Build parameters understood by the kernel builder workflow. Each field knows
 * the {@code workflow_dispatch} input key it is sent under and whether the
 * workflow requires it.
 */
public enum BuildField {

    COMPILER("COMPILER", true),
    KERNEL_REPO_URL("KREPO", true),
    KERNEL_BRANCH("KBRANCH", true),
    CONTAINER_IMAGE("CONTAINER", true),
    NOTES("NOTES", false),
    SUFFIX("SUFFIX", false),
    ZIP_REPO_URL("ZREPO", false),
    ZIP_BRANCH("ZBRANCH", false),
    KERNEL_SU_MODE("KSU", false),
    NOTIFY_RECIPIENT("TG_RECIPIENT", false);

    private final String inputKey;
    private final boolean required;

    BuildField(String inputKey, boolean required) {
        this.inputKey = inputKey;
        this.required = required;
    }

    public String getInputKey() {
        return inputKey;
    }

    public boolean isRequired() {
        return required;
    }
}
