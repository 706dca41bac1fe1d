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

import java.util.Optional;

/**
 * Answer to the build confirmation prompt, carried by inline button callback
 * data.
 */
public enum ConfirmationChoice {

    CONFIRM("build:confirm"),
    CANCEL("build:cancel");

    private final String callbackData;

    ConfirmationChoice(String callbackData) {
        this.callbackData = callbackData;
    }

    public String getCallbackData() {
        return callbackData;
    }

    public static Optional<ConfirmationChoice> fromCallbackData(String data) {
        for (ConfirmationChoice choice : values()) {
            if (choice.callbackData.equals(data)) {
                return Optional.of(choice);
            }
        }
        return Optional.empty();
    }
}
