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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * In-progress build dialog of one user in one chat. Holds the stage and the
 * partially filled configuration; discarded when the dialog ends.
 */
@Data
@Builder
public class BuildConversation {

    private String chatId;
    private String userId;
    private BuildConversationState state;
    private BuildConfig config;
    private Instant startedAt;

    public static String key(String chatId, String userId) {
        return chatId + ":" + userId;
    }

    public String key() {
        return key(chatId, userId);
    }

    /**
     * Applies the answer for the current field stage and advances to the next
     * stage.
     *
     * @return the value the field holds after the answer
     */
    public String answer(String text) {
        if (!state.isCollectingField()) {
            throw new IllegalStateException("Stage " + state + " does not collect a field");
        }
        BuildField field = state.field();
        String accepted = config.apply(field, FieldOverride.parse(field, text));
        state = state.next();
        return accepted;
    }
}
