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

import java.util.List;

/**
 * Rendered response to a user event. The text is Telegram HTML; actions, when
 * present, are shown as inline buttons below it.
 */
public record BotReply(String text, List<Action> actions) {

    public BotReply {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static BotReply text(String text) {
        return new BotReply(text, List.of());
    }

    public static BotReply withActions(String text, List<Action> actions) {
        return new BotReply(text, actions);
    }

    public boolean hasActions() {
        return !actions.isEmpty();
    }

    /**
     * Inline button: label plus the callback data sent back when pressed.
     */
    public record Action(String label, String callbackData) {
    }
}
