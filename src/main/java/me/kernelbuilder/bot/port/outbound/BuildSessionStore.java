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

import me.kernelbuilder.bot.domain.model.BuildConversation;

import java.util.Optional;

/**
 * Port for in-progress build dialogs, keyed by
 * {@link BuildConversation#key()}.
 */
public interface BuildSessionStore {

    Optional<BuildConversation> get(String key);

    void save(BuildConversation conversation);

    /**
     * Removes and returns the dialog. Only one of several concurrent callers
     * receives it.
     */
    Optional<BuildConversation> remove(String key);
}
