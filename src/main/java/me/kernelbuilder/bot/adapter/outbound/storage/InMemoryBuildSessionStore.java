package me.kernelbuilder.bot.adapter.outbound.storage;

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
import me.kernelbuilder.bot.port.outbound.BuildSessionStore;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local table of build dialogs in progress, keyed by chat and user.
 */
@Component
public class InMemoryBuildSessionStore implements BuildSessionStore {

    private final Map<String, BuildConversation> conversations = new ConcurrentHashMap<>();

    @Override
    public Optional<BuildConversation> get(String key) {
        return Optional.ofNullable(conversations.get(key));
    }

    @Override
    public void save(BuildConversation conversation) {
        conversations.put(conversation.key(), conversation);
    }

    @Override
    public Optional<BuildConversation> remove(String key) {
        return Optional.ofNullable(conversations.remove(key));
    }
}
