package me.kernelbuilder.bot.port.inbound;

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

import me.kernelbuilder.bot.domain.model.BotReply;

import java.util.List;

/**
 * Port for executing slash commands (/build, /status, etc.). Commands are
 * routed before free-text handling by channel adapters.
 */
public interface CommandPort {

    /**
     * Executes a command for the given user.
     *
     * @param command
     *            command name without leading slash
     * @param context
     *            chat and user the command came from
     * @return reply to send back
     */
    BotReply execute(String command, CommandContext context);

    /**
     * Checks if a command with the given name is registered.
     */
    boolean hasCommand(String command);

    /**
     * Returns all registered commands.
     */
    List<CommandDefinition> listCommands();

    /**
     * Identifies where a command came from.
     */
    record CommandContext(String channelType, String chatId, String userId) {
    }

    /**
     * Command name and the message key of its description.
     */
    record CommandDefinition(String name, String descriptionKey) {
    }
}
