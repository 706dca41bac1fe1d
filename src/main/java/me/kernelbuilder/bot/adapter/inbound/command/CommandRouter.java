package me.kernelbuilder.bot.adapter.inbound.command;

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
import me.kernelbuilder.bot.domain.service.BuildConversationService;
import me.kernelbuilder.bot.domain.service.BuildStatusService;
import me.kernelbuilder.bot.infrastructure.config.BotProperties;
import me.kernelbuilder.bot.infrastructure.i18n.MessageService;
import me.kernelbuilder.bot.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Routes slash commands to the build services.
 *
 * <p>
 * Available commands:
 * <ul>
 * <li>/start - welcome text
 * <li>/help - commands, build steps and required setup
 * <li>/build - start (or restart) the build dialog
 * <li>/status - latest run of the last dispatched build
 * <li>/cancel - discard the build dialog
 * </ul>
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_START = "start";
    private static final String CMD_HELP = "help";
    private static final String CMD_BUILD = "build";
    private static final String CMD_STATUS = "status";
    private static final String CMD_CANCEL = "cancel";

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_START, "command.start.description"),
            new CommandDefinition(CMD_HELP, "command.help.description"),
            new CommandDefinition(CMD_BUILD, "command.build.description"),
            new CommandDefinition(CMD_STATUS, "command.status.description"),
            new CommandDefinition(CMD_CANCEL, "command.cancel.description"));

    private static final Set<String> KNOWN_COMMAND_SET = COMMANDS.stream()
            .map(CommandDefinition::name)
            .collect(Collectors.toUnmodifiableSet());

    private final BuildConversationService conversationService;
    private final BuildStatusService statusService;
    private final MessageService messageService;
    private final BotProperties properties;

    public CommandRouter(BuildConversationService conversationService, BuildStatusService statusService,
            MessageService messageService, BotProperties properties) {
        this.conversationService = conversationService;
        this.statusService = statusService;
        this.messageService = messageService;
        this.properties = properties;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMAND_SET);
    }

    @Override
    public BotReply execute(String command, CommandContext context) {
        log.debug("Executing command: /{} (chat={}, user={})", command, context.chatId(), context.userId());
        return switch (command) {
        case CMD_START -> BotReply.text(messageService.getMessage("welcome"));
        case CMD_HELP -> handleHelp();
        case CMD_BUILD -> conversationService.startBuild(context.chatId(), context.userId());
        case CMD_STATUS -> statusService.status(context.userId());
        case CMD_CANCEL -> conversationService.cancel(context.chatId(), context.userId());
        default -> BotReply.text(messageService.getMessage("command.unknown", command));
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    private BotReply handleHelp() {
        StringBuilder sb = new StringBuilder();
        for (CommandDefinition command : listCommands()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(messageService.getMessage("help.command", command.name(),
                    messageService.getMessage(command.descriptionKey())));
        }
        BotProperties.GitHubProperties github = properties.getGithub();
        String repositoryUrl = "https://github.com/" + github.getOwner() + "/" + github.getRepo();
        return BotReply.text(messageService.getMessage("help", sb.toString(), repositoryUrl));
    }
}
