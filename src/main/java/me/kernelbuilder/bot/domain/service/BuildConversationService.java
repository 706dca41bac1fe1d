package me.kernelbuilder.bot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.kernelbuilder.bot.domain.model.ActiveBuild;
import me.kernelbuilder.bot.domain.model.BotReply;
import me.kernelbuilder.bot.domain.model.BuildConfig;
import me.kernelbuilder.bot.domain.model.BuildConversation;
import me.kernelbuilder.bot.domain.model.BuildConversationState;
import me.kernelbuilder.bot.domain.model.BuildField;
import me.kernelbuilder.bot.domain.model.ConfirmationChoice;
import me.kernelbuilder.bot.domain.model.DispatchResult;
import me.kernelbuilder.bot.infrastructure.config.BotProperties;
import me.kernelbuilder.bot.infrastructure.i18n.MessageService;
import me.kernelbuilder.bot.port.outbound.ActiveBuildStore;
import me.kernelbuilder.bot.port.outbound.BuildSessionStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Guided collection of build parameters, one field per message.
 *
 * <p>
 * Conversations are keyed by chat and user, so different users never share a
 * record. A conversation starts from the configured defaults, walks through
 * the field stages of {@link BuildConversationState} and ends with a
 * confirm/cancel choice. Confirmation removes the conversation from the store
 * before dispatching, so a repeated confirm finds nothing and dispatches
 * nothing.
 *
 * <p>
 * Replies are Telegram HTML; every user value is escaped before it is
 * embedded.
 */
@Service
@Slf4j
public class BuildConversationService {

    private static final Map<BuildField, String> FIELD_KEYS = Map.of(
            BuildField.COMPILER, "compiler",
            BuildField.KERNEL_REPO_URL, "kernel-repo",
            BuildField.KERNEL_BRANCH, "kernel-branch",
            BuildField.CONTAINER_IMAGE, "container",
            BuildField.NOTES, "notes",
            BuildField.KERNEL_SU_MODE, "ksu");

    private static final String PARAGRAPH = "\n\n";

    private final BuildSessionStore sessionStore;
    private final ActiveBuildStore activeBuildStore;
    private final WorkflowDispatchService dispatchService;
    private final MessageService messageService;
    private final BotProperties properties;
    private final Clock clock;

    public BuildConversationService(BuildSessionStore sessionStore, ActiveBuildStore activeBuildStore,
            WorkflowDispatchService dispatchService, MessageService messageService,
            BotProperties properties, Clock clock) {
        this.sessionStore = sessionStore;
        this.activeBuildStore = activeBuildStore;
        this.dispatchService = dispatchService;
        this.messageService = messageService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts a conversation from the defaults, replacing any conversation the
     * user already has in this chat.
     */
    public BotReply startBuild(String chatId, String userId) {
        BuildConversation conversation = BuildConversation.builder()
                .chatId(chatId)
                .userId(userId)
                .state(BuildConversationState.AWAITING_COMPILER)
                .config(defaultConfig())
                .startedAt(clock.instant())
                .build();
        sessionStore.save(conversation);
        log.debug("[Build] Conversation {} started", conversation.key());

        return BotReply.text(messageService.getMessage("build.intro") + PARAGRAPH + prompt(conversation));
    }

    public BotReply handleText(String chatId, String userId, String text) {
        Optional<BuildConversation> found = sessionStore.get(BuildConversation.key(chatId, userId));
        if (found.isEmpty()) {
            return BotReply.text(messageService.getMessage("build.not-in-progress"));
        }
        BuildConversation conversation = found.get();
        if (conversation.getState() == BuildConversationState.AWAITING_CONFIRMATION) {
            return summary(conversation.getConfig());
        }
        if (!conversation.getState().isCollectingField()) {
            sessionStore.remove(conversation.key());
            return BotReply.text(messageService.getMessage("build.not-in-progress"));
        }

        BuildField field = conversation.getState().field();
        String accepted = conversation.answer(text);
        sessionStore.save(conversation);
        log.debug("[Build] Conversation {} accepted {} and moved to {}", conversation.key(), field,
                conversation.getState());

        String echo = messageService.getMessage("build.accepted." + FIELD_KEYS.get(field), display(accepted));
        if (conversation.getState() == BuildConversationState.AWAITING_CONFIRMATION) {
            BotReply summary = summary(conversation.getConfig());
            return BotReply.withActions(echo + PARAGRAPH + summary.text(), summary.actions());
        }
        return BotReply.text(echo + PARAGRAPH + prompt(conversation));
    }

    public BotReply handleConfirmation(String chatId, String userId, ConfirmationChoice choice) {
        String key = BuildConversation.key(chatId, userId);
        Optional<BuildConversation> pending = sessionStore.get(key)
                .filter(c -> c.getState() == BuildConversationState.AWAITING_CONFIRMATION);
        if (pending.isEmpty()) {
            return BotReply.text(messageService.getMessage("build.not-in-progress"));
        }
        // whoever removes the record owns the confirmation
        Optional<BuildConversation> removed = sessionStore.remove(key);
        if (removed.isEmpty() || removed.get().getState() != BuildConversationState.AWAITING_CONFIRMATION) {
            return BotReply.text(messageService.getMessage("build.not-in-progress"));
        }

        BuildConversation conversation = removed.get();
        conversation.setState(conversation.getState().resolve(choice));
        if (conversation.getState() == BuildConversationState.CANCELLED) {
            log.info("[Build] Conversation {} cancelled at confirmation", key);
            return BotReply.text(messageService.getMessage("build.cancelled"));
        }

        BuildConfig config = conversation.getConfig();
        DispatchResult result = dispatchService.dispatch(config);
        if (!result.succeeded()) {
            log.info("[Build] Dispatch for user {} failed", userId);
            return BotReply.text(messageService.getMessage("build.failed", result.message()));
        }

        activeBuildStore.put(userId, ActiveBuild.started(config, clock.instant()));
        if (result.runUrl() != null) {
            log.info("[Build] Dispatch for user {} accepted, latest run {}", userId, result.runUrl());
        } else {
            log.info("[Build] Dispatch for user {} accepted", userId);
        }
        return BotReply.text(messageService.getMessage("build.started", result.message()));
    }

    /**
     * Discards the conversation in any stage. The reply is the same whether or
     * not a conversation existed.
     */
    public BotReply cancel(String chatId, String userId) {
        Optional<BuildConversation> removed = sessionStore.remove(BuildConversation.key(chatId, userId));
        removed.ifPresent(c -> log.info("[Build] Conversation {} cancelled in {}", c.key(), c.getState()));
        return BotReply.text(messageService.getMessage("build.configuration-cancelled"));
    }

    BuildConfig defaultConfig() {
        BotProperties.BuildDefaults defaults = properties.getBuild().getDefaults();
        BuildConfig config = new BuildConfig();
        config.set(BuildField.COMPILER, trim(defaults.getCompiler()));
        config.set(BuildField.KERNEL_REPO_URL, trim(defaults.getKernelRepoUrl()));
        config.set(BuildField.KERNEL_BRANCH, trim(defaults.getKernelBranch()));
        config.set(BuildField.CONTAINER_IMAGE, trim(defaults.getContainerImage()));
        config.set(BuildField.NOTES, trim(defaults.getNotes()));
        config.set(BuildField.SUFFIX, trim(defaults.getSuffix()));
        config.set(BuildField.ZIP_REPO_URL, trim(defaults.getZipRepoUrl()));
        config.set(BuildField.ZIP_BRANCH, trim(defaults.getZipBranch()));
        config.set(BuildField.KERNEL_SU_MODE, trim(defaults.getKernelSuMode()));
        return config;
    }

    private String prompt(BuildConversation conversation) {
        BuildField field = conversation.getState().field();
        return messageService.getMessage("build.prompt." + FIELD_KEYS.get(field),
                display(conversation.getConfig().get(field)));
    }

    private BotReply summary(BuildConfig config) {
        String text = messageService.getMessage("build.summary",
                HtmlText.escape(config.get(BuildField.COMPILER)),
                HtmlText.escape(config.get(BuildField.KERNEL_REPO_URL)),
                HtmlText.escape(config.get(BuildField.KERNEL_BRANCH)),
                HtmlText.escape(config.get(BuildField.CONTAINER_IMAGE)),
                display(config.get(BuildField.NOTES)),
                display(config.get(BuildField.KERNEL_SU_MODE)));
        return BotReply.withActions(text, List.of(
                new BotReply.Action(messageService.getMessage("build.button.confirm"),
                        ConfirmationChoice.CONFIRM.getCallbackData()),
                new BotReply.Action(messageService.getMessage("build.button.cancel"),
                        ConfirmationChoice.CANCEL.getCallbackData())));
    }

    private String display(String value) {
        return value.isEmpty() ? messageService.getMessage("build.none") : HtmlText.escape(value);
    }

    private static String trim(String value) {
        return value != null ? value.trim() : "";
    }
}
