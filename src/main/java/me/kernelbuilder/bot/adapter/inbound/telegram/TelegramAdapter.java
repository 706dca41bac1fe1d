package me.kernelbuilder.bot.adapter.inbound.telegram;

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
import me.kernelbuilder.bot.domain.model.ConfirmationChoice;
import me.kernelbuilder.bot.domain.service.BuildConversationService;
import me.kernelbuilder.bot.infrastructure.config.BotProperties;
import me.kernelbuilder.bot.infrastructure.i18n.MessageService;
import me.kernelbuilder.bot.port.inbound.ChannelPort;
import me.kernelbuilder.bot.port.inbound.CommandPort;
import me.kernelbuilder.bot.security.AllowlistValidator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for outbound replies and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates:
 * <ul>
 * <li>Slash commands are routed through {@link CommandPort}
 * <li>Other text goes to the build dialog in {@link BuildConversationService}
 * <li>{@code build:*} button presses resolve the confirmation and edit the
 * summary message in place
 * </ul>
 *
 * <p>
 * Users outside {@code bot.channels.telegram.allow-from} get a refusal and
 * nothing else. Replies are sent as HTML; if Telegram rejects the markup the
 * same text is sent again without it.
 *
 * <p>
 * The adapter is only started when {@code bot.channels.telegram.enabled=true}
 * and a token is configured.
 *
 * @see me.kernelbuilder.bot.port.inbound.ChannelPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String PARSE_MODE_HTML = "HTML";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int MESSAGE_CHUNK_LENGTH = 3800;

    private final BotProperties properties;
    private final AllowlistValidator allowlistValidator;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;
    private final BuildConversationService conversationService;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private BotProperties.ChannelProperties channelProperties() {
        return properties.getChannels().get(CHANNEL_TYPE);
    }

    private boolean isEnabled() {
        BotProperties.ChannelProperties channel = channelProperties();
        return channel != null && channel.isEnabled();
    }

    private String token() {
        BotProperties.ChannelProperties channel = channelProperties();
        return channel != null ? channel.getToken() : null;
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled())
            return;

        String token = token();
        if (token == null || token.isBlank()) {
            log.warn("Telegram token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("Telegram client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(token(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasCallbackQuery()) {
            handleCallback(update.getCallbackQuery());
        } else if (update.hasMessage()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleCallback(CallbackQuery callback) {
        answerCallback(callback.getId());
        if (callback.getMessage() == null) {
            log.warn("Callback query without associated message, ignoring");
            return;
        }
        String chatId = callback.getMessage().getChatId().toString();
        Integer messageId = callback.getMessage().getMessageId();
        String userId = callback.getFrom().getId().toString();
        String data = callback.getData();

        log.debug("Callback: {}", data);

        if (!isAuthorized(userId)) {
            log.warn("Unauthorized callback from user: {} in chat: {}", userId, chatId);
            sendReply(chatId, BotReply.text(messageService.getMessage("security.unauthorized")));
            return;
        }

        Optional<ConfirmationChoice> choice = ConfirmationChoice.fromCallbackData(data);
        if (choice.isEmpty()) {
            log.warn("Unknown callback data: {}", data);
            return;
        }

        BotReply reply = conversationService.handleConfirmation(chatId, userId, choice.get());
        editOrSend(chatId, messageId, reply);
    }

    private void handleMessage(Message telegramMessage) {
        if (!telegramMessage.hasText() || telegramMessage.getFrom() == null) {
            return;
        }
        String chatId = telegramMessage.getChatId().toString();
        String userId = telegramMessage.getFrom().getId().toString();

        if (!isAuthorized(userId)) {
            log.warn("Unauthorized user: {} in chat: {}", userId, chatId);
            sendReply(chatId, BotReply.text(messageService.getMessage("security.unauthorized")));
            return;
        }

        String text = telegramMessage.getText();
        if (text.startsWith("/")) {
            String cmd = text.split("\\s+", 2)[0].substring(1).split("@")[0]; // strip / and @botname
            CommandPort router = commandRouter.getIfAvailable();
            if (router != null) {
                if (!router.hasCommand(cmd)) {
                    sendReply(chatId, BotReply.text(messageService.getMessage("command.unknown", cmd)));
                    return;
                }
                try {
                    CommandPort.CommandContext context = new CommandPort.CommandContext(CHANNEL_TYPE, chatId, userId);
                    sendReply(chatId, router.execute(cmd, context));
                } catch (RuntimeException e) {
                    log.error("Command execution failed: /{}", cmd, e);
                }
                return;
            }
        }

        sendReply(chatId, conversationService.handleText(chatId, userId, text));
    }

    @Override
    public void sendReply(String chatId, BotReply reply) {
        // Split long replies at paragraph/line boundaries (Telegram limit is 4096
        // chars); the keyboard goes with the last chunk
        List<String> chunks = splitAtNewlines(reply.text(), MESSAGE_CHUNK_LENGTH);
        for (int i = 0; i < chunks.size(); i++) {
            InlineKeyboardMarkup markup = i == chunks.size() - 1 ? keyboard(reply) : null;
            sendChunk(chatId, chunks.get(i), markup);
        }
    }

    private void sendChunk(String chatId, String chunk, InlineKeyboardMarkup markup) {
        SendMessage html = SendMessage.builder()
                .chatId(chatId)
                .text(truncate(chunk))
                .parseMode(PARSE_MODE_HTML)
                .replyMarkup(markup)
                .build();
        try {
            telegramClient.execute(html);
        } catch (TelegramApiException htmlEx) {
            // Fallback: retry without formatting if HTML parsing fails
            log.debug("HTML parse failed, retrying as plain text: {}", htmlEx.getMessage());
            SendMessage plain = SendMessage.builder()
                    .chatId(chatId)
                    .text(truncate(toPlainText(chunk)))
                    .replyMarkup(markup)
                    .build();
            try {
                telegramClient.execute(plain);
            } catch (TelegramApiException e) {
                log.error("Failed to send message to chat: {}", chatId, e);
            }
        }
    }

    @Override
    public boolean isAuthorized(String senderId) {
        return allowlistValidator.isAllowed(CHANNEL_TYPE, senderId);
    }

    private void editOrSend(String chatId, Integer messageId, BotReply reply) {
        if (reply.text().length() > MESSAGE_CHUNK_LENGTH) {
            sendReply(chatId, reply);
            return;
        }
        try {
            EditMessageText edit = EditMessageText.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .text(reply.text())
                    .parseMode(PARSE_MODE_HTML)
                    .build();
            telegramClient.execute(edit);
        } catch (TelegramApiException e) {
            log.debug("Failed to edit confirmation message, sending a new one: {}", e.getMessage());
            sendReply(chatId, reply);
        }
    }

    private void answerCallback(String callbackQueryId) {
        try {
            telegramClient.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackQueryId)
                    .build());
        } catch (TelegramApiException e) {
            log.debug("Failed to answer callback query", e);
        }
    }

    private static InlineKeyboardMarkup keyboard(BotReply reply) {
        if (!reply.hasActions()) {
            return null;
        }
        InlineKeyboardRow row = new InlineKeyboardRow();
        for (BotReply.Action action : reply.actions()) {
            row.add(InlineKeyboardButton.builder()
                    .text(action.label())
                    .callbackData(action.callbackData())
                    .build());
        }
        return InlineKeyboardMarkup.builder()
                .keyboardRow(row)
                .build();
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength, so HTML tags, which never span lines in replies, stay whole.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            // Hard split as last resort
            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }

    private static String truncate(String text) {
        if (text.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
            return text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
        }
        return text;
    }

    /**
     * Strips tags and decodes the entities produced by HTML escaping.
     */
    static String toPlainText(String html) {
        return html.replaceAll("<[^>]+>", "")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&amp;", "&");
    }
}
