package com.programmersdiary.crondaemon.telegram;

import com.programmersdiary.crondaemon.chat.ChatService;
import com.programmersdiary.crondaemon.command.CommandRouter;
import com.programmersdiary.crondaemon.session.DeliveryException;
import com.programmersdiary.crondaemon.session.Session;
import com.programmersdiary.crondaemon.session.SessionRegistry;
import com.programmersdiary.crondaemon.session.TransportKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Telegram long-polling interface. All allowed chats share the {@code telegram} conversation; each chat
 * that has written to the bot is attached as its own session so scheduled output reaches it.
 */
@Component
@ConditionalOnProperty(name = "crondaemon.telegram.enabled", havingValue = "true")
public class TelegramTransport implements LongPollingSingleThreadUpdateConsumer, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TelegramTransport.class);

    public static final String LINEAGE = "telegram";
    static final int MAX_MESSAGE_LENGTH = 4000;

    private final TelegramConfig config;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramClient telegramClient;
    private final SessionRegistry sessionRegistry;
    private final ChatService chatService;
    private final CommandRouter commandRouter;
    private final Map<String, Session> sessionsByChat = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private volatile boolean running;

    public TelegramTransport(TelegramConfig config,
                             TelegramBotsLongPollingApplication botsApplication,
                             TelegramClient telegramClient,
                             SessionRegistry sessionRegistry,
                             ChatService chatService,
                             CommandRouter commandRouter) {
        this.config = config;
        this.botsApplication = botsApplication;
        this.telegramClient = telegramClient;
        this.sessionRegistry = sessionRegistry;
        this.chatService = chatService;
        this.commandRouter = commandRouter;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            if (config.token().isEmpty()) {
                log.error("Telegram is enabled but crondaemon.telegram.token is empty; not starting");
                return;
            }
            try {
                botsApplication.registerBot(config.token(), this);
                running = true;
                log.info("Telegram transport started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram transport", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            sessionsByChat.values().forEach(s -> sessionRegistry.detach(s.handle()));
            sessionsByChat.clear();
            try {
                botsApplication.close();
                log.info("Telegram transport stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram transport", e);
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }
        var message = update.getMessage();
        var chatId = message.getChatId().toString();
        var userId = message.getFrom() != null ? message.getFrom().getId() : null;
        if (userId == null || !config.isAllowed(userId)) {
            log.warn("Ignoring message from unauthorized user {}", userId);
            return;
        }
        sessionsByChat.computeIfAbsent(chatId, id -> sessionRegistry.attach(TransportKind.TELEGRAM, LINEAGE,
                text -> send(id, text)));

        var text = message.getText().strip();
        log.info("Message received from chat {}", chatId);
        try {
            if (CommandRouter.isCommand(text)) {
                reply(chatId, commandRouter.execute(text, LINEAGE).output());
                return;
            }
            showTyping(chatId);
            var chatReply = chatService.chat(LINEAGE, text);
            chatReply.notices().forEach(notice -> reply(chatId, notice));
            if (!chatReply.text().isBlank()) {
                reply(chatId, chatReply.text());
            }
        } catch (RuntimeException e) {
            log.error("Message from chat {} failed: {}", chatId, e.getMessage(), e);
            reply(chatId, "❌ Error: " + e.getMessage());
        }
    }

    void send(String chatId, String text) throws DeliveryException {
        for (var chunk : splitAtNewlines(text, MAX_MESSAGE_LENGTH)) {
            try {
                telegramClient.execute(SendMessage.builder()
                        .chatId(chatId)
                        .text(chunk)
                        .build());
            } catch (TelegramApiRequestException e) {
                var code = e.getErrorCode();
                boolean transientFailure = code == null || code == 429 || code >= 500;
                throw new DeliveryException("Telegram rejected message to " + chatId + ": " + e.getMessage(),
                        transientFailure, e);
            } catch (TelegramApiException e) {
                throw new DeliveryException("Telegram send to " + chatId + " failed: " + e.getMessage(), true, e);
            }
        }
    }

    private void reply(String chatId, String text) {
        try {
            send(chatId, text);
        } catch (DeliveryException e) {
            log.warn("Reply to chat {} failed: {}", chatId, e.getMessage());
        }
    }

    private void showTyping(String chatId) {
        try {
            telegramClient.execute(SendChatAction.builder()
                    .chatId(chatId)
                    .action(ActionType.TYPING.toString())
                    .build());
        } catch (TelegramApiException e) {
            log.debug("Failed to send typing indicator", e);
        }
    }

    /**
     * Splits text at paragraph or line boundaries so every chunk fits in one Telegram message.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }
        var chunks = new ArrayList<String>();
        int start = 0;
        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }
            var segment = text.substring(start, start + maxLength);
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
            chunks.add(segment);
            start += maxLength;
        }
        return chunks;
    }
}
