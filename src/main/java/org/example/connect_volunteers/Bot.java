package org.example.connect_volunteers;

import lombok.extern.slf4j.Slf4j;
import org.apache.http.client.config.RequestConfig;
import org.example.connect_volunteers.handler.IntakeMessageHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Главный класс бота - слушает сообщения от Telegram.
 * <p>
 * TelegramLongPollingBot: бот постоянно спрашивает у Telegram "есть новые сообщения?"
 * и отдаёт каждое в {@link IntakeMessageHandler}.
 * <p>
 * Все запросы к Telegram ограничены таймаутом ({@code telegram.bot.request-timeout-ms}),
 * чтобы отправка ответа не могла повиснуть навсегда.
 */
@Slf4j
@Component
public class Bot extends TelegramLongPollingBot {

    private final String botUsername;

    private final IntakeMessageHandler intakeMessageHandler;

    public Bot(@Value("${telegram.bot.token}") String botToken,
               @Value("${telegram.bot.username}") String botUsername,
               @Value("${telegram.bot.request-timeout-ms:30000}") int requestTimeoutMs,
               @Value("${telegram.bot.updates-timeout-seconds:20}") int updatesTimeoutSeconds,
               IntakeMessageHandler intakeMessageHandler) {
        super(botOptions(requestTimeoutMs, updatesTimeoutSeconds), botToken);
        this.botUsername = botUsername;
        this.intakeMessageHandler = intakeMessageHandler;
    }

    /**
     * Настройки HTTP-клиента бота.
     * <p>
     * getUpdates - это long polling: Telegram держит запрос открытым до {@code updatesTimeoutSeconds}.
     * Поэтому таймаут сокета должен быть больше, иначе каждый пустой опрос будет падать по таймауту.
     */
    static DefaultBotOptions botOptions(int requestTimeoutMs, int updatesTimeoutSeconds) {
        if (updatesTimeoutSeconds * 1000L >= requestTimeoutMs) {
            throw new IllegalArgumentException("telegram.bot.updates-timeout-seconds должен быть меньше request-timeout-ms: "
                    + updatesTimeoutSeconds + "s >= " + requestTimeoutMs + "ms");
        }
        DefaultBotOptions options = new DefaultBotOptions();
        options.setGetUpdatesTimeout(updatesTimeoutSeconds);
        options.setRequestConfig(RequestConfig.custom()
                .setConnectTimeout(requestTimeoutMs)
                .setConnectionRequestTimeout(requestTimeoutMs)
                .setSocketTimeout(requestTimeoutMs)
                .build());
        return options;
    }

    /**
     * Вызывается на КАЖДОЕ событие от Telegram.
     */
    @Override
    public void onUpdateReceived(Update update) {
        intakeMessageHandler.handle(update);
    }

    /**
     * Username бота без @ (должен совпадать с тем, что выдал @BotFather).
     */
    @Override
    public String getBotUsername() {
        return botUsername;
    }
}
