package org.example.connect_volunteers.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.dialogue.InboundEvent;
import org.example.connect_volunteers.exception.StateStoreException;
import org.example.connect_volunteers.model.SessionKey;
import org.example.connect_volunteers.service.DriverOutcome;
import org.example.connect_volunteers.service.SessionDriver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Превращает Update от Telegram во {@link InboundEvent} и отдаёт его в {@link SessionDriver}.
 * <p>
 * Бот работает только в личных чатах: в группах анкету заполнять некому, такие сообщения пропускаем.
 */
@Slf4j
@Component
public class IntakeMessageHandler {

    private final SessionDriver sessionDriver;

    /**
     * Сколько раз пробуем обработать сообщение, если упала БД.
     * Повторять можно: пока состояние не сохранено, ответ не отправлялся.
     */
    private final int storeAttempts;

    public IntakeMessageHandler(SessionDriver sessionDriver,
                                @Value("${telegram.bot.store-attempts:3}") int storeAttempts) {
        if (storeAttempts < 1) {
            throw new IllegalArgumentException("telegram.bot.store-attempts должен быть >= 1");
        }
        this.sessionDriver = sessionDriver;
        this.storeAttempts = storeAttempts;
    }

    /**
     * Обработать событие от Telegram.
     *
     * @param update объект Update от Telegram
     */
    public void handle(Update update) {
        if (!update.hasMessage()) {
            log.debug("Update без сообщения, пропускаем: updateId={}", update.getUpdateId());
            return;
        }

        Message message = update.getMessage();
        if (message.getChat() == null || !message.getChat().isUserChat()) {
            log.info("Чат не личный, пропускаем: chatId={}", message.getChatId());
            return;
        }

        SessionKey key = SessionKey.of(message.getChatId());
        InboundEvent event = message.hasText()
                ? InboundEvent.text(key, message.getText())
                : InboundEvent.nonText(key);

        for (int attempt = 1; attempt <= storeAttempts; attempt++) {
            try {
                DriverOutcome outcome = sessionDriver.handle(event);
                log.debug("Сообщение обработано: {}, outcome={}", key, outcome);
                return;
            } catch (StateStoreException e) {
                if (attempt == storeAttempts) {
                    log.error("Сообщение НЕ обработано: хранилище состояний недоступно, попыток={}: {}",
                            attempt, key, e);
                } else {
                    log.warn("Хранилище состояний недоступно, повторяем: {}, попытка {} из {}",
                            key, attempt, storeAttempts, e);
                }
            }
        }
    }
}
