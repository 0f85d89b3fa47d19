package org.example.connect_volunteers.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.Bot;
import org.example.connect_volunteers.dialogue.Reply;
import org.example.connect_volunteers.exception.TransportException;
import org.example.connect_volunteers.model.SessionKey;
import org.example.connect_volunteers.service.ReplyTransport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardRemove;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/**
 * Отправка ответов бота в Telegram.
 * <p>
 * Кнопки из {@link Reply#suggestedReplies()} рисуем обычной клавиатурой (ReplyKeyboardMarkup) в одну строку:
 * нажатие на кнопку приходит боту как текстовое сообщение с текстом кнопки.
 */
@Slf4j
@Component
public class TelegramReplySender implements ReplyTransport {

    // @Lazy - разрываем цикл Bot → IntakeMessageHandler → SessionDriver → TelegramReplySender → Bot
    @Autowired
    @Lazy
    private Bot bot;

    @Override
    public void send(SessionKey key, Reply reply) {
        SendMessage message = toSendMessage(key, reply);
        try {
            bot.execute(message);
            log.debug("Ответ отправлен: {}, buttons={}", key, reply.suggestedReplies().size());
        } catch (TelegramApiException e) {
            throw new TransportException("Не удалось отправить сообщение в Telegram: " + key, e);
        }
    }

    /**
     * Собрать SendMessage из ответа.
     * Без parseMode: в сводке анкеты текст юзера, в нём могут быть * и _.
     */
    SendMessage toSendMessage(SessionKey key, Reply reply) {
        SendMessage message = new SendMessage();
        message.setChatId(String.valueOf(key.chatId()));
        message.setText(reply.text());

        if (!reply.suggestedReplies().isEmpty()) {
            KeyboardRow row = new KeyboardRow();
            reply.suggestedReplies().forEach(row::add);

            ReplyKeyboardMarkup keyboard = new ReplyKeyboardMarkup();
            keyboard.setKeyboard(List.of(row));
            keyboard.setResizeKeyboard(true);
            message.setReplyMarkup(keyboard);
        } else {
            // Кнопок нет - убираем клавиатуру прошлого шага
            message.setReplyMarkup(new ReplyKeyboardRemove(true));
        }
        return message;
    }
}
