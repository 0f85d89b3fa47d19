package org.example.connect_volunteers.dialogue;

import java.util.List;

/**
 * Ответ бота.
 * <p>
 * {@code suggestedReplies} - кнопки, которые транспорт покажет под полем ввода.
 * Пустой список - кнопок нет, клавиатура от прошлого шага убирается.
 *
 * @param text             текст сообщения
 * @param suggestedReplies кнопки (по порядку), может быть пустым
 */
public record Reply(String text, List<String> suggestedReplies) {

    public Reply {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Текст ответа не может быть пустым");
        }
        suggestedReplies = suggestedReplies == null ? List.of() : List.copyOf(suggestedReplies);
    }

    public static Reply withKeyboard(String text, List<String> suggestedReplies) {
        return new Reply(text, suggestedReplies);
    }

    public static Reply plain(String text) {
        return new Reply(text, List.of());
    }
}
