package org.example.connect_volunteers.model;

/**
 * Идентификатор одного диалога.
 * <p>
 * Бот работает только в личных чатах, поэтому один чат = один человек,
 * и ключом служит Telegram ID чата.
 *
 * @param chatId ID чата в Telegram
 */
public record SessionKey(long chatId) {

    public static SessionKey of(Long chatId) {
        if (chatId == null) {
            throw new IllegalArgumentException("chatId не может быть null");
        }
        return new SessionKey(chatId);
    }

    @Override
    public String toString() {
        return "chat:" + chatId;
    }
}
