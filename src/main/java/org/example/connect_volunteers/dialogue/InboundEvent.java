package org.example.connect_volunteers.dialogue;

import org.example.connect_volunteers.model.SessionKey;

import java.util.Optional;

/**
 * Входящее сообщение от юзера.
 * <p>
 * Нас интересует только текст. Фото, стикеры, контакты и прочее приходят с пустым текстом.
 *
 * @param sessionKey чей это диалог
 * @param text       текст сообщения, или null если это не текст
 */
public record InboundEvent(SessionKey sessionKey, String text) {

    public InboundEvent {
        if (sessionKey == null) {
            throw new IllegalArgumentException("sessionKey не может быть null");
        }
    }

    public static InboundEvent text(SessionKey sessionKey, String text) {
        return new InboundEvent(sessionKey, text);
    }

    public static InboundEvent nonText(SessionKey sessionKey) {
        return new InboundEvent(sessionKey, null);
    }

    /**
     * Текст, если он есть и не пустой.
     */
    public Optional<String> textContent() {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(text);
    }
}
