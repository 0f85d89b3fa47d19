package org.example.connect_volunteers.exception;

/**
 * Не удалось прочитать или сохранить состояние диалога.
 * <p>
 * Событие считается необработанным: ответ не отправлен, состояние не изменилось,
 * весь шаг можно безопасно повторить.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
