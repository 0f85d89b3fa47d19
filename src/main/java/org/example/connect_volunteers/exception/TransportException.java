package org.example.connect_volunteers.exception;

/**
 * Не удалось отправить ответ юзеру.
 * <p>
 * Состояние к этому моменту уже сохранено, поэтому переход заново не выполняется.
 * Повторить можно только саму отправку.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
