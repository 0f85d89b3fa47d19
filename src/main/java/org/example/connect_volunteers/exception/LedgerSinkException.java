package org.example.connect_volunteers.exception;

/**
 * Не удалось дописать заявку в таблицу волонтёров.
 */
public class LedgerSinkException extends RuntimeException {

    public LedgerSinkException(String message) {
        super(message);
    }

    public LedgerSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
