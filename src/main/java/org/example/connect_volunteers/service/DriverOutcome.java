package org.example.connect_volunteers.service;

/**
 * Чем закончилась обработка одного сообщения.
 */
public enum DriverOutcome {

    /** Состояние сохранено, ответ отправлен (и анкета записана, если была) */
    PROCESSED,

    /** Сообщение пропущено: ни ответа, ни отправки анкеты */
    IGNORED,

    /** Состояние сохранено, но ответ до юзера не дошёл */
    REPLY_FAILED,

    /** Юзер подтвердил анкету, но в таблицу она не записалась */
    LEDGER_FAILED
}
