package org.example.connect_volunteers.service;

import org.example.connect_volunteers.exception.LedgerSinkException;
import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.HelpCategory;

import java.time.OffsetDateTime;

/**
 * Журнал заявок для волонтёров (в проде - Google таблицы, по одной на категорию).
 * Только дописывает строки, ничего не читает и не меняет.
 */
public interface LedgerSink {

    /**
     * Дописать одну строку: ПІБ, телефоны, адрес, комментарий, время.
     *
     * @param category    категория - определяет таблицу
     * @param record      полностью заполненная анкета
     * @param committedAt когда юзер подтвердил отправку
     * @throws LedgerSinkException если строку записать не удалось
     */
    void append(HelpCategory category, ContactRecord record, OffsetDateTime committedAt);
}
