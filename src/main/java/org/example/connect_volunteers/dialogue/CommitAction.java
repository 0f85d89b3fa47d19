package org.example.connect_volunteers.dialogue;

import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.HelpCategory;

/**
 * Сигнал "анкета подтверждена, отправь её волонтёрам".
 *
 * @param category категория - определяет, в какую таблицу писать
 * @param record   полностью заполненная анкета
 */
public record CommitAction(HelpCategory category, ContactRecord record) {

    public CommitAction {
        if (category == null || record == null || !record.isComplete()) {
            throw new IllegalArgumentException("Отправить можно только полную анкету с категорией");
        }
    }
}
