package org.example.connect_volunteers.dialogue;

import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.model.ContactField;
import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.DialogueState;
import org.example.connect_volunteers.model.HelpCategory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Логика диалога: (текущее состояние, сообщение) → (новое состояние, ответ, анкета на отправку).
 * <p>
 * Никакого I/O: ни БД, ни Telegram, ни таблиц. Одинаковый вход - одинаковый выход.
 * Сохранением и отправкой занимается {@link org.example.connect_volunteers.service.SessionDriver}.
 * <p>
 * Флоу:
 * <pre>
 * IDLE ──"Я можу допомогти"──→ SELECTING_PROVIDE_CATEGORY ──категория──┐
 *   └──"Я потребую допомоги"─→ SELECTING_REQUEST_CATEGORY ──категория──┤
 *                                                                      ↓
 *   COLLECTING_RECORD: ПІБ → телефоны → адрес → комментарий → "Так"/"Ні" → IDLE
 * </pre>
 * Любой незнакомый текст - повторяем вопрос текущего шага, состояние не меняем.
 */
@Slf4j
@Component
public class IntakeDialogue {

    /**
     * Один шаг диалога.
     *
     * @param current текущее состояние сессии (IDLE для новых юзеров)
     * @param event   входящее сообщение
     * @return что делать дальше
     */
    public Transition transition(DialogueState current, InboundEvent event) {
        Optional<String> text = event.textContent();
        if (text.isEmpty()) {
            // Фото, стикеры, пустые сообщения - молча пропускаем
            return Transition.ignored(current);
        }

        switch (current.step()) {
            case IDLE:
                return onIdle(current, text.get());
            case SELECTING_PROVIDE_CATEGORY:
                return onCategorySelection(current, HelpCategory.Direction.PROVIDING, text.get());
            case SELECTING_REQUEST_CATEGORY:
                return onCategorySelection(current, HelpCategory.Direction.REQUESTING, text.get());
            case COLLECTING_RECORD:
                return onCollecting(current, text.get());
            default:
                throw new IllegalStateException("Неизвестный шаг диалога: " + current.step());
        }
    }

    private Transition onIdle(DialogueState current, String text) {
        if (DialogueTexts.OFFER_HELP.equals(text)) {
            return Transition.to(DialogueState.selectingProvideCategory(), DialogueTexts.provideCategoryMenu());
        }
        if (DialogueTexts.REQUEST_HELP.equals(text)) {
            return Transition.to(DialogueState.selectingRequestCategory(), DialogueTexts.requestCategoryMenu());
        }
        log.debug("Главное меню: незнакомый текст, показываем меню ещё раз");
        return Transition.to(current, DialogueTexts.mainMenu());
    }

    private Transition onCategorySelection(DialogueState current, HelpCategory.Direction direction, String text) {
        Optional<HelpCategory> category = HelpCategory.fromLabel(direction, text);
        if (category.isEmpty()) {
            log.debug("Выбор категории ({}): незнакомый текст, показываем меню ещё раз", direction);
            return Transition.to(current, direction == HelpCategory.Direction.PROVIDING
                    ? DialogueTexts.provideCategoryMenu()
                    : DialogueTexts.requestCategoryMenu());
        }
        return Transition.to(DialogueState.collecting(category.get(), null), DialogueTexts.fullNamePrompt());
    }

    private Transition onCollecting(DialogueState current, String text) {
        HelpCategory category = current.category();
        ContactRecord record = current.record();

        // Первое сообщение после выбора категории - это ПІБ
        if (record == null) {
            return Transition.to(
                    DialogueState.collecting(category, ContactRecord.withFullName(text)),
                    DialogueTexts.phoneNumbersPrompt());
        }

        if (!record.isOrderedPrefix()) {
            // Сюда нельзя попасть через обычные переходы: только битая строка в БД
            log.warn("Анкета заполнена не по порядку, сбрасываем сессию: category={}, record={}", category, record);
            return Transition.silentReset();
        }

        Optional<ContactField> missing = record.nextMissingField();
        if (missing.isEmpty()) {
            return onConfirmation(current, text);
        }

        ContactRecord updated = record.withNext(text);
        DialogueState next = DialogueState.collecting(category, updated);
        switch (missing.get()) {
            case FULL_NAME:
                // Анкета без ПІБ должна быть null, а не пустой
                log.warn("Пустая анкета вместо null, сбрасываем сессию: category={}", category);
                return Transition.silentReset();
            case PHONE_NUMBERS:
                return Transition.to(next, DialogueTexts.addressPrompt());
            case ADDRESS:
                return Transition.to(next, DialogueTexts.commentsPrompt());
            case COMMENTS:
                return Transition.to(next, DialogueTexts.confirmationRequest(updated));
            default:
                throw new IllegalStateException("Неизвестное поле анкеты: " + missing.get());
        }
    }

    private Transition onConfirmation(DialogueState current, String text) {
        if (DialogueTexts.CONFIRM.equals(text)) {
            CommitAction commit = new CommitAction(current.category(), current.record());
            return Transition.commit(DialogueState.idle(), DialogueTexts.submitted(), commit);
        }
        if (DialogueTexts.DECLINE.equals(text)) {
            return Transition.to(DialogueState.idle(), DialogueTexts.cancelled());
        }
        return Transition.to(current, DialogueTexts.confirmationReprompt());
    }
}
