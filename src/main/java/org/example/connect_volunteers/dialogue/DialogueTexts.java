package org.example.connect_volunteers.dialogue;

import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.HelpCategory;

import java.util.List;

/**
 * Все тексты и кнопки бота в одном месте.
 * <p>
 * Бот общается по-украински. Тексты кнопок одновременно являются командами:
 * Telegram присылает нажатую кнопку как обычное сообщение с этим текстом.
 */
public final class DialogueTexts {

    // ============================================
    // ГЛАВНОЕ МЕНЮ
    // ============================================

    public static final String OFFER_HELP = "Я можу допомогти";
    public static final String REQUEST_HELP = "Я потребую допомоги";

    public static final List<String> MAIN_MENU = List.of(OFFER_HELP, REQUEST_HELP);

    static final String MAIN_MENU_PROMPT = "Оберіть \"" + OFFER_HELP + "\" чи \"" + REQUEST_HELP + "\"";

    // ============================================
    // ВЫБОР КАТЕГОРИИ
    // ============================================

    static final String PROVIDE_CATEGORY_PROMPT =
            "Наразі в нас є можливість координувати водіїв, що допомогають з евакуацією, "
                    + "надавати гуманітарну допомогу, та ми завжди відкриті до корисних контактів. "
                    + "Оберіть один з варіантів.";

    static final String REQUEST_CATEGORY_PROMPT =
            "Наразі ми координуємо запити на евакуацію та гуманітарну допомогу.";

    // ============================================
    // АНКЕТА
    // ============================================

    static final String FULL_NAME_PROMPT = "Ваше ПІБ? (призвіще, імʼя, побатькові)";
    static final String PHONE_NUMBERS_PROMPT = "Контактні номери телефону?";
    static final String ADDRESS_PROMPT = "Адреса?";

    /** Что прислать, если комментария нет */
    public static final String NO_COMMENT_PLACEHOLDER = "-";

    static final String COMMENTS_PROMPT =
            "Додатковий коментар? (якшо нема, відправте повідомлення з текстом \"" + NO_COMMENT_PLACEHOLDER + "\")";

    // ============================================
    // ПОДТВЕРЖДЕНИЕ
    // ============================================

    public static final String CONFIRM = "Так, відправити інформацію волонтерам";
    public static final String DECLINE = "Ні, почати спочатку";

    public static final List<String> CONFIRMATION_MENU = List.of(CONFIRM, DECLINE);

    static final String CONFIRMATION_REPROMPT =
            "Ви бажаєте відправити запит волонтерам? (відправте лише \"" + CONFIRM + "\" або \"" + DECLINE + "\")";

    static final String SUBMITTED =
            "Дякуємо! Вашу інформацію відправлено волонтерам.\n\n"
                    + "Чекайте коли з вами звʼяжуться. Також можете надіслати іншу заявку.";

    static final String CANCELLED = "Добре, вашу заявку скасовано. Можете почати знову.";

    private DialogueTexts() {
    }

    static Reply mainMenu() {
        return Reply.withKeyboard(MAIN_MENU_PROMPT, MAIN_MENU);
    }

    static Reply provideCategoryMenu() {
        return Reply.withKeyboard(PROVIDE_CATEGORY_PROMPT, HelpCategory.labelsOf(HelpCategory.Direction.PROVIDING));
    }

    static Reply requestCategoryMenu() {
        return Reply.withKeyboard(REQUEST_CATEGORY_PROMPT, HelpCategory.labelsOf(HelpCategory.Direction.REQUESTING));
    }

    static Reply fullNamePrompt() {
        return Reply.plain(FULL_NAME_PROMPT);
    }

    static Reply phoneNumbersPrompt() {
        return Reply.plain(PHONE_NUMBERS_PROMPT);
    }

    static Reply addressPrompt() {
        return Reply.plain(ADDRESS_PROMPT);
    }

    static Reply commentsPrompt() {
        return Reply.plain(COMMENTS_PROMPT);
    }

    static Reply confirmationRequest(ContactRecord record) {
        return Reply.withKeyboard(summary(record), CONFIRMATION_MENU);
    }

    static Reply confirmationReprompt() {
        return Reply.withKeyboard(CONFIRMATION_REPROMPT, CONFIRMATION_MENU);
    }

    static Reply submitted() {
        return Reply.withKeyboard(SUBMITTED, MAIN_MENU);
    }

    static Reply cancelled() {
        return Reply.withKeyboard(CANCELLED, MAIN_MENU);
    }

    /**
     * Сводка по анкете перед отправкой.
     */
    static String summary(ContactRecord record) {
        return "Ось таку інформацію ми зібрали:\n"
                + "ПІБ: " + record.fullName() + "\n"
                + "Контактні номери телефону: " + record.phoneNumbers() + "\n"
                + "Адреса: " + record.address() + "\n"
                + "Коментар: " + record.comments() + "\n\n"
                + "Ви бажаєте відправити цей запит волонтерам?";
    }
}
