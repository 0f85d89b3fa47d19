package org.example.connect_volunteers.model;

/**
 * Шаги диалога.
 * <p>
 * IDLE → (SELECTING_PROVIDE_CATEGORY | SELECTING_REQUEST_CATEGORY) → COLLECTING_RECORD → IDLE
 */
public enum DialogueStep {

    // Ничего не заполняем, показываем главное меню
    IDLE,

    // Юзер хочет помочь, ждём выбор категории
    SELECTING_PROVIDE_CATEGORY,

    // Юзеру нужна помощь, ждём выбор категории
    SELECTING_REQUEST_CATEGORY,

    // Заполняем анкету по одному полю
    COLLECTING_RECORD
}
