package org.example.connect_volunteers.model;

/**
 * Состояние диалога с одним юзером.
 * <p>
 * Шаг ({@link DialogueStep}) + данные, которые есть только у шага COLLECTING_RECORD:
 * <ul>
 *   <li>{@code category} - выбранная категория заявки</li>
 *   <li>{@code record} - анкета; null пока юзер не ввёл ПІБ</li>
 * </ul>
 * Значение неизменяемое, каждый переход возвращает новое состояние целиком.
 */
public record DialogueState(DialogueStep step, HelpCategory category, ContactRecord record) {

    private static final DialogueState IDLE = new DialogueState(DialogueStep.IDLE, null, null);
    private static final DialogueState SELECTING_PROVIDE =
            new DialogueState(DialogueStep.SELECTING_PROVIDE_CATEGORY, null, null);
    private static final DialogueState SELECTING_REQUEST =
            new DialogueState(DialogueStep.SELECTING_REQUEST_CATEGORY, null, null);

    public DialogueState {
        if (step == null) {
            throw new IllegalArgumentException("step не может быть null");
        }
        if (step == DialogueStep.COLLECTING_RECORD) {
            if (category == null) {
                throw new IllegalArgumentException("Для COLLECTING_RECORD нужна категория");
            }
        } else if (category != null || record != null) {
            throw new IllegalArgumentException("Категория и анкета есть только у COLLECTING_RECORD, а шаг " + step);
        }
    }

    public static DialogueState idle() {
        return IDLE;
    }

    public static DialogueState selectingProvideCategory() {
        return SELECTING_PROVIDE;
    }

    public static DialogueState selectingRequestCategory() {
        return SELECTING_REQUEST;
    }

    public static DialogueState collecting(HelpCategory category, ContactRecord record) {
        return new DialogueState(DialogueStep.COLLECTING_RECORD, category, record);
    }

    public boolean isIdle() {
        return step == DialogueStep.IDLE;
    }

    /**
     * Анкета заполнена полностью, ждём "Так" / "Ні".
     */
    public boolean isAwaitingConfirmation() {
        return step == DialogueStep.COLLECTING_RECORD && record != null && record.isComplete();
    }
}
