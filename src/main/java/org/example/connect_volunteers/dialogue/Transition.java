package org.example.connect_volunteers.dialogue;

import org.example.connect_volunteers.model.DialogueState;

import java.util.Optional;

/**
 * Результат одного шага диалога: новое состояние, что ответить и нужно ли отправлять анкету.
 *
 * @param nextState следующее состояние
 * @param reply     ответ юзеру (пусто - молчим)
 * @param commit    анкета на отправку (только после "Так")
 */
public record Transition(DialogueState nextState, Optional<Reply> reply, Optional<CommitAction> commit) {

    public Transition {
        if (nextState == null || reply == null || commit == null) {
            throw new IllegalArgumentException("Поля Transition не могут быть null");
        }
    }

    public static Transition to(DialogueState nextState, Reply reply) {
        return new Transition(nextState, Optional.of(reply), Optional.empty());
    }

    public static Transition commit(DialogueState nextState, Reply reply, CommitAction commit) {
        return new Transition(nextState, Optional.of(reply), Optional.of(commit));
    }

    /**
     * Ничего не делаем: состояние то же, ответа нет.
     */
    public static Transition ignored(DialogueState current) {
        return new Transition(current, Optional.empty(), Optional.empty());
    }

    /**
     * Сбросить в главное меню молча.
     */
    public static Transition silentReset() {
        return new Transition(DialogueState.idle(), Optional.empty(), Optional.empty());
    }
}
