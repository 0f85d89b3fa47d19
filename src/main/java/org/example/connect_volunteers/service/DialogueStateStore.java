package org.example.connect_volunteers.service;

import org.example.connect_volunteers.exception.StateStoreException;
import org.example.connect_volunteers.model.DialogueState;
import org.example.connect_volunteers.model.SessionKey;

import java.util.function.UnaryOperator;

/**
 * Хранилище состояний диалогов (переживает рестарт бота).
 * <p>
 * Отдельных "load" + "save" для обновления нет специально: если юзер быстро отправит
 * два сообщения, оба прочитают одно и то же старое состояние, и одно поле анкеты потеряется.
 * Поэтому обновление - только через {@link #atomicUpdate}.
 */
public interface DialogueStateStore {

    /**
     * Прочитать состояние. Для незнакомого чата - IDLE.
     *
     * @throws StateStoreException если хранилище недоступно
     */
    DialogueState load(SessionKey key);

    /**
     * Прочитать состояние, применить к нему {@code update} и сохранить результат - как одно целое.
     * Пока идёт обновление одного ключа, другие обновления этого же ключа ждут.
     * Разные ключи друг друга не блокируют.
     *
     * @param key    чей диалог
     * @param update функция перехода; вызывается под блокировкой, не должна делать I/O
     * @return сохранённое новое состояние
     * @throws StateStoreException если не удалось прочитать или сохранить (ничего не изменилось)
     */
    DialogueState atomicUpdate(SessionKey key, UnaryOperator<DialogueState> update);
}
