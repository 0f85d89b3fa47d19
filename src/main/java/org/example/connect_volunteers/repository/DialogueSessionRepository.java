package org.example.connect_volunteers.repository;

import jakarta.persistence.LockModeType;
import org.example.connect_volunteers.model.DialogueSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Репозиторий для таблицы dialogue_sessions.
 * <p>
 * Готовые методы из JpaRepository ({@code findById}, {@code save}, {@code delete}) + один свой:
 * чтение с блокировкой строки.
 *
 * @see org.example.connect_volunteers.model.DialogueSession
 * @see org.example.connect_volunteers.service.JpaDialogueStateStore
 */
@Repository
public interface DialogueSessionRepository extends JpaRepository<DialogueSession, Long> {

    /**
     * Найти сессию и заблокировать строку до конца транзакции.
     * <p>
     * SQL: {@code SELECT ... FROM dialogue_sessions WHERE chat_id = ? FOR UPDATE}
     * <p>
     * Второй инстанс бота, который захочет обновить ту же сессию, будет ждать, пока мы не закоммитим.
     *
     * @param chatId ID чата
     * @return сессия, или пусто если юзер в главном меню
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from DialogueSession s where s.chatId = :chatId")
    Optional<DialogueSession> findForUpdate(@Param("chatId") Long chatId);
}
