package org.example.connect_volunteers.service;

import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.exception.StateStoreException;
import org.example.connect_volunteers.model.DialogueSession;
import org.example.connect_volunteers.model.DialogueState;
import org.example.connect_volunteers.model.SessionKey;
import org.example.connect_volunteers.repository.DialogueSessionRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Хранилище состояний в PostgreSQL (таблица dialogue_sessions).
 * <p>
 * Как обеспечивается атомарность обновления одного ключа:
 * <ul>
 *   <li>внутри процесса - блокировка по ключу (фиксированный набор ReentrantLock, ключ → hash → замок);</li>
 *   <li>между инстансами - SELECT ... FOR UPDATE по строке + {@code @Version};</li>
 *   <li>чтение, переход и запись - в одной транзакции.</li>
 * </ul>
 * IDLE в таблице не храним: строка удаляется, как только диалог вернулся в главное меню.
 */
@Slf4j
@Service
public class JpaDialogueStateStore implements DialogueStateStore {

    // Количество замков. Разные ключи могут попасть на один замок - это просто лишнее ожидание.
    private static final int LOCK_STRIPES = 64;

    private final DialogueSessionRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public JpaDialogueStateStore(DialogueSessionRepository repository,
                                 PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public DialogueState load(SessionKey key) {
        try {
            return repository.findById(key.chatId())
                    .map(session -> toState(key, session))
                    .orElse(DialogueState.idle());
        } catch (DataAccessException e) {
            throw new StateStoreException("Не удалось прочитать состояние диалога: " + key, e);
        }
    }

    @Override
    public DialogueState atomicUpdate(SessionKey key, UnaryOperator<DialogueState> update) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            return transactionTemplate.execute(status -> updateInTransaction(key, update));
        } catch (DataAccessException | TransactionException e) {
            throw new StateStoreException("Не удалось обновить состояние диалога: " + key, e);
        } finally {
            lock.unlock();
        }
    }

    private DialogueState updateInTransaction(SessionKey key, UnaryOperator<DialogueState> update) {
        Optional<DialogueSession> existing = repository.findForUpdate(key.chatId());
        DialogueState current = existing
                .map(session -> toState(key, session))
                .orElse(DialogueState.idle());

        DialogueState next = update.apply(current);
        if (next == null) {
            throw new IllegalArgumentException("Функция перехода вернула null для " + key);
        }

        if (next.isIdle()) {
            existing.ifPresent(session -> {
                repository.delete(session);
                log.debug("Сессия завершена, строка удалена: {}", key);
            });
            return next;
        }

        if (existing.isPresent() && next.equals(current)) {
            // Ничего не поменялось - лишний UPDATE не нужен
            return next;
        }

        DialogueSession session = existing.orElseGet(() -> DialogueSession.newSession(key));
        session.apply(next);
        repository.save(session);
        log.debug("Состояние сохранено: {} → {}", key, next.step());
        return next;
    }

    /**
     * Строка из БД → состояние. Битая строка (например, COLLECTING_RECORD без категории) = IDLE.
     */
    private DialogueState toState(SessionKey key, DialogueSession session) {
        try {
            return session.toState();
        } catch (IllegalArgumentException e) {
            log.warn("Битая строка в dialogue_sessions, считаем сессию завершённой: {}, step={}, category={}",
                    key, session.getStep(), session.getCategory(), e);
            return DialogueState.idle();
        }
    }

    private ReentrantLock lockFor(SessionKey key) {
        return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
    }
}
