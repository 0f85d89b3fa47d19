package org.example.connect_volunteers.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.config.LedgerConfig;
import org.example.connect_volunteers.dialogue.CommitAction;
import org.example.connect_volunteers.dialogue.InboundEvent;
import org.example.connect_volunteers.dialogue.IntakeDialogue;
import org.example.connect_volunteers.dialogue.Transition;
import org.example.connect_volunteers.exception.StateStoreException;
import org.example.connect_volunteers.exception.TransportException;
import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.SessionKey;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Обработка одного входящего сообщения от начала до конца.
 * <p>
 * Порядок всегда один и тот же:
 * <ol>
 *   <li>прочитать состояние, посчитать переход и сохранить результат (атомарно, {@link DialogueStateStore#atomicUpdate})</li>
 *   <li>отправить ответ юзеру</li>
 *   <li>если юзер подтвердил анкету - дописать её в таблицу</li>
 * </ol>
 * Ошибки:
 * <ul>
 *   <li>хранилище упало - {@link StateStoreException} летит наверх, ничего не отправлено, шаг можно повторить;</li>
 *   <li>ответ не отправился - пишем в лог, переход заново НЕ выполняем (состояние уже сохранено);</li>
 *   <li>таблица не записалась - громко пишем в лог всю анкету, сессия всё равно остаётся в главном меню.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionDriver {

    private final DialogueStateStore stateStore;
    private final IntakeDialogue dialogue;
    private final ReplyTransport replyTransport;
    private final LedgerSink ledgerSink;
    private final LedgerConfig ledgerConfig;
    private final Clock clock;

    /**
     * Обработать сообщение.
     *
     * @param event входящее сообщение
     * @return что получилось
     * @throws StateStoreException если состояние не удалось прочитать или сохранить
     */
    public DriverOutcome handle(InboundEvent event) {
        SessionKey key = event.sessionKey();

        // Переход считаем под блокировкой ключа, чтобы два сообщения подряд не прочитали одно и то же состояние
        AtomicReference<Transition> applied = new AtomicReference<>();
        stateStore.atomicUpdate(key, current -> {
            Transition transition = dialogue.transition(current, event);
            applied.set(transition);
            return transition.nextState();
        });
        Transition transition = applied.get();
        if (transition == null) {
            throw new IllegalStateException("Хранилище не вызвало функцию перехода для " + key);
        }

        if (transition.reply().isEmpty() && transition.commit().isEmpty()) {
            log.debug("Сообщение пропущено: {}, step={}", key, transition.nextState().step());
            return DriverOutcome.IGNORED;
        }

        DriverOutcome outcome = DriverOutcome.PROCESSED;

        if (transition.reply().isPresent()) {
            try {
                replyTransport.send(key, transition.reply().get());
            } catch (TransportException e) {
                log.error("Ответ не отправлен (состояние уже сохранено, шаг не повторяем): {}, step={}",
                        key, transition.nextState().step(), e);
                outcome = DriverOutcome.REPLY_FAILED;
            }
        }

        if (transition.commit().isPresent()) {
            if (!commit(key, transition.commit().get())) {
                outcome = DriverOutcome.LEDGER_FAILED;
            }
        }

        return outcome;
    }

    /**
     * Записать подтверждённую анкету в таблицу.
     *
     * @return true если записали
     */
    private boolean commit(SessionKey key, CommitAction commit) {
        OffsetDateTime committedAt = OffsetDateTime.now(clock.withZone(ledgerConfig.getZoneOffset()));
        ContactRecord record = commit.record();
        try {
            ledgerSink.append(commit.category(), record, committedAt);
            log.info("Заявка отправлена волонтёрам: {}, category={}, committedAt={}",
                    key, commit.category(), committedAt);
            return true;
        } catch (RuntimeException e) {
            // Юзеру уже сказали "отправлено" - восстанавливать руками по этой строке лога.
            // Не только LedgerSinkException: любая ошибка записи попадает в этот лог
            log.error("!!! ЗАЯВКА НЕ ЗАПИСАНА В ТАБЛИЦУ !!! {}, category={}, fullName={}, phoneNumbers={}, "
                            + "address={}, comments={}, committedAt={}",
                    key, commit.category(), record.fullName(), record.phoneNumbers(),
                    record.address(), record.comments(), committedAt, e);
            return false;
        }
    }
}
