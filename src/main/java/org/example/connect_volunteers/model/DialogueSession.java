package org.example.connect_volunteers.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Сохранённое состояние диалога - Java представление таблицы dialogue_sessions.
 * <p>
 * Одна строка = один чат, который сейчас где-то посередине анкеты.
 * Если юзер в главном меню (IDLE), строки нет вообще: отсутствие строки и IDLE - одно и то же.
 * Поэтому бот переживает рестарт: анкета, заполненная наполовину, лежит в БД.
 */
@Entity
@Table(name = "dialogue_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DialogueSession {

    /**
     * Telegram ID чата - он же ключ сессии.
     */
    @Id
    @Column(name = "chat_id", nullable = false, updatable = false)
    private Long chatId;

    /**
     * Текущий шаг диалога.
     *
     * @Enumerated(EnumType.STRING) - храним 'COLLECTING_RECORD', а не 3
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "step", nullable = false, length = 64)
    private DialogueStep step;

    /**
     * Выбранная категория (только для COLLECTING_RECORD).
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "category", length = 64)
    private HelpCategory category;

    /**
     * true - юзер уже начал анкету (есть ПІБ), false - анкеты ещё нет.
     */
    @Column(name = "has_record", nullable = false)
    @Builder.Default
    private Boolean hasRecord = false;

    // Поля анкеты. Telegram не присылает сообщения длиннее 4096 символов.

    @Column(name = "full_name", length = 4096)
    private String fullName;

    @Column(name = "phone_numbers", length = 4096)
    private String phoneNumbers;

    @Column(name = "address", length = 4096)
    private String address;

    @Column(name = "comments", length = 4096)
    private String comments;

    /**
     * Версия строки для оптимистичной блокировки.
     * Если два инстанса бота одновременно обновят одну сессию - второй получит ошибку, а не затрёт первого.
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Новая (ещё не сохранённая) сессия для чата.
     */
    public static DialogueSession newSession(SessionKey key) {
        return DialogueSession.builder()
                .chatId(key.chatId())
                .step(DialogueStep.IDLE)
                .build();
    }

    /**
     * Собрать доменное состояние из строки БД.
     */
    public DialogueState toState() {
        if (step != DialogueStep.COLLECTING_RECORD) {
            switch (step) {
                case SELECTING_PROVIDE_CATEGORY:
                    return DialogueState.selectingProvideCategory();
                case SELECTING_REQUEST_CATEGORY:
                    return DialogueState.selectingRequestCategory();
                default:
                    return DialogueState.idle();
            }
        }
        ContactRecord record = Boolean.TRUE.equals(hasRecord)
                ? new ContactRecord(fullName, phoneNumbers, address, comments)
                : null;
        return DialogueState.collecting(category, record);
    }

    /**
     * Переписать строку целиком по доменному состоянию.
     */
    public void apply(DialogueState state) {
        this.step = state.step();
        this.category = state.category();
        ContactRecord record = state.record();
        this.hasRecord = record != null;
        this.fullName = record != null ? record.fullName() : null;
        this.phoneNumbers = record != null ? record.phoneNumbers() : null;
        this.address = record != null ? record.address() : null;
        this.comments = record != null ? record.comments() : null;
    }
}
