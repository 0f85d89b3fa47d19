package org.example.connect_volunteers.model;

import java.util.Optional;

/**
 * Анкета, которую собираем у юзера.
 * <p>
 * Неизменяемая: на каждом шаге создаётся новый экземпляр с одним
 * дополнительным полем. Поле считается заполненным, если в нём непустая строка.
 * <p>
 * Заполняется строго по порядку {@link ContactField}: ПІБ → телефоны → адрес → комментарий.
 *
 * @param fullName     ПІБ
 * @param phoneNumbers контактные номера телефонов (одной строкой, как ввёл юзер)
 * @param address      адрес
 * @param comments     дополнительный комментарий ("-" если нечего добавить)
 */
public record ContactRecord(
        String fullName,
        String phoneNumbers,
        String address,
        String comments
) {

    /**
     * Пустая анкета (ни одно поле не заполнено).
     */
    public static ContactRecord empty() {
        return new ContactRecord(null, null, null, null);
    }

    /**
     * Анкета, у которой заполнено только ПІБ.
     */
    public static ContactRecord withFullName(String fullName) {
        return new ContactRecord(fullName, null, null, null);
    }

    public String get(ContactField field) {
        switch (field) {
            case FULL_NAME:
                return fullName;
            case PHONE_NUMBERS:
                return phoneNumbers;
            case ADDRESS:
                return address;
            case COMMENTS:
                return comments;
            default:
                throw new IllegalArgumentException("Неизвестное поле: " + field);
        }
    }

    public boolean isSet(ContactField field) {
        String value = get(field);
        return value != null && !value.isEmpty();
    }

    /**
     * Первое незаполненное поле (по порядку), или empty если анкета полная.
     */
    public Optional<ContactField> nextMissingField() {
        for (ContactField field : ContactField.values()) {
            if (!isSet(field)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public boolean isComplete() {
        return nextMissingField().isEmpty();
    }

    /**
     * Заполненные поля идут подряд с начала списка, без дырок.
     * Например (ПІБ, телефон) - ок, а (ПІБ, адрес) без телефона - нет.
     */
    public boolean isOrderedPrefix() {
        boolean gapSeen = false;
        for (ContactField field : ContactField.values()) {
            if (!isSet(field)) {
                gapSeen = true;
            } else if (gapSeen) {
                return false;
            }
        }
        return true;
    }

    /**
     * Вернуть новую анкету, в которой следующее по порядку поле = value.
     *
     * @throws IllegalStateException если анкета уже заполнена или в ней есть дырки
     */
    public ContactRecord withNext(String value) {
        if (!isOrderedPrefix()) {
            throw new IllegalStateException("Анкета заполнена не по порядку: " + this);
        }
        ContactField field = nextMissingField()
                .orElseThrow(() -> new IllegalStateException("Анкета уже заполнена"));
        switch (field) {
            case FULL_NAME:
                return new ContactRecord(value, phoneNumbers, address, comments);
            case PHONE_NUMBERS:
                return new ContactRecord(fullName, value, address, comments);
            case ADDRESS:
                return new ContactRecord(fullName, phoneNumbers, value, comments);
            case COMMENTS:
                return new ContactRecord(fullName, phoneNumbers, address, value);
            default:
                throw new IllegalArgumentException("Неизвестное поле: " + field);
        }
    }
}
