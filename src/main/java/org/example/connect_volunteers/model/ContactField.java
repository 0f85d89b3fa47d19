package org.example.connect_volunteers.model;

/**
 * Поля анкеты в том порядке, в котором бот их спрашивает.
 */
public enum ContactField {
    FULL_NAME,
    PHONE_NUMBERS,
    ADDRESS,
    COMMENTS
}
